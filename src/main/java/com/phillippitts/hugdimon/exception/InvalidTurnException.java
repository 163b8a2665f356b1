package com.phillippitts.hugdimon.exception;

/**
 * Thrown when an inbound turn is malformed (missing or blank message, bad field types).
 * Rejected at the boundary before any session is touched.
 */
public class InvalidTurnException extends HugDimonException {

    private final String field;

    public InvalidTurnException(String field, String reason) {
        super("Invalid turn input (" + field + "): " + reason);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
