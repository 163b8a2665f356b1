package com.phillippitts.hugdimon.exception;

/**
 * Base exception for all HugDimon application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class HugDimonException extends RuntimeException {

    public HugDimonException(String message) {
        super(message);
    }

    public HugDimonException(String message, Throwable cause) {
        super(message, cause);
    }

    public HugDimonException(Throwable cause) {
        super(cause);
    }
}
