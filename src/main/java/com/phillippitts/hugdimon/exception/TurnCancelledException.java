package com.phillippitts.hugdimon.exception;

/**
 * Thrown inside a turn when the handling thread is interrupted (caller went away).
 * Propagates out of the session lock scope so nothing is committed.
 */
public class TurnCancelledException extends HugDimonException {

    public TurnCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
