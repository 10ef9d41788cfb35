package com.phillippitts.recallahead.exception;

/**
 * Base exception for all RecallAhead application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class RecallAheadException extends RuntimeException {

    public RecallAheadException(String message) {
        super(message);
    }

    public RecallAheadException(String message, Throwable cause) {
        super(message, cause);
    }

    public RecallAheadException(Throwable cause) {
        super(cause);
    }
}
