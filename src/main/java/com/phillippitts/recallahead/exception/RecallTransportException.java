package com.phillippitts.recallahead.exception;

/**
 * Thrown when the remote recall service cannot be reached or answers with a non-success status.
 */
public class RecallTransportException extends RecallAheadException {

    /** Status code reported when no HTTP response was received at all. */
    public static final int NO_STATUS = -1;

    private final int statusCode;

    public RecallTransportException(String message, int statusCode) {
        super(message + " (status: " + statusCode + ")");
        this.statusCode = statusCode;
    }

    public RecallTransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_STATUS;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
