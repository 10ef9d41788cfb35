package com.phillippitts.recallahead.exception;

/**
 * Thrown when an operation targets an input surface that was never opened or has been closed.
 */
public class SurfaceNotFoundException extends RecallAheadException {

    private final String surfaceId;

    public SurfaceNotFoundException(String surfaceId) {
        super("Input surface not registered: " + surfaceId);
        this.surfaceId = surfaceId;
    }

    public String getSurfaceId() {
        return surfaceId;
    }
}
