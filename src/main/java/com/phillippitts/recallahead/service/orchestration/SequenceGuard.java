package com.phillippitts.recallahead.service.orchestration;

/**
 * Monotonic counter identifying the most recent lookup.
 *
 * <p>Each dispatch captures {@link #next()}; when its response arrives, {@link #isCurrent(long)}
 * tells whether a newer dispatch has happened in between. Only current responses may touch
 * orchestrator state. Confined to the event loop.
 */
public final class SequenceGuard {

    private long current;

    /**
     * Advances the counter.
     *
     * @return the new current value
     */
    public long next() {
        return ++current;
    }

    public boolean isCurrent(long captured) {
        return captured == current;
    }

    public long current() {
        return current;
    }
}
