package com.phillippitts.recallahead.service.orchestration;

/**
 * Tracks the single lookup an orchestrator may have in flight, with its cancellation token.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → IN_FLIGHT (via start)
 * IN_FLIGHT → IDLE (via cancelActive or finish)
 * </pre>
 *
 * <p>Confined to the event loop; not thread-safe.
 *
 * @since 1.0
 */
public final class InFlightTracker {

    private String query;
    private CancellationToken token;

    /**
     * Marks {@code newQuery} as in flight with a fresh token. Any active lookup must have been
     * cancelled with {@link #cancelActive()} first.
     *
     * @return the token to hand to the fetcher
     * @throws IllegalStateException if another lookup is still tracked
     */
    public CancellationToken start(String newQuery) {
        if (query != null) {
            throw new IllegalStateException("Lookup already in flight: " + query);
        }
        query = newQuery;
        token = new CancellationToken();
        return token;
    }

    /**
     * Signals the active token and clears the slot.
     *
     * @return the cancelled query, or null if nothing was in flight
     */
    public String cancelActive() {
        String cancelled = query;
        if (token != null) {
            token.cancel();
        }
        query = null;
        token = null;
        return cancelled;
    }

    /**
     * Clears the slot without signalling cancellation (lookup completed).
     */
    public void finish() {
        query = null;
        token = null;
    }

    public boolean isActive() {
        return query != null;
    }

    public boolean isTracking(String candidate) {
        return query != null && query.equals(candidate);
    }

    /**
     * @return query in flight, or null
     */
    public String query() {
        return query;
    }
}
