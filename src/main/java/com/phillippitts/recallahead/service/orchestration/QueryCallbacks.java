package com.phillippitts.recallahead.service.orchestration;

import java.util.List;

/**
 * Lifecycle notifications emitted by a {@link QueryOrchestrator}. All methods default to no-ops.
 *
 * <p>Callbacks are invoked on the event loop thread. Implementations must not block.
 *
 * @param <T> result item type
 */
public interface QueryCallbacks<T> {

    /** Fired right before the fetcher is invoked. Not fired for cache-only hits. */
    default void onStart(String query) {
    }

    /**
     * Fired for a cache hit ({@code fromCache = true}) and for every live result that is still
     * current when it arrives ({@code fromCache = false}).
     */
    default void onSuccess(String query, List<T> result, boolean fromCache) {
    }

    /** Fired when a current lookup fails for a reason other than cancellation. */
    default void onError(String query, Throwable error) {
    }

    /** Fired once per dispatched, still-current lookup after the in-flight slot is cleared. */
    default void onFinally(String query) {
    }

    static <T> QueryCallbacks<T> noop() {
        return new QueryCallbacks<>() { };
    }
}
