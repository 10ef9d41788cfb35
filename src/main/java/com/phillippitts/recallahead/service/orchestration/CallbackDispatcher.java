package com.phillippitts.recallahead.service.orchestration;

import com.phillippitts.recallahead.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Invokes caller callbacks and contains their failures.
 *
 * <p>A throwing callback is logged and otherwise ignored so that it cannot leave the
 * orchestrator with a half-applied state transition.
 */
final class CallbackDispatcher<T> {

    private static final Logger LOG = LogManager.getLogger(CallbackDispatcher.class);

    private final QueryCallbacks<T> callbacks;

    CallbackDispatcher(QueryCallbacks<T> callbacks) {
        this.callbacks = Objects.requireNonNull(callbacks, "callbacks must not be null");
    }

    void onStart(String query) {
        guard("onStart", query, () -> callbacks.onStart(query));
    }

    void onSuccess(String query, List<T> result, boolean fromCache) {
        guard("onSuccess", query, () -> callbacks.onSuccess(query, result, fromCache));
    }

    void onError(String query, Throwable error) {
        guard("onError", query, () -> callbacks.onError(query, error));
    }

    void onFinally(String query) {
        guard("onFinally", query, () -> callbacks.onFinally(query));
    }

    private static void guard(String callback, String query, Runnable invocation) {
        try {
            invocation.run();
        } catch (RuntimeException e) {
            LOG.warn("{} callback threw for query {}", callback, LogSanitizer.preview(query), e);
        }
    }
}
