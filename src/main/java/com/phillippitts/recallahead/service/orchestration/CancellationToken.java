package com.phillippitts.recallahead.service.orchestration;

import com.phillippitts.recallahead.exception.QueryCancelledException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal handed to a {@link RecallFetcher} with each lookup.
 *
 * <p>The orchestrator can only signal the token. The fetcher is responsible for observing it,
 * either by polling {@link #isCancellationRequested()} / {@link #throwIfCancellationRequested(String)}
 * or by registering a listener via {@link #onCancel(Runnable)} that aborts the underlying
 * transport call.
 *
 * <p><b>Thread Safety:</b> Safe for use from any thread. Each registered listener runs at most once.
 *
 * @since 1.0
 */
public final class CancellationToken {

    private static final Logger LOG = LogManager.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /**
     * Signals cancellation and runs all registered listeners on the calling thread.
     *
     * @return {@code true} if this call performed the cancellation, {@code false} if already cancelled
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable listener : listeners) {
            runOnce(listener);
        }
        return true;
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * @param query query the caller is working on, used in the exception message
     * @throws QueryCancelledException if cancellation has been requested
     */
    public void throwIfCancellationRequested(String query) {
        if (cancelled.get()) {
            throw new QueryCancelledException(query);
        }
    }

    /**
     * Registers a listener invoked when the token is cancelled. If the token is already
     * cancelled the listener runs immediately on the calling thread.
     *
     * @param listener action that aborts the caller's work
     */
    public void onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get()) {
            runOnce(listener);
        }
    }

    // Removal is the claim: whichever thread removes the listener runs it.
    private void runOnce(Runnable listener) {
        if (!listeners.remove(listener)) {
            return;
        }
        try {
            listener.run();
        } catch (RuntimeException e) {
            LOG.warn("Cancellation listener failed: {}", e.toString());
        }
    }
}
