package com.phillippitts.recallahead.service.orchestration;

import com.phillippitts.recallahead.service.eventloop.EventLoop;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * Trailing-edge debounce: each {@link #arm} replaces the pending timer, so only the last call of
 * a burst fires. Confined to the event loop.
 */
public final class DebounceScheduler {

    private final EventLoop eventLoop;
    private ScheduledFuture<?> pending;

    public DebounceScheduler(EventLoop eventLoop) {
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop must not be null");
    }

    /**
     * Cancels any pending timer and schedules {@code action} after {@code delay}.
     */
    public void arm(Runnable action, Duration delay) {
        disarm();
        pending = eventLoop.schedule(() -> {
            pending = null;
            action.run();
        }, delay);
    }

    /**
     * @return {@code true} if a pending timer was cancelled
     */
    public boolean disarm() {
        if (pending == null) {
            return false;
        }
        pending.cancel(false);
        pending = null;
        return true;
    }

    public boolean isArmed() {
        return pending != null;
    }
}
