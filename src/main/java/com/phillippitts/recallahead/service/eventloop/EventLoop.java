package com.phillippitts.recallahead.service.eventloop;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;

/**
 * Single logical thread on which orchestrator state is mutated.
 *
 * <p>Tasks handed to {@link #execute(Runnable)} and {@link #schedule(Runnable, Duration)} run one
 * at a time, in submission order for immediate tasks and in deadline order for delayed ones. Code
 * running inside a task may therefore touch orchestrator fields without locking.
 *
 * <p>Production code uses {@link TaskSchedulerEventLoop}; tests use a virtual-time implementation
 * so debounce and cache expiry can be driven deterministically.
 *
 * @since 1.0
 */
public interface EventLoop extends Executor {

    /**
     * Runs {@code task} on the loop once {@code delay} has elapsed.
     *
     * @param task  work to run
     * @param delay delay from now, zero for "next turn"
     * @return handle whose {@code cancel(false)} prevents a not-yet-started task from running
     */
    ScheduledFuture<?> schedule(Runnable task, Duration delay);

    /**
     * Clock used for cache timestamps. Shares its time base with {@link #schedule}.
     */
    Clock clock();
}
