package com.phillippitts.recallahead.service.eventloop;

import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link EventLoop} backed by a single-threaded Spring {@link ThreadPoolTaskScheduler}.
 *
 * <p>The scheduler must be configured with a pool size of one; see
 * {@link com.phillippitts.recallahead.config.ThreadPoolConfig#recallEventLoopScheduler()}.
 * Every submitted or scheduled task is wrapped with the {@link TaskDecorator} at submission
 * time, on the submitting thread.
 */
public final class TaskSchedulerEventLoop implements EventLoop {

    private final ThreadPoolTaskScheduler scheduler;
    private final TaskDecorator decorator;

    public TaskSchedulerEventLoop(ThreadPoolTaskScheduler scheduler, TaskDecorator decorator) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.decorator = Objects.requireNonNull(decorator, "decorator must not be null");
    }

    @Override
    public void execute(Runnable command) {
        scheduler.execute(decorator.decorate(command));
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        return scheduler.schedule(decorator.decorate(task), clock().instant().plus(delay));
    }

    @Override
    public Clock clock() {
        return scheduler.getClock();
    }
}
