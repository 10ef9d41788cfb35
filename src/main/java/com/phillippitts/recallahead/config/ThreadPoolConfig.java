package com.phillippitts.recallahead.config;

import com.phillippitts.recallahead.config.properties.ThreadPoolProperties;
import com.phillippitts.recallahead.service.eventloop.EventLoop;
import com.phillippitts.recallahead.service.eventloop.TaskSchedulerEventLoop;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;

/**
 * Configuration for the single-threaded recall event loop.
 *
 * <p>Every orchestrator, debounce timer and fetch completion runs on this one thread, so
 * orchestrator state needs no locking. Loop properties are configured via
 * {@link ThreadPoolProperties} ({@code threadpool.loop.*}).
 */
@Configuration
public class ThreadPoolConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolConfig.class);

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the scheduler backing the recall event loop.
     *
     * <p>Pool size is fixed at one. Cancelled debounce timers are removed from the queue
     * immediately. Failures escaping a task are logged and do not stop the loop.
     *
     * @return scheduler with a single worker thread
     */
    @Bean(name = "recallEventLoopScheduler")
    public ThreadPoolTaskScheduler recallEventLoopScheduler() {
        ThreadPoolProperties.LoopProperties loopProps = threadPoolProperties.getLoop();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix(loopProps.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setAwaitTerminationSeconds(loopProps.getAwaitTerminationSeconds());
        scheduler.setErrorHandler(t -> LOG.error("Unhandled failure on recall event loop", t));
        return scheduler;
    }

    /**
     * Wraps the scheduler as the recall event loop.
     *
     * <p>MDC propagation: copies Log4j2 ThreadContext from the submitting thread so that
     * request and surface ids follow the work onto the loop, for immediate and delayed tasks.
     */
    @Bean
    public EventLoop recallEventLoop(ThreadPoolTaskScheduler recallEventLoopScheduler) {
        return new TaskSchedulerEventLoop(recallEventLoopScheduler, mdcPropagatingDecorator());
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
