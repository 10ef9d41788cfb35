package com.phillippitts.recallahead.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for recall search orchestration.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Lookups dispatched to the recall service and their latency</li>
 *   <li>Cache hits</li>
 *   <li>Cancelled and stale (superseded) lookups</li>
 *   <li>Failures by error category</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class OrchestratorMetrics {

    static final String METRIC_PREFIX = "recallahead.search";

    private final MeterRegistry registry;

    public OrchestratorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementDispatch() {
        Counter.builder(METRIC_PREFIX + ".dispatch")
                .description("Number of lookups sent to the recall service")
                .register(registry)
                .increment();
    }

    public void incrementCacheHit() {
        Counter.builder(METRIC_PREFIX + ".cache.hit")
                .description("Number of lookups answered from the result cache")
                .register(registry)
                .increment();
    }

    public void incrementStale() {
        Counter.builder(METRIC_PREFIX + ".stale")
                .description("Number of responses discarded because a newer lookup had started")
                .register(registry)
                .increment();
    }

    public void incrementCancelled() {
        Counter.builder(METRIC_PREFIX + ".cancelled")
                .description("Number of in-flight lookups cancelled")
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure category (exception simple name)
     */
    public void incrementFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed lookups")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param durationNanos time from dispatch to applied result
     */
    public void recordLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time from dispatch to applied recall result")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
