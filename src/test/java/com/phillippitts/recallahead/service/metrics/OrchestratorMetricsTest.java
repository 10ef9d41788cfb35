package com.phillippitts.recallahead.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class OrchestratorMetricsTest {

    private MeterRegistry registry;
    private OrchestratorMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new OrchestratorMetrics(registry);
    }

    @Test
    void shouldRecordLatency() {
        long durationNanos = TimeUnit.MILLISECONDS.toNanos(120);

        metrics.recordLatency(durationNanos);

        Timer timer = registry.find("recallahead.search.latency").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.NANOSECONDS)).isEqualTo(durationNanos);
    }

    @Test
    void shouldAccumulateCounters() {
        metrics.incrementDispatch();
        metrics.incrementDispatch();
        metrics.incrementCacheHit();
        metrics.incrementStale();
        metrics.incrementCancelled();

        assertThat(registry.find("recallahead.search.dispatch").counter().count()).isEqualTo(2.0);
        assertThat(registry.find("recallahead.search.cache.hit").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("recallahead.search.stale").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("recallahead.search.cancelled").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldTagFailuresByReason() {
        metrics.incrementFailure("RecallTransportException");
        metrics.incrementFailure("RecallTransportException");
        metrics.incrementFailure("IllegalStateException");

        Counter transport = registry.find("recallahead.search.failure")
                .tag("reason", "RecallTransportException")
                .counter();
        Counter other = registry.find("recallahead.search.failure")
                .tag("reason", "IllegalStateException")
                .counter();

        assertThat(transport).isNotNull();
        assertThat(transport.count()).isEqualTo(2.0);
        assertThat(other.count()).isEqualTo(1.0);
    }
}
