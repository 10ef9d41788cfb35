package com.phillippitts.recallahead.service.orchestration;

import com.phillippitts.recallahead.service.metrics.OrchestratorMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Centralizes metrics recording for orchestrators so the orchestration code stays free of
 * Micrometer types.
 *
 * <p><b>Null Safety:</b> All methods tolerate a missing {@link OrchestratorMetrics}, allowing
 * orchestrators to run without metrics in tests.
 *
 * @since 1.0
 * @see OrchestratorMetrics
 */
@Component
public final class OrchestratorMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(OrchestratorMetricsPublisher.class);

    /**
     * Singleton no-op instance for tests and builder defaults.
     */
    public static final OrchestratorMetricsPublisher NOOP = new OrchestratorMetricsPublisher(null);

    private final OrchestratorMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public OrchestratorMetricsPublisher(OrchestratorMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("OrchestratorMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordDispatch() {
        if (metrics != null) {
            metrics.incrementDispatch();
        }
    }

    public void recordCacheHit() {
        if (metrics != null) {
            metrics.incrementCacheHit();
        }
    }

    public void recordStale() {
        if (metrics != null) {
            metrics.incrementStale();
        }
    }

    public void recordCancelled() {
        if (metrics != null) {
            metrics.incrementCancelled();
        }
    }

    /**
     * @param durationNanos time from dispatch to applied result
     */
    public void recordSuccess(long durationNanos) {
        if (metrics != null) {
            metrics.recordLatency(durationNanos);
        }
    }

    /**
     * @param errorCategory simple class name of the failure
     */
    public void recordFailure(String errorCategory) {
        if (metrics != null) {
            metrics.incrementFailure(errorCategory);
        }
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
