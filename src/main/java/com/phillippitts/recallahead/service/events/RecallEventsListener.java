package com.phillippitts.recallahead.service.events;

import com.phillippitts.recallahead.service.orchestration.event.RecallFailedEvent;
import com.phillippitts.recallahead.service.orchestration.event.RecallResultsEvent;
import com.phillippitts.recallahead.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized logging of recall outcomes. Privacy-safe and throttled to avoid log spam while
 * the remote service is down.
 *
 * <p>Failure warnings are throttled per failure kind (exception name), not per surface, so the
 * throttle map stays bounded however many surfaces callers open. Entries older than the
 * throttle window are evicted.
 */
@Component
class RecallEventsListener {
    private static final Logger LOG = LogManager.getLogger(RecallEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Clock clock;

    RecallEventsListener() {
        this(Clock.systemUTC());
    }

    RecallEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onResults(RecallResultsEvent e) {
        LOG.info("Recall results for surface={}: {} memories for {}{}",
                e.surfaceId(), e.items().size(), LogSanitizer.preview(e.query()),
                e.fromCache() ? " (cached)" : "");
    }

    @EventListener
    void onFailure(RecallFailedEvent e) {
        String key = "recall-failure-" + failureKind(e.reason());
        if (shouldLog(key)) {
            LOG.warn("Recall lookup failed for surface={}: {}. Check recall.client.* settings "
                    + "and service availability.", e.surfaceId(), e.reason());
        }
    }

    private static String failureKind(String reason) {
        int colon = reason.indexOf(':');
        return colon < 0 ? reason : reason.substring(0, colon);
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        lastLog.values().removeIf(logged -> Duration.between(logged, now).compareTo(THROTTLE) > 0);
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }

    int trackedKeys() {
        return lastLog.size();
    }
}
