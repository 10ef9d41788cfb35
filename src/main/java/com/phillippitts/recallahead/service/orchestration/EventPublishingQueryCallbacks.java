package com.phillippitts.recallahead.service.orchestration;

import com.phillippitts.recallahead.domain.MemoryItem;
import com.phillippitts.recallahead.service.orchestration.event.RecallFailedEvent;
import com.phillippitts.recallahead.service.orchestration.event.RecallFinishedEvent;
import com.phillippitts.recallahead.service.orchestration.event.RecallResultsEvent;
import com.phillippitts.recallahead.service.orchestration.event.RecallStartedEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Bridges orchestrator callbacks of one surface onto Spring application events.
 *
 * <p>Once {@link #detach()} is called nothing more is published, so a lookup that completes
 * after its surface was closed stays silent.
 *
 * @see com.phillippitts.recallahead.service.events.RecallEventsListener
 */
public final class EventPublishingQueryCallbacks implements QueryCallbacks<MemoryItem> {

    private final String surfaceId;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private volatile boolean detached;

    public EventPublishingQueryCallbacks(String surfaceId, ApplicationEventPublisher publisher, Clock clock) {
        this.surfaceId = Objects.requireNonNull(surfaceId, "surfaceId must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void onStart(String query) {
        publish(new RecallStartedEvent(surfaceId, query, clock.instant()));
    }

    @Override
    public void onSuccess(String query, List<MemoryItem> result, boolean fromCache) {
        publish(new RecallResultsEvent(surfaceId, query, result, fromCache, clock.instant()));
    }

    @Override
    public void onError(String query, Throwable error) {
        String reason = error.getClass().getSimpleName()
                + (error.getMessage() == null ? "" : ": " + error.getMessage());
        publish(new RecallFailedEvent(surfaceId, query, reason, clock.instant()));
    }

    @Override
    public void onFinally(String query) {
        publish(new RecallFinishedEvent(surfaceId, query, clock.instant()));
    }

    /**
     * Stops publishing; used when the owning surface is closed.
     */
    public void detach() {
        detached = true;
    }

    private void publish(Object event) {
        if (!detached) {
            publisher.publishEvent(event);
        }
    }
}
