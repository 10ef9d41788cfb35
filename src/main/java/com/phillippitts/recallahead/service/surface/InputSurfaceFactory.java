package com.phillippitts.recallahead.service.surface;

import com.phillippitts.recallahead.config.properties.InputTriggerProperties;
import com.phillippitts.recallahead.config.properties.OrchestratorProperties;
import com.phillippitts.recallahead.domain.MemoryItem;
import com.phillippitts.recallahead.service.client.MemorySearchClient;
import com.phillippitts.recallahead.service.eventloop.EventLoop;
import com.phillippitts.recallahead.service.orchestration.EventPublishingQueryCallbacks;
import com.phillippitts.recallahead.service.orchestration.OrchestratorMetricsPublisher;
import com.phillippitts.recallahead.service.orchestration.QueryOrchestrator;
import com.phillippitts.recallahead.service.orchestration.QueryOrchestratorBuilder;
import com.phillippitts.recallahead.service.trigger.InputTriggerGate;
import com.phillippitts.recallahead.service.trigger.InputTriggerPolicy;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.Objects;

/**
 * Assembles a fresh {@link InputSurface}: HTTP fetcher bound to the surface's provider,
 * event-publishing callbacks, options from configuration and a trigger gate.
 *
 * <p>Not annotated as {@code @Component}; see
 * {@link com.phillippitts.recallahead.config.orchestration.OrchestrationConfig} for bean wiring.
 */
public class InputSurfaceFactory {

    private final MemorySearchClient client;
    private final EventLoop eventLoop;
    private final ApplicationEventPublisher publisher;
    private final OrchestratorMetricsPublisher metricsPublisher;
    private final OrchestratorProperties orchestratorProperties;
    private final InputTriggerProperties triggerProperties;
    private final InputTriggerPolicy triggerPolicy;

    public InputSurfaceFactory(MemorySearchClient client,
                               EventLoop eventLoop,
                               ApplicationEventPublisher publisher,
                               OrchestratorMetricsPublisher metricsPublisher,
                               OrchestratorProperties orchestratorProperties,
                               InputTriggerProperties triggerProperties) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metricsPublisher = Objects.requireNonNull(metricsPublisher, "metricsPublisher must not be null");
        this.orchestratorProperties = Objects.requireNonNull(orchestratorProperties,
                "orchestratorProperties must not be null");
        this.triggerProperties = Objects.requireNonNull(triggerProperties, "triggerProperties must not be null");
        this.triggerPolicy = new InputTriggerPolicy(triggerProperties.getMinChars(),
                triggerProperties.getMinWords(), triggerProperties.getMinWordsWithoutPunctuation());
    }

    /**
     * @param surfaceId identifier of the text field
     * @param provider  hosting provider, may be null
     * @return a new surface; nothing is shared with previously created surfaces
     */
    public InputSurface create(String surfaceId, String provider) {
        EventPublishingQueryCallbacks callbacks =
                new EventPublishingQueryCallbacks(surfaceId, publisher, eventLoop.clock());
        QueryOrchestrator<MemoryItem> orchestrator = QueryOrchestratorBuilder.<MemoryItem>builder()
                .name(surfaceId)
                .fetcher(client.forProvider(provider))
                .eventLoop(eventLoop)
                .callbacks(callbacks)
                .options(orchestratorProperties.toOptions())
                .metricsPublisher(metricsPublisher)
                .build();

        InputTriggerGate gate = new InputTriggerGate(orchestrator, triggerPolicy,
                triggerProperties.isHeuristicEnabled(),
                Duration.ofMillis(triggerProperties.getMinIntervalMs()),
                eventLoop.clock());

        return new InputSurface(surfaceId, provider, orchestrator, gate, callbacks);
    }
}
