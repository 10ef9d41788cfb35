package com.phillippitts.recallahead.config.orchestration;

import com.phillippitts.recallahead.config.properties.InputTriggerProperties;
import com.phillippitts.recallahead.config.properties.OrchestratorProperties;
import com.phillippitts.recallahead.service.client.MemorySearchClient;
import com.phillippitts.recallahead.service.eventloop.EventLoop;
import com.phillippitts.recallahead.service.orchestration.OrchestratorMetricsPublisher;
import com.phillippitts.recallahead.service.surface.InputSurfaceFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the factory that assembles per-surface orchestrators.
 */
@Configuration
public class OrchestrationConfig {

    @Bean
    public InputSurfaceFactory inputSurfaceFactory(MemorySearchClient memorySearchClient,
                                                   EventLoop recallEventLoop,
                                                   ApplicationEventPublisher publisher,
                                                   OrchestratorMetricsPublisher metricsPublisher,
                                                   OrchestratorProperties orchestratorProperties,
                                                   InputTriggerProperties triggerProperties) {
        return new InputSurfaceFactory(memorySearchClient, recallEventLoop, publisher, metricsPublisher,
                orchestratorProperties, triggerProperties);
    }
}
