package com.phillippitts.recallahead.service.surface;

import com.phillippitts.recallahead.domain.MemoryItem;
import com.phillippitts.recallahead.service.orchestration.EventPublishingQueryCallbacks;
import com.phillippitts.recallahead.service.orchestration.QueryOrchestrator;
import com.phillippitts.recallahead.service.trigger.InputTriggerGate;

/**
 * One registered text field with its private orchestrator and trigger gate.
 *
 * @param surfaceId    caller-chosen identifier of the text field
 * @param provider     chat provider hosting the field; its own memories are excluded from results
 * @param orchestrator orchestrator owned by this surface
 * @param gate         trigger gate feeding the orchestrator
 * @param callbacks    event bridge of the orchestrator, detached when the surface closes
 */
public record InputSurface(
        String surfaceId,
        String provider,
        QueryOrchestrator<MemoryItem> orchestrator,
        InputTriggerGate gate,
        EventPublishingQueryCallbacks callbacks
) {}
