package com.phillippitts.recallahead.service.surface;

import com.phillippitts.recallahead.domain.MemoryItem;
import com.phillippitts.recallahead.service.orchestration.OrchestratorOptions;
import com.phillippitts.recallahead.service.orchestration.OrchestratorState;

/**
 * State and options of a surface, captured together on the event loop.
 */
public record SurfaceSnapshot(
        String surfaceId,
        String provider,
        OrchestratorState<MemoryItem> state,
        OrchestratorOptions options
) {}
