package com.phillippitts.recallahead.presentation.dto;

import com.phillippitts.recallahead.domain.MemoryItem;
import com.phillippitts.recallahead.service.orchestration.OrchestratorOptions;
import com.phillippitts.recallahead.service.orchestration.OrchestratorState;
import com.phillippitts.recallahead.service.surface.SurfaceSnapshot;

import java.util.List;

/**
 * JSON view of a surface snapshot. Durations are rendered in milliseconds.
 */
public record SurfaceView(
        String surfaceId,
        String provider,
        String latestText,
        String lastCompletedQuery,
        List<MemoryItem> lastResult,
        String inFlightQuery,
        boolean inFlight,
        int cacheSize,
        OptionsView options
) {

    public static SurfaceView from(SurfaceSnapshot snapshot) {
        OrchestratorState<MemoryItem> state = snapshot.state();
        return new SurfaceView(
                snapshot.surfaceId(),
                snapshot.provider(),
                state.latestText(),
                state.lastCompletedQuery(),
                state.lastResult(),
                state.inFlightQuery(),
                state.inFlight(),
                state.cacheSize(),
                OptionsView.from(snapshot.options()));
    }

    public record OptionsView(
            int minLength,
            long debounceMs,
            long cacheTtlMs,
            boolean useCache,
            boolean refreshOnCache,
            int nearDuplicateMaxDelta
    ) {
        static OptionsView from(OrchestratorOptions options) {
            return new OptionsView(options.minLength(), options.debounce().toMillis(),
                    options.cacheTtl().toMillis(), options.useCache(), options.refreshOnCache(),
                    options.nearDuplicateMaxDelta());
        }
    }
}
