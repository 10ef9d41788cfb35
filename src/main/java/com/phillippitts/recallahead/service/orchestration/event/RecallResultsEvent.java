package com.phillippitts.recallahead.service.orchestration.event;

import com.phillippitts.recallahead.domain.MemoryItem;

import java.time.Instant;
import java.util.List;

/**
 * Emitted when results for a surface are ready for rendering (e.g. a notification badge with
 * the number of memories found).
 *
 * @param surfaceId input surface the results belong to
 * @param query     normalized query
 * @param items     results, possibly empty
 * @param fromCache whether the results came from the surface's cache
 * @param timestamp when the results were delivered
 */
public record RecallResultsEvent(
        String surfaceId,
        String query,
        List<MemoryItem> items,
        boolean fromCache,
        Instant timestamp
) {}
