package com.phillippitts.recallahead.service.orchestration;

import java.util.List;

/**
 * Read-only snapshot of a {@link QueryOrchestrator}, taken on the event loop.
 *
 * @param latestText         raw text of the most recent {@code setText}/{@code runImmediate}
 * @param lastCompletedQuery last query whose live result was applied, empty if none
 * @param lastResult         that result, or null before the first live success
 * @param inFlightQuery      query currently being fetched, or null
 * @param inFlight           whether a lookup is in flight
 * @param cacheSize          number of cache entries, including expired ones not yet read
 * @param <T> result item type
 */
public record OrchestratorState<T>(
        String latestText,
        String lastCompletedQuery,
        List<T> lastResult,
        String inFlightQuery,
        boolean inFlight,
        int cacheSize
) {
}
