package com.phillippitts.recallahead.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted once per dispatched lookup after it settled, whatever the outcome. UI layers use it
 * to end loading indicators.
 *
 * @param surfaceId input surface that issued the lookup
 * @param query     normalized query
 * @param timestamp settle time
 */
public record RecallFinishedEvent(String surfaceId, String query, Instant timestamp) {}
