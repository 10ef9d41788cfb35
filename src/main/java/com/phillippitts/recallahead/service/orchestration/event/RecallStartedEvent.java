package com.phillippitts.recallahead.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted when a surface dispatches a live lookup to the recall service.
 *
 * @param surfaceId input surface that issued the lookup
 * @param query     normalized query
 * @param timestamp dispatch time
 */
public record RecallStartedEvent(String surfaceId, String query, Instant timestamp) {}
