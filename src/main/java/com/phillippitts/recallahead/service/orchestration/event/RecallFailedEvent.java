package com.phillippitts.recallahead.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted when a current lookup fails for a reason other than cancellation.
 *
 * @param surfaceId input surface that issued the lookup
 * @param query     normalized query
 * @param reason    short failure description (exception type and message)
 * @param timestamp failure time
 */
public record RecallFailedEvent(String surfaceId, String query, String reason, Instant timestamp) {}
