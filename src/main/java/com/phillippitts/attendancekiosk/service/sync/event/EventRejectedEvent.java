package com.phillippitts.attendancekiosk.service.sync.event;

import java.time.Instant;

/**
 * Published when the backend permanently rejects an attendance event. The event stays in the
 * store as FAILED for manual review.
 */
public record EventRejectedEvent(
        String eventId,
        String personId,
        int statusCode,
        String reason,
        Instant at
) {}
