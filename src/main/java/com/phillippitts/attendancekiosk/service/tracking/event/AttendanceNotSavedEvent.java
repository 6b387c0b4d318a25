package com.phillippitts.attendancekiosk.service.tracking.event;

import java.time.Instant;

/**
 * Published when a decided attendance event could not be written to the local store
 * after all retries. Shown to the user as "attendance not saved".
 *
 * <p>PII note: carries the person id only; no face data.
 */
public record AttendanceNotSavedEvent(
        String trackId,
        String personId,
        String reason,
        Instant at
) {
    public AttendanceNotSavedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
