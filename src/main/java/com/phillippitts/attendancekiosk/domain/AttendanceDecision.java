package com.phillippitts.attendancekiosk.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of a track resolving to RECOGNIZED or UNKNOWN. Produced at most once per track.
 *
 * @param trackId   resolved track
 * @param personId  recognized person, or {@code null} for UNKNOWN
 * @param outcome   recorded, suppressed by cooldown, or unknown
 * @param decidedAt capture time of the frame that resolved the track
 * @param window    attendance window of {@code decidedAt}
 */
public record AttendanceDecision(
        String trackId,
        String personId,
        DecisionOutcome outcome,
        Instant decidedAt,
        AttendanceWindow window
) {

    public AttendanceDecision {
        Objects.requireNonNull(trackId, "trackId must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(decidedAt, "decidedAt must not be null");
        Objects.requireNonNull(window, "window must not be null");
        if (outcome != DecisionOutcome.UNKNOWN && personId == null) {
            throw new IllegalArgumentException(outcome + " decision requires a personId");
        }
    }
}
