package com.phillippitts.attendancekiosk.service.tracking.event;

import com.phillippitts.attendancekiosk.domain.DecisionOutcome;

import java.time.Instant;

/**
 * Emitted once per track when it resolves, for bounding-box color and greeting collaborators.
 *
 * @param trackId  resolved track
 * @param personId recognized person, or {@code null} for an unknown face
 * @param outcome  recorded, suppressed by cooldown, or unknown
 * @param eventId  id of the stored attendance event, or {@code null} when none was created
 * @param at       capture time of the resolving frame
 */
public record DecisionEmittedEvent(
        String trackId,
        String personId,
        DecisionOutcome outcome,
        String eventId,
        Instant at
) {}
