package com.phillippitts.attendancekiosk.service.tracking;

import com.phillippitts.attendancekiosk.domain.AttendanceDecision;
import com.phillippitts.attendancekiosk.domain.AttendanceEvent;
import com.phillippitts.attendancekiosk.domain.DecisionOutcome;
import com.phillippitts.attendancekiosk.exception.EventStoreException;
import com.phillippitts.attendancekiosk.service.metrics.AttendanceMetrics;
import com.phillippitts.attendancekiosk.service.store.AttendanceEventStore;
import com.phillippitts.attendancekiosk.service.tracking.event.AttendanceNotSavedEvent;
import com.phillippitts.attendancekiosk.service.tracking.event.DecisionEmittedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;
import java.util.Optional;

/**
 * Persists track decisions as attendance events and announces them.
 *
 * <p>RECORDED and UNKNOWN decisions become a new {@link AttendanceEvent} appended to the store;
 * SUPPRESSED decisions are only announced. A failed append is retried {@code appendRetries}
 * times. When the event still cannot be stored the person's cooldown is released, so the next
 * track can record again, and an {@link AttendanceNotSavedEvent} is published.
 *
 * <p>Runs on the decisioning path right after {@link FaceTrackStateMachine#process}.
 */
public class DecisionRecorder {

    private static final Logger LOG = LogManager.getLogger(DecisionRecorder.class);

    private final AttendanceEventStore store;
    private final FaceTrackStateMachine stateMachine;
    private final ApplicationEventPublisher publisher;
    private final AttendanceMetrics metrics;
    private final String deviceId;
    private final int appendRetries;

    public DecisionRecorder(AttendanceEventStore store,
                            FaceTrackStateMachine stateMachine,
                            ApplicationEventPublisher publisher,
                            AttendanceMetrics metrics,
                            String deviceId,
                            int appendRetries) {
        this.store = Objects.requireNonNull(store, "store");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        if (appendRetries < 0) {
            throw new IllegalArgumentException("appendRetries must be >= 0, got: " + appendRetries);
        }
        this.appendRetries = appendRetries;
    }

    /**
     * Stores and announces one decision.
     *
     * @return the stored event, or empty when the decision creates none or could not be stored
     */
    public Optional<AttendanceEvent> record(AttendanceDecision decision) {
        Objects.requireNonNull(decision, "decision");
        metrics.recordDecision(decision.outcome());
        if (!decision.outcome().createsEvent()) {
            announce(decision, null);
            return Optional.empty();
        }

        AttendanceEvent event = AttendanceEvent.create(
                decision.personId(), deviceId, decision.decidedAt(), decision.window());
        EventStoreException failure = null;
        for (int attempt = 0; attempt <= appendRetries; attempt++) {
            try {
                store.append(event);
                metrics.recordStored(event);
                LOG.info("Stored {} event {} for {} in {}", event.kind(), event.eventId(),
                        event.isUnknownFace() ? "unknown face" : "person " + event.personId(), event.windowKey());
                announce(decision, event.eventId());
                return Optional.of(event);
            } catch (EventStoreException e) {
                failure = e;
                LOG.warn("Append of event {} failed (attempt {}/{}): {}",
                        event.eventId(), attempt + 1, appendRetries + 1, e.getMessage());
            }
        }

        LOG.error("Attendance not saved for track {} (person={}); local store unavailable",
                decision.trackId(), decision.personId(), failure);
        if (decision.outcome() == DecisionOutcome.RECORDED) {
            stateMachine.releaseCooldown(decision.personId(), decision.window());
        }
        metrics.recordNotSaved();
        publisher.publishEvent(new AttendanceNotSavedEvent(
                decision.trackId(), decision.personId(), failure.getMessage(), decision.decidedAt()));
        announce(decision, null);
        return Optional.empty();
    }

    private void announce(AttendanceDecision decision, String eventId) {
        publisher.publishEvent(new DecisionEmittedEvent(
                decision.trackId(), decision.personId(), decision.outcome(), eventId, decision.decidedAt()));
    }
}
