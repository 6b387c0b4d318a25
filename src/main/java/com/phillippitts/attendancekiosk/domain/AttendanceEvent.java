package com.phillippitts.attendancekiosk.domain;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable unit of record for one attendance decision.
 *
 * <p>{@code eventId} is the idempotency key the backend deduplicates on; it is generated once
 * and resent unchanged on every retry. {@code occurredAt} is the frame capture time and is
 * never altered after creation.
 *
 * @param eventId    client-generated UUID
 * @param personId   recognized person, or {@code null} for an unknown face
 * @param deviceId   id of this kiosk
 * @param occurredAt capture time, millisecond precision
 * @param kind       check-in or check-out, from the attendance window
 * @param windowKey  attendance window the decision fell into (e.g. {@code 2026-10-19/morning-in})
 * @param syncStatus delivery state
 * @param attempts   delivery attempts so far
 * @param lastError  last delivery error, or {@code null}
 * @param rejected   true when the backend permanently rejected the event
 */
public record AttendanceEvent(
        String eventId,
        String personId,
        String deviceId,
        Instant occurredAt,
        AttendanceKind kind,
        String windowKey,
        SyncStatus syncStatus,
        int attempts,
        String lastError,
        boolean rejected
) {

    public AttendanceEvent {
        Objects.requireNonNull(eventId, "eventId must not be null");
        Objects.requireNonNull(deviceId, "deviceId must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(windowKey, "windowKey must not be null");
        Objects.requireNonNull(syncStatus, "syncStatus must not be null");
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be non-negative, got: " + attempts);
        }
    }

    /**
     * Creates a new pending event with a fresh eventId.
     *
     * @param personId   recognized person, or {@code null} for an unknown face
     * @param deviceId   id of this kiosk
     * @param occurredAt capture time (truncated to milliseconds)
     * @param window     resolved attendance window
     * @return a new {@link SyncStatus#PENDING} event
     */
    public static AttendanceEvent create(String personId, String deviceId, Instant occurredAt,
                                         AttendanceWindow window) {
        return new AttendanceEvent(
                UUID.randomUUID().toString(),
                personId,
                deviceId,
                occurredAt.truncatedTo(ChronoUnit.MILLIS),
                window.kind(),
                window.key(),
                SyncStatus.PENDING,
                0,
                null,
                false
        );
    }

    public Optional<String> person() {
        return Optional.ofNullable(personId);
    }

    public boolean isUnknownFace() {
        return personId == null;
    }
}
