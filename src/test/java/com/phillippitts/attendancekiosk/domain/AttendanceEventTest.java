package com.phillippitts.attendancekiosk.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AttendanceEventTest {

    private static final AttendanceWindow MORNING =
            new AttendanceWindow(LocalDate.of(2026, 10, 19), "morning-in", AttendanceKind.CHECK_IN);

    @Test
    void createsPendingEventWithFreshId() {
        Instant at = Instant.parse("2026-10-19T07:30:00.123456789Z");

        AttendanceEvent event = AttendanceEvent.create("alice", "kiosk-01", at, MORNING);

        assertThat(UUID.fromString(event.eventId())).isNotNull();
        assertThat(event.syncStatus()).isEqualTo(SyncStatus.PENDING);
        assertThat(event.attempts()).isZero();
        assertThat(event.lastError()).isNull();
        assertThat(event.rejected()).isFalse();
        assertThat(event.kind()).isEqualTo(AttendanceKind.CHECK_IN);
        assertThat(event.windowKey()).isEqualTo("2026-10-19/morning-in");
        assertThat(event.occurredAt()).isEqualTo(Instant.parse("2026-10-19T07:30:00.123Z"));
    }

    @Test
    void eachEventGetsItsOwnId() {
        Instant at = Instant.parse("2026-10-19T07:30:00Z");

        AttendanceEvent first = AttendanceEvent.create("alice", "kiosk-01", at, MORNING);
        AttendanceEvent second = AttendanceEvent.create("alice", "kiosk-01", at, MORNING);

        assertThat(first.eventId()).isNotEqualTo(second.eventId());
    }

    @Test
    void unknownFaceHasNoPerson() {
        AttendanceEvent event = AttendanceEvent.create(null, "kiosk-01", Instant.EPOCH, MORNING);

        assertThat(event.isUnknownFace()).isTrue();
        assertThat(event.person()).isEmpty();
    }

    @Test
    void rejectsNegativeAttempts() {
        assertThatThrownBy(() -> new AttendanceEvent("e-1", "alice", "kiosk-01", Instant.EPOCH,
                AttendanceKind.CHECK_IN, "k", SyncStatus.PENDING, -1, null, false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
