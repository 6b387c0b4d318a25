package com.phillippitts.attendancekiosk.service.tracking;

import com.phillippitts.attendancekiosk.domain.AttendanceKind;
import com.phillippitts.attendancekiosk.domain.AttendanceWindow;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class PersonCooldownRegistryTest {

    private static final LocalDate DAY = LocalDate.of(2026, 10, 19);
    private static final AttendanceWindow MORNING = new AttendanceWindow(DAY, "morning-in", AttendanceKind.CHECK_IN);
    private static final AttendanceWindow AFTERNOON = new AttendanceWindow(DAY, "afternoon-out", AttendanceKind.CHECK_OUT);
    private static final Instant T0 = Instant.parse("2026-10-19T08:00:00Z");

    private final PersonCooldownRegistry registry = new PersonCooldownRegistry(Duration.ofHours(12));

    @Test
    void activeWithinSameWindow() {
        registry.record("P1", MORNING, T0);

        assertThat(registry.isActive("P1", MORNING, T0.plusSeconds(60))).isTrue();
        assertThat(registry.isActive("P2", MORNING, T0.plusSeconds(60))).isFalse();
    }

    @Test
    void inactiveInAnotherWindow() {
        registry.record("P1", MORNING, T0);

        assertThat(registry.isActive("P1", AFTERNOON, T0.plus(Duration.ofHours(5)))).isFalse();
    }

    @Test
    void expiresAfterCooldownDuration() {
        PersonCooldownRegistry shortRegistry = new PersonCooldownRegistry(Duration.ofMinutes(10));
        shortRegistry.record("P1", MORNING, T0);

        assertThat(shortRegistry.isActive("P1", MORNING, T0.plus(Duration.ofMinutes(9)))).isTrue();
        assertThat(shortRegistry.isActive("P1", MORNING, T0.plus(Duration.ofMinutes(10)))).isFalse();
    }

    @Test
    void releaseOnlyDropsMatchingWindow() {
        registry.record("P1", AFTERNOON, T0);

        registry.release("P1", MORNING.key());
        assertThat(registry.get("P1")).isPresent();

        registry.release("P1", AFTERNOON.key());
        assertThat(registry.get("P1")).isEmpty();
        assertThat(registry.size()).isZero();
    }
}
