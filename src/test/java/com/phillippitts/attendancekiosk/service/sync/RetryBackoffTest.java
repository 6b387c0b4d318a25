package com.phillippitts.attendancekiosk.service.sync;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryBackoffTest {

    private static final Instant T0 = Instant.parse("2026-10-19T08:00:00Z");

    private final RetryBackoff backoff = new RetryBackoff(Duration.ofSeconds(2), Duration.ofSeconds(60));

    @Test
    void doublesUpToCap() {
        assertThat(backoff.delayFor(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(backoff.delayFor(2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(backoff.delayFor(5)).isEqualTo(Duration.ofSeconds(32));
        assertThat(backoff.delayFor(6)).isEqualTo(Duration.ofSeconds(60));
        assertThat(backoff.delayFor(100)).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void notReadyUntilDelayElapsed() {
        assertThat(backoff.isReady(T0)).isTrue();

        Duration delay = backoff.recordFailure(T0);

        assertThat(delay).isEqualTo(Duration.ofSeconds(2));
        assertThat(backoff.isReady(T0.plusMillis(1999))).isFalse();
        assertThat(backoff.isReady(T0.plusSeconds(2))).isTrue();
        assertThat(backoff.nextAttemptAt()).contains(T0.plusSeconds(2));
    }

    @Test
    void resetReturnsToBase() {
        backoff.recordFailure(T0);
        backoff.recordFailure(T0);

        backoff.reset();

        assertThat(backoff.consecutiveFailures()).isZero();
        assertThat(backoff.isReady(T0)).isTrue();
        assertThat(backoff.recordFailure(T0)).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void rejectsCapBelowBase() {
        assertThatThrownBy(() -> new RetryBackoff(Duration.ofSeconds(10), Duration.ofSeconds(5)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryBackoff(Duration.ZERO, Duration.ofSeconds(5)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
