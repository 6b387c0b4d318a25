package com.phillippitts.attendancekiosk.service.sync;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Exponential delay between delivery attempts after transient failures.
 *
 * <p>The n-th consecutive failure delays the next attempt by {@code base * 2^(n-1)}, capped at
 * {@code cap}. A success or a connectivity recovery resets it to base.
 *
 * <p><b>Thread Safety:</b> All methods are synchronized; sync passes and connectivity
 * listeners run on different threads.
 */
public class RetryBackoff {

    private final Duration base;
    private final Duration cap;

    private int consecutiveFailures;
    private Instant notBefore;

    public RetryBackoff(Duration base, Duration cap) {
        this.base = Objects.requireNonNull(base, "base");
        this.cap = Objects.requireNonNull(cap, "cap");
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("base must be positive, got: " + base);
        }
        if (cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("cap " + cap + " must not be below base " + base);
        }
    }

    /**
     * Records one more transient failure.
     *
     * @return delay before the next attempt is allowed
     */
    public synchronized Duration recordFailure(Instant now) {
        consecutiveFailures++;
        Duration delay = delayFor(consecutiveFailures);
        notBefore = now.plus(delay);
        return delay;
    }

    public synchronized boolean isReady(Instant now) {
        return notBefore == null || !now.isBefore(notBefore);
    }

    public synchronized void reset() {
        consecutiveFailures = 0;
        notBefore = null;
    }

    public synchronized Optional<Instant> nextAttemptAt() {
        return Optional.ofNullable(notBefore);
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    /**
     * Delay after {@code failures} consecutive failures.
     */
    Duration delayFor(int failures) {
        if (failures <= 0) {
            return Duration.ZERO;
        }
        // bounded shift; the cap is reached long before
        int exponent = Math.min(failures - 1, 30);
        Duration delay = base.multipliedBy(1L << exponent);
        return delay.compareTo(cap) > 0 ? cap : delay;
    }
}
