package com.phillippitts.attendancekiosk.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Delivery cadence, retry budget and backoff for the sync manager.
 */
@ConfigurationProperties(prefix = "kiosk.sync")
@Validated
public class SyncProperties {

    /** Sync pass interval while online. */
    @NotNull
    private Duration interval = Duration.ofSeconds(30);

    /** Delivery attempts per event before it is skipped for the current retry round. */
    @Positive(message = "Max attempts must be positive")
    private int maxAttempts = 5;

    @NotNull
    private Duration backoffBase = Duration.ofSeconds(2);

    @NotNull
    private Duration backoffCap = Duration.ofSeconds(60);

    /** Time an in-flight pass gets to finish on shutdown. */
    @NotNull
    private Duration shutdownGrace = Duration.ofSeconds(10);

    /** Synced events older than this are purged. */
    @NotNull
    private Duration retention = Duration.ofDays(30);

    public Duration getInterval() {
        return interval;
    }

    public void setInterval(Duration interval) {
        this.interval = interval;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getBackoffBase() {
        return backoffBase;
    }

    public void setBackoffBase(Duration backoffBase) {
        this.backoffBase = backoffBase;
    }

    public Duration getBackoffCap() {
        return backoffCap;
    }

    public void setBackoffCap(Duration backoffCap) {
        this.backoffCap = backoffCap;
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    public void setShutdownGrace(Duration shutdownGrace) {
        this.shutdownGrace = shutdownGrace;
    }

    public Duration getRetention() {
        return retention;
    }

    public void setRetention(Duration retention) {
        this.retention = retention;
    }
}
