package com.phillippitts.attendancekiosk.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Debounce and lifetime settings for the face track state machine.
 */
@ConfigurationProperties(prefix = "kiosk.tracking")
@Validated
public class TrackingProperties {

    /** Number of most recent observations voted on while verifying. */
    @Positive(message = "Verify window size must be positive")
    private int verifyWindowSize = 3;

    /** Votes one person needs within the window to be recognized. */
    @Positive(message = "Required agreement must be positive")
    private int requiredAgreement = 2;

    /** Minimum confidence for a detection to count as a vote. */
    @DecimalMin(value = "0.0", message = "Verify threshold must be >= 0.0")
    @DecimalMax(value = "1.0", message = "Verify threshold must be <= 1.0")
    private double verifyThreshold = 0.8;

    /** How long a track may stay unresolved before it becomes UNKNOWN. */
    @NotNull
    private Duration verifyTimeout = Duration.ofSeconds(2);

    /** How long a track may go unreported before it expires. */
    @NotNull
    private Duration trackExpiry = Duration.ofMillis(1500);

    /** Maximum concurrently tracked faces used for decisioning. */
    @Positive(message = "Max tracks must be positive")
    private int maxTracks = 5;

    public int getVerifyWindowSize() {
        return verifyWindowSize;
    }

    public void setVerifyWindowSize(int verifyWindowSize) {
        this.verifyWindowSize = verifyWindowSize;
    }

    public int getRequiredAgreement() {
        return requiredAgreement;
    }

    public void setRequiredAgreement(int requiredAgreement) {
        this.requiredAgreement = requiredAgreement;
    }

    public double getVerifyThreshold() {
        return verifyThreshold;
    }

    public void setVerifyThreshold(double verifyThreshold) {
        this.verifyThreshold = verifyThreshold;
    }

    public Duration getVerifyTimeout() {
        return verifyTimeout;
    }

    public void setVerifyTimeout(Duration verifyTimeout) {
        this.verifyTimeout = verifyTimeout;
    }

    public Duration getTrackExpiry() {
        return trackExpiry;
    }

    public void setTrackExpiry(Duration trackExpiry) {
        this.trackExpiry = trackExpiry;
    }

    public int getMaxTracks() {
        return maxTracks;
    }

    public void setMaxTracks(int maxTracks) {
        this.maxTracks = maxTracks;
    }
}
