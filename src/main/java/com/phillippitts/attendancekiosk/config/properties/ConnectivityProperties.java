package com.phillippitts.attendancekiosk.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Health probe cadence for the connectivity monitor.
 */
@ConfigurationProperties(prefix = "kiosk.connectivity")
@Validated
public class ConnectivityProperties {

    /** Probe interval while the backend is unreachable. */
    @NotNull
    private Duration offlineProbeInterval = Duration.ofSeconds(5);

    /** Keep-alive probe interval while online. */
    @NotNull
    private Duration onlineProbeInterval = Duration.ofSeconds(30);

    /** Timeout of a single probe; a timeout counts as offline. */
    @NotNull
    private Duration probeTimeout = Duration.ofSeconds(3);

    public Duration getOfflineProbeInterval() {
        return offlineProbeInterval;
    }

    public void setOfflineProbeInterval(Duration offlineProbeInterval) {
        this.offlineProbeInterval = offlineProbeInterval;
    }

    public Duration getOnlineProbeInterval() {
        return onlineProbeInterval;
    }

    public void setOnlineProbeInterval(Duration onlineProbeInterval) {
        this.onlineProbeInterval = onlineProbeInterval;
    }

    public Duration getProbeTimeout() {
        return probeTimeout;
    }

    public void setProbeTimeout(Duration probeTimeout) {
        this.probeTimeout = probeTimeout;
    }
}
