package com.phillippitts.attendancekiosk.config.pipeline;

import com.phillippitts.attendancekiosk.config.properties.AttendanceProperties;
import com.phillippitts.attendancekiosk.config.properties.BackendProperties;
import com.phillippitts.attendancekiosk.config.properties.ConnectivityProperties;
import com.phillippitts.attendancekiosk.config.properties.SyncProperties;
import com.phillippitts.attendancekiosk.config.properties.TrackingProperties;
import com.phillippitts.attendancekiosk.exception.InvalidConfigurationException;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalTime;
import java.util.HashSet;
import java.util.Set;

/**
 * Cross-field checks of the pipeline configuration at startup, to fail fast with
 * actionable messages. Single-field ranges are covered by bean validation on the properties.
 */
@Component
class PipelineConfigurationValidator {

    private final TrackingProperties tracking;
    private final AttendanceProperties attendance;
    private final SyncProperties sync;
    private final ConnectivityProperties connectivity;
    private final BackendProperties backend;

    PipelineConfigurationValidator(TrackingProperties tracking,
                                   AttendanceProperties attendance,
                                   SyncProperties sync,
                                   ConnectivityProperties connectivity,
                                   BackendProperties backend) {
        this.tracking = tracking;
        this.attendance = attendance;
        this.sync = sync;
        this.connectivity = connectivity;
        this.backend = backend;
    }

    @PostConstruct
    void validate() {
        validateTracking();
        validateWindows();
        validateSync();
        validateConnectivity();
        validateBackend();
    }

    private void validateTracking() {
        int window = tracking.getVerifyWindowSize();
        int required = tracking.getRequiredAgreement();
        if (required > window) {
            throw new InvalidConfigurationException("kiosk.tracking.required-agreement",
                    "must not exceed verify-window-size (" + window + "), got: " + required);
        }
        // Two persons must never both reach agreement within one window
        if (required * 2 <= window) {
            throw new InvalidConfigurationException("kiosk.tracking.required-agreement",
                    "must be a strict majority of verify-window-size (" + window + "), got: " + required);
        }
        requirePositive("kiosk.tracking.verify-timeout", tracking.getVerifyTimeout());
        requirePositive("kiosk.tracking.track-expiry", tracking.getTrackExpiry());
    }

    private void validateWindows() {
        try {
            attendance.zoneId();
        } catch (DateTimeException e) {
            throw new InvalidConfigurationException("kiosk.attendance.zone",
                    "unknown time zone '" + attendance.getZone() + "'");
        }
        if (attendance.getCooldown().isNegative()) {
            throw new InvalidConfigurationException("kiosk.attendance.cooldown",
                    "must not be negative, got: " + attendance.getCooldown());
        }
        Set<String> names = new HashSet<>();
        Set<LocalTime> starts = new HashSet<>();
        for (AttendanceProperties.Window w : attendance.getWindows()) {
            if (!names.add(w.getName())) {
                throw new InvalidConfigurationException("kiosk.attendance.windows",
                        "duplicate window name '" + w.getName() + "'");
            }
            if (!starts.add(w.getStart())) {
                throw new InvalidConfigurationException("kiosk.attendance.windows",
                        "two windows start at " + w.getStart());
            }
        }
        if (!starts.contains(LocalTime.MIDNIGHT)) {
            throw new InvalidConfigurationException("kiosk.attendance.windows",
                    "one window must start at 00:00 so every time of day has a window");
        }
    }

    private void validateSync() {
        requirePositive("kiosk.sync.interval", sync.getInterval());
        requirePositive("kiosk.sync.backoff-base", sync.getBackoffBase());
        requirePositive("kiosk.sync.retention", sync.getRetention());
        if (sync.getBackoffCap().compareTo(sync.getBackoffBase()) < 0) {
            throw new InvalidConfigurationException("kiosk.sync.backoff-cap",
                    "must be >= backoff-base (" + sync.getBackoffBase() + "), got: " + sync.getBackoffCap());
        }
        if (sync.getShutdownGrace().isNegative()) {
            throw new InvalidConfigurationException("kiosk.sync.shutdown-grace",
                    "must not be negative, got: " + sync.getShutdownGrace());
        }
    }

    private void validateConnectivity() {
        requirePositive("kiosk.connectivity.offline-probe-interval", connectivity.getOfflineProbeInterval());
        requirePositive("kiosk.connectivity.online-probe-interval", connectivity.getOnlineProbeInterval());
        requirePositive("kiosk.connectivity.probe-timeout", connectivity.getProbeTimeout());
    }

    private void validateBackend() {
        try {
            URI uri = new URI(backend.getBaseUrl());
            String scheme = uri.getScheme();
            if ((!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) || uri.getHost() == null) {
                throw new InvalidConfigurationException("kiosk.backend.base-url",
                        "must be an http(s) URL, got: '" + backend.getBaseUrl() + "'");
            }
        } catch (URISyntaxException e) {
            throw new InvalidConfigurationException("kiosk.backend.base-url",
                    "malformed URL '" + backend.getBaseUrl() + "': " + e.getReason());
        }
        requirePositive("kiosk.backend.connect-timeout", backend.getConnectTimeout());
        requirePositive("kiosk.backend.request-timeout", backend.getRequestTimeout());
    }

    private static void requirePositive(String property, Duration value) {
        if (value.isZero() || value.isNegative()) {
            throw new InvalidConfigurationException(property, "must be positive, got: " + value);
        }
    }
}
