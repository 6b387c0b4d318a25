package com.phillippitts.attendancekiosk.config.properties;

import com.phillippitts.attendancekiosk.domain.AttendanceKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Device identity, attendance windows and the per-person cooldown.
 *
 * <p>Windows are given by start time; each one lasts until the next window starts,
 * the last one until midnight. The first window must start at 00:00.
 */
@ConfigurationProperties(prefix = "kiosk.attendance")
@Validated
public class AttendanceProperties {

    /** Id of this kiosk, sent with every event. */
    @NotBlank(message = "Device id must not be blank")
    private String deviceId = "kiosk-01";

    /** Time zone used to resolve windows; blank means the system default. */
    private String zone = "";

    /** Minimum time between two recorded decisions for the same person in the same window. */
    @NotNull
    private Duration cooldown = Duration.ofHours(12);

    /** Extra append attempts when the local store fails on the decision path. */
    @Min(value = 0, message = "Append retries must be >= 0")
    private int appendRetries = 1;

    @NotEmpty(message = "At least one attendance window is required")
    @Valid
    private List<Window> windows = new ArrayList<>(List.of(
            new Window("morning-in", LocalTime.MIDNIGHT, AttendanceKind.CHECK_IN),
            new Window("afternoon-out", LocalTime.NOON, AttendanceKind.CHECK_OUT)
    ));

    public String getDeviceId() {
        return deviceId;
    }

    public void setDeviceId(String deviceId) {
        this.deviceId = deviceId;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    /**
     * @return configured zone, or the system default when blank
     */
    public ZoneId zoneId() {
        return zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
    }

    public Duration getCooldown() {
        return cooldown;
    }

    public void setCooldown(Duration cooldown) {
        this.cooldown = cooldown;
    }

    public int getAppendRetries() {
        return appendRetries;
    }

    public void setAppendRetries(int appendRetries) {
        this.appendRetries = appendRetries;
    }

    public List<Window> getWindows() {
        return windows;
    }

    public void setWindows(List<Window> windows) {
        this.windows = windows;
    }

    /**
     * One named attendance window.
     */
    public static class Window {
        @NotBlank
        private String name;
        @NotNull
        private LocalTime start;
        @NotNull
        private AttendanceKind kind;

        public Window() {
        }

        public Window(String name, LocalTime start, AttendanceKind kind) {
            this.name = name;
            this.start = start;
            this.kind = kind;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public LocalTime getStart() {
            return start;
        }

        public void setStart(LocalTime start) {
            this.start = start;
        }

        public AttendanceKind getKind() {
            return kind;
        }

        public void setKind(AttendanceKind kind) {
            this.kind = kind;
        }
    }
}
