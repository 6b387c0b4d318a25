package com.phillippitts.attendancekiosk.domain;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Attendance window a decision falls into, e.g. the morning check-in window of one day.
 *
 * @param date the local date
 * @param name window name from configuration (e.g. {@code morning-in})
 * @param kind check-in or check-out
 */
public record AttendanceWindow(LocalDate date, String name, AttendanceKind kind) {

    public AttendanceWindow {
        Objects.requireNonNull(date, "date must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    /**
     * Key used for cooldown comparison and stored with each event.
     */
    public String key() {
        return date + "/" + name;
    }
}
