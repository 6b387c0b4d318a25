package com.phillippitts.attendancekiosk.service.tracking;

import com.phillippitts.attendancekiosk.config.properties.AttendanceProperties;
import com.phillippitts.attendancekiosk.domain.AttendanceWindow;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Resolves windows from time-of-day start boundaries, e.g. {@code morning-in} from 00:00
 * and {@code afternoon-out} from 12:00. Each window runs until the next one starts.
 */
public class TimeOfDayWindowResolver implements AttendanceWindowResolver {

    private final List<AttendanceProperties.Window> windows;
    private final ZoneId zone;

    public TimeOfDayWindowResolver(List<AttendanceProperties.Window> windows, ZoneId zone) {
        Objects.requireNonNull(windows, "windows");
        if (windows.isEmpty()) {
            throw new IllegalArgumentException("At least one window is required");
        }
        List<AttendanceProperties.Window> sorted = new ArrayList<>(windows);
        sorted.sort(Comparator.comparing(AttendanceProperties.Window::getStart));
        if (!LocalTime.MIDNIGHT.equals(sorted.get(0).getStart())) {
            throw new IllegalArgumentException("First window must start at 00:00, got "
                    + sorted.get(0).getStart());
        }
        this.windows = List.copyOf(sorted);
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    @Override
    public AttendanceWindow resolve(Instant at) {
        LocalDateTime local = LocalDateTime.ofInstant(at, zone);
        LocalTime time = local.toLocalTime();
        AttendanceProperties.Window match = windows.get(0);
        for (AttendanceProperties.Window w : windows) {
            if (!time.isBefore(w.getStart())) {
                match = w;
            }
        }
        return new AttendanceWindow(local.toLocalDate(), match.getName(), match.getKind());
    }
}
