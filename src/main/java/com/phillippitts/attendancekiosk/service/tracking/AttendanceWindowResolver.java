package com.phillippitts.attendancekiosk.service.tracking;

import com.phillippitts.attendancekiosk.domain.AttendanceWindow;

import java.time.Instant;

/**
 * Maps a capture time to the attendance window it belongs to.
 *
 * <p>Two decisions for the same person fall under the same cooldown only when they resolve
 * to the same window key.
 */
public interface AttendanceWindowResolver {

    /**
     * @param at capture time
     * @return window containing {@code at}, never {@code null}
     */
    AttendanceWindow resolve(Instant at);
}
