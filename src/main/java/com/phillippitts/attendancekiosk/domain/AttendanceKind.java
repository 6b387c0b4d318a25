package com.phillippitts.attendancekiosk.domain;

/**
 * Check-in/check-out classification sent to the backend.
 */
public enum AttendanceKind {
    CHECK_IN,
    CHECK_OUT
}
