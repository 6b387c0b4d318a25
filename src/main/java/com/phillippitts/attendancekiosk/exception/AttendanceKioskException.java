package com.phillippitts.attendancekiosk.exception;

/**
 * Base exception for all attendance kiosk application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class AttendanceKioskException extends RuntimeException {

    public AttendanceKioskException(String message) {
        super(message);
    }

    public AttendanceKioskException(String message, Throwable cause) {
        super(message, cause);
    }

    public AttendanceKioskException(Throwable cause) {
        super(cause);
    }
}
