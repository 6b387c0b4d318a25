package com.phillippitts.attendancekiosk.exception;

/**
 * Thrown when the backend permanently rejects an attendance event with a 4xx response
 * (e.g. unknown person id). The event must not be resent.
 */
public class BackendRejectionException extends AttendanceKioskException {

    private final int statusCode;
    private final String reason;

    public BackendRejectionException(int statusCode, String reason) {
        super("Backend rejected event (status: " + statusCode + "): " + reason);
        this.statusCode = statusCode;
        this.reason = reason;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getReason() {
        return reason;
    }
}
