package com.phillippitts.attendancekiosk.exception;

/**
 * Thrown when the backend could not be reached or answered with a retryable status
 * (timeout, connection refused, 5xx, 408, 429). The request should be retried with backoff.
 */
public class NetworkTransientException extends AttendanceKioskException {

    private final int statusCode;

    public NetworkTransientException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public NetworkTransientException(int statusCode, String message) {
        super(message + " (status: " + statusCode + ")");
        this.statusCode = statusCode;
    }

    /**
     * @return HTTP status, or 0 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }
}
