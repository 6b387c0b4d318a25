package com.phillippitts.attendancekiosk.exception;

/**
 * Thrown at startup when threshold, interval or window configuration is inconsistent.
 * Not recoverable at runtime; the application fails to start.
 */
public class InvalidConfigurationException extends AttendanceKioskException {

    private final String property;

    public InvalidConfigurationException(String property, String message) {
        super("Invalid configuration '" + property + "': " + message);
        this.property = property;
    }

    public String getProperty() {
        return property;
    }
}
