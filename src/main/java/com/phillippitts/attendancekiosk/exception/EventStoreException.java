package com.phillippitts.attendancekiosk.exception;

/**
 * Thrown when the local attendance event store cannot read or write (disk full,
 * permission denied, database file locked).
 */
public class EventStoreException extends AttendanceKioskException {

    private final String operation;

    public EventStoreException(String operation, Throwable cause) {
        super("Event store " + operation + " failed", cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
