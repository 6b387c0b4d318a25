package com.phillippitts.attendancekiosk.domain;

/**
 * Lifecycle of a face track. Transitions only move forward:
 * SCANNING, VERIFYING, then RECOGNIZED or UNKNOWN, and finally EXPIRED.
 */
public enum TrackStatus {
    SCANNING,
    VERIFYING,
    RECOGNIZED,
    UNKNOWN,
    EXPIRED;

    public boolean isResolved() {
        return this == RECOGNIZED || this == UNKNOWN;
    }
}
