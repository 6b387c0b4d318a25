package com.phillippitts.attendancekiosk.domain;

/**
 * Delivery state of a stored attendance event.
 */
public enum SyncStatus {
    PENDING,
    SYNCING,
    SYNCED,
    FAILED
}
