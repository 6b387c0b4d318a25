package com.phillippitts.attendancekiosk.service.sync.event;

import com.phillippitts.attendancekiosk.domain.ConnectivityState;

import java.time.Instant;

/**
 * Published after every sync pass and on every failed probe while offline, so the offline
 * indicator and pending counter stay current.
 *
 * @param pendingCount events not yet synced (excluding rejected ones), or -1 when the store could not be read
 * @param lastError    last delivery error, or {@code null} after a clean pass
 * @param connectivity connectivity state at publication time
 * @param at           publication time
 */
public record SyncStatusChangedEvent(
        int pendingCount,
        String lastError,
        ConnectivityState connectivity,
        Instant at
) {}
