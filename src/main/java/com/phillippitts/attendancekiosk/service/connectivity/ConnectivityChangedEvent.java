package com.phillippitts.attendancekiosk.service.connectivity;

import com.phillippitts.attendancekiosk.domain.ConnectivityState;

import java.time.Instant;

/**
 * Published on every connectivity state change, including the PROBING step of each probe cycle.
 *
 * @param previous  state before the change
 * @param current   new state
 * @param recovered true when a probe cycle took the monitor from OFFLINE to ONLINE
 * @param at        time of the change
 */
public record ConnectivityChangedEvent(
        ConnectivityState previous,
        ConnectivityState current,
        boolean recovered,
        Instant at
) {}
