package com.phillippitts.attendancekiosk.domain;

/**
 * Best-effort view of backend reachability.
 */
public enum ConnectivityState {
    ONLINE,
    OFFLINE,
    PROBING
}
