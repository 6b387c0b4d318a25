package com.phillippitts.attendancekiosk.domain;

/**
 * What a resolved track produced.
 */
public enum DecisionOutcome {
    /** Recognized person, attendance event recorded. */
    RECORDED,
    /** Recognized person already punched in the current window; no event. */
    SUPPRESSED,
    /** Face never stabilized on an enrolled person; recorded without a person id. */
    UNKNOWN;

    public boolean createsEvent() {
        return this != SUPPRESSED;
    }
}
