package com.phillippitts.attendancekiosk.service.sync;

/**
 * Outcome of one sync pass.
 *
 * @param ran        false when the pass was skipped (offline, backoff pending or another pass running)
 * @param attempted  events sent to the backend
 * @param synced     events the backend accepted
 * @param transientFailures events that failed with a retryable error
 * @param rejected   events the backend permanently rejected
 */
public record SyncReport(boolean ran, int attempted, int synced, int transientFailures, int rejected) {

    public static SyncReport skipped() {
        return new SyncReport(false, 0, 0, 0, 0);
    }
}
