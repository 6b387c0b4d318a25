package com.phillippitts.attendancekiosk.service.store;

import com.phillippitts.attendancekiosk.domain.AttendanceEvent;
import com.phillippitts.attendancekiosk.exception.EventStoreException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Crash-safe local persistence of attendance events and their delivery status.
 *
 * <p>Never touches the network. Status transitions are idempotent: marking an event that is
 * already in (or past) the target state is a no-op reported by a {@code false} return value,
 * not an error.
 *
 * <p><b>Lifecycle of an event:</b>
 * <pre>
 * PENDING → SYNCING → SYNCED
 *              ↓
 *           FAILED → SYNCING ...   (transient, until the retry round is exhausted)
 *           FAILED + rejected       (permanent, never listed as pending again)
 * </pre>
 *
 * <p><b>Thread Safety:</b> Implementations must allow {@link #append} from the decisioning
 * thread concurrently with listing and status updates from the sync thread.
 *
 * @since 1.0
 */
public interface AttendanceEventStore {

    /**
     * Durably stores a new event. Appending an eventId that already exists is a no-op.
     *
     * @throws EventStoreException on local I/O or database failure
     */
    void append(AttendanceEvent event);

    /**
     * Returns events awaiting delivery: PENDING, or FAILED but not rejected and still within the
     * current retry round, oldest {@code occurredAt} first.
     *
     * @throws EventStoreException on local I/O or database failure
     */
    List<AttendanceEvent> listPending();

    /**
     * Moves a PENDING or FAILED event to SYNCING and counts one delivery attempt.
     *
     * @return false if the event is already syncing, synced, rejected or unknown
     */
    boolean markSyncing(String eventId);

    /**
     * Marks an event delivered.
     *
     * @return false if the event was already synced or does not exist
     */
    boolean markSynced(String eventId);

    /**
     * Records a failed delivery of a SYNCING event.
     *
     * @param permanent true when the backend rejected the event and it must not be resent
     * @return false if the event was not syncing
     */
    boolean markFailed(String eventId, String error, boolean permanent);

    Optional<AttendanceEvent> findById(String eventId);

    /**
     * Delivery attempts left for an event in the current retry round.
     *
     * @return remaining attempts, 0 when exhausted, rejected, synced or unknown
     */
    int remainingAttempts(String eventId);

    /**
     * Events that need manual attention: rejected ones and those that used up their retry round.
     */
    List<AttendanceEvent> listFailed();

    /**
     * Number of events not yet synced and not rejected.
     */
    int countPending();

    /**
     * Returns events left in SYNCING by an interrupted process to PENDING.
     *
     * @return number of events recovered
     */
    int recoverInFlight();

    /**
     * Starts a new retry round for failed, non-rejected events that used up their attempts.
     *
     * @return number of events requeued
     */
    int requeueExhausted();

    /**
     * Deletes synced events that occurred before {@code cutoff}.
     *
     * @return number of events deleted
     */
    int purgeSynced(Instant cutoff);
}
