package com.phillippitts.attendancekiosk.service.store;

import com.phillippitts.attendancekiosk.domain.AttendanceEvent;
import com.phillippitts.attendancekiosk.domain.AttendanceKind;
import com.phillippitts.attendancekiosk.domain.SyncStatus;
import com.phillippitts.attendancekiosk.exception.EventStoreException;
import com.phillippitts.attendancekiosk.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link AttendanceEventStore} backed by an embedded database through {@link JdbcTemplate}.
 *
 * <p>Every status transition is a single conditional {@code UPDATE} whose {@code WHERE} clause
 * names the allowed source states, so two threads racing on the same event cannot both win and
 * a repeated mark changes nothing.
 *
 * <p>Retry rounds: {@code attempts} only grows. {@code retry_floor} remembers the attempt count
 * at the start of the current round, so an event is pending while
 * {@code attempts - retry_floor < maxAttempts}.
 */
public class JdbcAttendanceEventStore implements AttendanceEventStore {

    private static final Logger LOG = LogManager.getLogger(JdbcAttendanceEventStore.class);

    private static final int MAX_ERROR_LENGTH = 1000;

    private static final String COLUMNS =
            "event_id, person_id, device_id, occurred_at, kind, window_key, sync_status, attempts, last_error, rejected";

    private static final RowMapper<AttendanceEvent> ROW_MAPPER = (rs, rowNum) -> new AttendanceEvent(
            rs.getString("event_id"),
            rs.getString("person_id"),
            rs.getString("device_id"),
            Instant.ofEpochMilli(rs.getLong("occurred_at")),
            AttendanceKind.valueOf(rs.getString("kind")),
            rs.getString("window_key"),
            SyncStatus.valueOf(rs.getString("sync_status")),
            rs.getInt("attempts"),
            rs.getString("last_error"),
            rs.getBoolean("rejected")
    );

    private final JdbcTemplate jdbc;
    private final int maxAttempts;
    private final Clock clock;

    public JdbcAttendanceEventStore(JdbcTemplate jdbc, int maxAttempts, Clock clock) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive, got: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates the table and index if missing. Safe to call on every start.
     */
    public void initializeSchema() {
        execute("initialize", () -> {
            jdbc.execute("""
                    CREATE TABLE IF NOT EXISTS attendance_event (
                        seq          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                        event_id     VARCHAR(36)   NOT NULL UNIQUE,
                        person_id    VARCHAR(128),
                        device_id    VARCHAR(128)  NOT NULL,
                        occurred_at  BIGINT        NOT NULL,
                        kind         VARCHAR(16)   NOT NULL,
                        window_key   VARCHAR(64)   NOT NULL,
                        sync_status  VARCHAR(16)   NOT NULL,
                        attempts     INT           NOT NULL DEFAULT 0,
                        retry_floor  INT           NOT NULL DEFAULT 0,
                        last_error   VARCHAR(1000),
                        rejected     BOOLEAN       NOT NULL DEFAULT FALSE,
                        updated_at   BIGINT        NOT NULL
                    )
                    """);
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_attendance_event_status "
                    + "ON attendance_event (sync_status, occurred_at)");
            return null;
        });
        LOG.info("Attendance event store ready (maxAttempts={})", maxAttempts);
    }

    @Override
    public void append(AttendanceEvent event) {
        Objects.requireNonNull(event, "event");
        try {
            jdbc.update("INSERT INTO attendance_event (" + COLUMNS + ", retry_floor, updated_at) "
                            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 0, ?)",
                    event.eventId(),
                    event.personId(),
                    event.deviceId(),
                    event.occurredAt().toEpochMilli(),
                    event.kind().name(),
                    event.windowKey(),
                    event.syncStatus().name(),
                    event.attempts(),
                    event.lastError(),
                    event.rejected(),
                    now());
            LOG.debug("Appended event {} (person={}, kind={})", event.eventId(), event.personId(), event.kind());
        } catch (DuplicateKeyException e) {
            LOG.debug("Event {} already stored; append ignored", event.eventId());
        } catch (DataAccessException e) {
            throw new EventStoreException("append", e);
        }
    }

    @Override
    public List<AttendanceEvent> listPending() {
        return execute("listPending", () -> jdbc.query(
                "SELECT " + COLUMNS + " FROM attendance_event "
                        + "WHERE rejected = FALSE AND sync_status IN ('PENDING', 'FAILED') "
                        + "AND attempts - retry_floor < ? "
                        + "ORDER BY occurred_at, seq",
                ROW_MAPPER, maxAttempts));
    }

    @Override
    public boolean markSyncing(String eventId) {
        return execute("markSyncing", () -> jdbc.update(
                "UPDATE attendance_event SET sync_status = 'SYNCING', attempts = attempts + 1, updated_at = ? "
                        + "WHERE event_id = ? AND rejected = FALSE AND sync_status IN ('PENDING', 'FAILED')",
                now(), eventId) == 1);
    }

    @Override
    public boolean markSynced(String eventId) {
        return execute("markSynced", () -> jdbc.update(
                "UPDATE attendance_event SET sync_status = 'SYNCED', updated_at = ? "
                        + "WHERE event_id = ? AND rejected = FALSE AND sync_status <> 'SYNCED'",
                now(), eventId) == 1);
    }

    @Override
    public boolean markFailed(String eventId, String error, boolean permanent) {
        return execute("markFailed", () -> jdbc.update(
                "UPDATE attendance_event SET sync_status = 'FAILED', last_error = ?, rejected = ?, updated_at = ? "
                        + "WHERE event_id = ? AND sync_status = 'SYNCING'",
                LogSanitizer.truncate(error, MAX_ERROR_LENGTH), permanent, now(), eventId) == 1);
    }

    @Override
    public Optional<AttendanceEvent> findById(String eventId) {
        return execute("findById", () -> jdbc.query(
                "SELECT " + COLUMNS + " FROM attendance_event WHERE event_id = ?",
                ROW_MAPPER, eventId).stream().findFirst());
    }

    @Override
    public int remainingAttempts(String eventId) {
        List<Integer> used = execute("remainingAttempts", () -> jdbc.queryForList(
                "SELECT attempts - retry_floor FROM attendance_event "
                        + "WHERE event_id = ? AND rejected = FALSE AND sync_status <> 'SYNCED'",
                Integer.class, eventId));
        return used.isEmpty() ? 0 : Math.max(0, maxAttempts - used.get(0));
    }

    @Override
    public List<AttendanceEvent> listFailed() {
        return execute("listFailed", () -> jdbc.query(
                "SELECT " + COLUMNS + " FROM attendance_event "
                        + "WHERE sync_status = 'FAILED' AND (rejected = TRUE OR attempts - retry_floor >= ?) "
                        + "ORDER BY occurred_at, seq",
                ROW_MAPPER, maxAttempts));
    }

    @Override
    public int countPending() {
        Integer count = execute("countPending", () -> jdbc.queryForObject(
                "SELECT COUNT(*) FROM attendance_event WHERE rejected = FALSE AND sync_status <> 'SYNCED'",
                Integer.class));
        return count == null ? 0 : count;
    }

    @Override
    public int recoverInFlight() {
        int recovered = execute("recoverInFlight", () -> jdbc.update(
                "UPDATE attendance_event SET sync_status = 'PENDING', updated_at = ? WHERE sync_status = 'SYNCING'",
                now()));
        if (recovered > 0) {
            LOG.warn("Recovered {} events interrupted mid-delivery", recovered);
        }
        return recovered;
    }

    @Override
    public int requeueExhausted() {
        return execute("requeueExhausted", () -> jdbc.update(
                "UPDATE attendance_event SET retry_floor = attempts, updated_at = ? "
                        + "WHERE sync_status = 'FAILED' AND rejected = FALSE AND attempts - retry_floor >= ?",
                now(), maxAttempts));
    }

    @Override
    public int purgeSynced(Instant cutoff) {
        return execute("purgeSynced", () -> jdbc.update(
                "DELETE FROM attendance_event WHERE sync_status = 'SYNCED' AND occurred_at < ?",
                cutoff.toEpochMilli()));
    }

    private long now() {
        return clock.millis();
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new EventStoreException(operation, e);
        }
    }
}
