package com.phillippitts.attendancekiosk.service.events;

import com.phillippitts.attendancekiosk.domain.ConnectivityState;
import com.phillippitts.attendancekiosk.service.sync.event.EventRejectedEvent;
import com.phillippitts.attendancekiosk.service.sync.event.SyncStatusChangedEvent;
import com.phillippitts.attendancekiosk.service.tracking.event.AttendanceNotSavedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for operator-facing pipeline events. Privacy-safe and throttled to avoid log spam.
 */
@Component
class OperatorNotificationsListener {
    private static final Logger LOG = LogManager.getLogger(OperatorNotificationsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onSyncStatus(SyncStatusChangedEvent e) {
        if (e.connectivity() == ConnectivityState.OFFLINE && shouldLog("offline")) {
            LOG.warn("Kiosk offline: {} attendance events stored locally, waiting for backend", e.pendingCount());
        }
    }

    @EventListener
    void onEventRejected(EventRejectedEvent e) {
        String key = "rejected-" + e.statusCode() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Attendance event rejected by backend: status={}, reason={}. "
                    + "Review failed events at GET /events/failed.", e.statusCode(), e.reason());
        }
    }

    @EventListener
    void onAttendanceNotSaved(AttendanceNotSavedEvent e) {
        if (shouldLog("not-saved")) {
            LOG.error("Attendance not saved: {}. Check disk space and data directory permissions.", e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
