package com.phillippitts.attendancekiosk.service.events;

import com.phillippitts.attendancekiosk.domain.ConnectivityState;
import com.phillippitts.attendancekiosk.service.sync.event.EventRejectedEvent;
import com.phillippitts.attendancekiosk.service.sync.event.SyncStatusChangedEvent;
import com.phillippitts.attendancekiosk.service.tracking.event.AttendanceNotSavedEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class OperatorNotificationsListenerTest {

    @Test
    void throttlesRepeatLogs() {
        OperatorNotificationsListener l = new OperatorNotificationsListener();
        assertThat(l.shouldLog("offline")).isTrue();
        assertThat(l.shouldLog("offline")).isFalse();
        assertThat(l.shouldLog("not-saved")).isTrue();
    }

    @Test
    void handlersDoNotThrow() {
        OperatorNotificationsListener l = new OperatorNotificationsListener();
        assertThatCode(() -> {
            l.onSyncStatus(new SyncStatusChangedEvent(3, "Read timed out", ConnectivityState.OFFLINE, Instant.now()));
            l.onSyncStatus(new SyncStatusChangedEvent(0, null, ConnectivityState.ONLINE, Instant.now()));
            l.onEventRejected(new EventRejectedEvent("e1", "P9", 422, "unregistered person", Instant.now()));
            l.onAttendanceNotSaved(new AttendanceNotSavedEvent("t1", "P1", "Event store append failed", null));
        }).doesNotThrowAnyException();
    }
}
