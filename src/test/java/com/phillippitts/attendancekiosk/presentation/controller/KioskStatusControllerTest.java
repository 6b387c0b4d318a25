package com.phillippitts.attendancekiosk.presentation.controller;

import com.phillippitts.attendancekiosk.domain.AttendanceEvent;
import com.phillippitts.attendancekiosk.domain.AttendanceKind;
import com.phillippitts.attendancekiosk.domain.ConnectivityState;
import com.phillippitts.attendancekiosk.domain.SyncStatus;
import com.phillippitts.attendancekiosk.service.connectivity.ConnectivityMonitor;
import com.phillippitts.attendancekiosk.service.metrics.AttendanceMetrics;
import com.phillippitts.attendancekiosk.service.orchestration.PipelineCoordinator;
import com.phillippitts.attendancekiosk.service.store.AttendanceEventStore;
import com.phillippitts.attendancekiosk.service.sync.SyncManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class KioskStatusControllerTest {

    private ConnectivityMonitor connectivity;
    private AttendanceEventStore store;
    private SyncManager syncManager;
    private AttendanceMetrics metrics;
    private PipelineCoordinator coordinator;
    private KioskStatusController controller;

    @BeforeEach
    void setUp() {
        connectivity = mock(ConnectivityMonitor.class);
        store = mock(AttendanceEventStore.class);
        syncManager = mock(SyncManager.class);
        metrics = mock(AttendanceMetrics.class);
        coordinator = mock(PipelineCoordinator.class);
        controller = new KioskStatusController(connectivity, store, syncManager, metrics, coordinator);
    }

    @Test
    void statusReportsPipelineState() {
        when(connectivity.getState()).thenReturn(ConnectivityState.OFFLINE);
        when(store.countPending()).thenReturn(7);
        when(syncManager.getLastError()).thenReturn("Connection refused");
        when(metrics.stats()).thenReturn(new AttendanceMetrics.AttendanceStats(12, 4, 2));
        when(coordinator.getSkippedFrames()).thenReturn(3L);

        ResponseEntity<Map<String, Object>> response = controller.status();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody())
                .containsEntry("connectivity", "OFFLINE")
                .containsEntry("pendingEvents", 7)
                .containsEntry("lastError", "Connection refused")
                .containsEntry("checkIns", 12L)
                .containsEntry("checkOuts", 4L)
                .containsEntry("unknownFaces", 2L)
                .containsEntry("skippedFrames", 3L)
                .containsKey("timestamp");
    }

    @Test
    void failedEventsListsExhaustedAndRejected() {
        Instant at = Instant.parse("2026-10-19T08:15:00Z");
        AttendanceEvent exhausted = new AttendanceEvent("e-1", "alice", "kiosk-01", at,
                AttendanceKind.CHECK_IN, "2026-10-19/morning-in", SyncStatus.FAILED, 5, "Read timed out", false);
        AttendanceEvent rejected = new AttendanceEvent("e-2", null, "kiosk-01", at,
                AttendanceKind.CHECK_IN, "2026-10-19/morning-in", SyncStatus.FAILED, 1, "unknown person", true);
        when(store.listFailed()).thenReturn(List.of(exhausted, rejected));

        ResponseEntity<List<KioskStatusController.FailedEventView>> response = controller.failedEvents();

        assertThat(response.getBody()).containsExactly(
                new KioskStatusController.FailedEventView("e-1", "alice", at, "CHECK_IN", 5, "Read timed out", false),
                new KioskStatusController.FailedEventView("e-2", null, at, "CHECK_IN", 1, "unknown person", true));
    }

    @Test
    void failedEventsEmptyWhenNothingFailed() {
        when(store.listFailed()).thenReturn(List.of());

        assertThat(controller.failedEvents().getBody()).isEmpty();
    }
}
