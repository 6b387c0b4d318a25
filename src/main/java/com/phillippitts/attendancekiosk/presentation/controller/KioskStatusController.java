package com.phillippitts.attendancekiosk.presentation.controller;

import com.phillippitts.attendancekiosk.domain.AttendanceEvent;
import com.phillippitts.attendancekiosk.service.connectivity.ConnectivityMonitor;
import com.phillippitts.attendancekiosk.service.metrics.AttendanceMetrics;
import com.phillippitts.attendancekiosk.service.orchestration.PipelineCoordinator;
import com.phillippitts.attendancekiosk.service.store.AttendanceEventStore;
import com.phillippitts.attendancekiosk.service.sync.SyncManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the kiosk for operators and the admin dashboard.
 */
@RestController
class KioskStatusController {

    private static final Logger LOG = LogManager.getLogger(KioskStatusController.class);

    private final ConnectivityMonitor connectivity;
    private final AttendanceEventStore store;
    private final SyncManager syncManager;
    private final AttendanceMetrics metrics;
    private final PipelineCoordinator coordinator;

    KioskStatusController(ConnectivityMonitor connectivity,
                          AttendanceEventStore store,
                          SyncManager syncManager,
                          AttendanceMetrics metrics,
                          PipelineCoordinator coordinator) {
        this.connectivity = connectivity;
        this.store = store;
        this.syncManager = syncManager;
        this.metrics = metrics;
        this.coordinator = coordinator;
    }

    @GetMapping("/status")
    ResponseEntity<Map<String, Object>> status() {
        AttendanceMetrics.AttendanceStats stats = metrics.stats();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("connectivity", connectivity.getState().name());
        body.put("pendingEvents", store.countPending());
        body.put("lastError", syncManager.getLastError());
        body.put("checkIns", stats.checkIns());
        body.put("checkOuts", stats.checkOuts());
        body.put("unknownFaces", stats.unknownFaces());
        body.put("skippedFrames", coordinator.getSkippedFrames());
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/events/failed")
    ResponseEntity<List<FailedEventView>> failedEvents() {
        List<FailedEventView> failed = store.listFailed().stream()
                .map(FailedEventView::from)
                .toList();
        LOG.info("Failed events listed: count={}", failed.size());
        return ResponseEntity.ok(failed);
    }

    record FailedEventView(String eventId, String personId, Instant occurredAt, String kind,
                           int attempts, String lastError, boolean rejected) {

        static FailedEventView from(AttendanceEvent event) {
            return new FailedEventView(event.eventId(), event.personId(), event.occurredAt(),
                    event.kind().name(), event.attempts(), event.lastError(), event.rejected());
        }
    }
}
