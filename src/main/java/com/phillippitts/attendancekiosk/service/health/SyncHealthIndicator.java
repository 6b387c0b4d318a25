package com.phillippitts.attendancekiosk.service.health;

import com.phillippitts.attendancekiosk.exception.EventStoreException;
import com.phillippitts.attendancekiosk.service.connectivity.ConnectivityMonitor;
import com.phillippitts.attendancekiosk.service.store.AttendanceEventStore;
import com.phillippitts.attendancekiosk.service.sync.SyncManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for local storage and backend delivery.
 *
 * <ul>
 *   <li>UP: store readable and backend reachable</li>
 *   <li>DEGRADED: store readable, backend unreachable (events queue locally)</li>
 *   <li>DOWN: local store unreadable</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health.
 */
@Component
public class SyncHealthIndicator implements HealthIndicator {

    private final AttendanceEventStore store;
    private final ConnectivityMonitor connectivity;
    private final SyncManager syncManager;

    public SyncHealthIndicator(AttendanceEventStore store,
                               ConnectivityMonitor connectivity,
                               SyncManager syncManager) {
        this.store = store;
        this.connectivity = connectivity;
        this.syncManager = syncManager;
    }

    @Override
    public Health health() {
        int pending;
        try {
            pending = store.countPending();
        } catch (EventStoreException e) {
            return Health.down(e)
                    .withDetail("status", "Local event store unavailable")
                    .withDetail("connectivity", connectivity.getState().name())
                    .build();
        }

        Health.Builder builder = connectivity.isOnline()
                ? Health.up().withDetail("status", "Backend reachable")
                : Health.status("DEGRADED").withDetail("status", "Backend unreachable; events stored locally");
        builder.withDetail("connectivity", connectivity.getState().name())
                .withDetail("pendingEvents", pending);
        String lastError = syncManager.getLastError();
        if (lastError != null) {
            builder.withDetail("lastError", lastError);
        }
        return builder.build();
    }
}
