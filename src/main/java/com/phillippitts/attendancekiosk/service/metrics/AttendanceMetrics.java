package com.phillippitts.attendancekiosk.service.metrics;

import com.phillippitts.attendancekiosk.domain.AttendanceEvent;
import com.phillippitts.attendancekiosk.domain.AttendanceKind;
import com.phillippitts.attendancekiosk.domain.DecisionOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the attendance pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Track decisions by outcome (recorded, suppressed, unknown)</li>
 *   <li>Stored attendance events by kind (check-in, check-out, unknown face)</li>
 *   <li>Delivery attempts by result and sync pass duration</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class AttendanceMetrics {

    private static final String METRIC_PREFIX = "kiosk.attendance";
    private static final String UNKNOWN_FACE = "unknown";

    /** Outcome of one delivery attempt. */
    public enum DeliveryResult {
        SYNCED, TRANSIENT_FAILURE, REJECTED;

        String tag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Counts of stored events since start, for the status screen.
     */
    public record AttendanceStats(long checkIns, long checkOuts, long unknownFaces) {
    }

    private final MeterRegistry registry;

    public AttendanceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDecision(DecisionOutcome outcome) {
        Counter.builder(METRIC_PREFIX + ".decisions")
                .description("Number of resolved tracks by outcome")
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * Counts an event that reached the local store.
     */
    public void recordStored(AttendanceEvent event) {
        eventCounter(event.isUnknownFace() ? UNKNOWN_FACE : kindTag(event.kind())).increment();
    }

    public void recordNotSaved() {
        Counter.builder(METRIC_PREFIX + ".not_saved")
                .description("Number of decisions that could not be stored locally")
                .register(registry)
                .increment();
    }

    public void recordDelivery(DeliveryResult result) {
        Counter.builder(METRIC_PREFIX + ".deliveries")
                .description("Number of delivery attempts by result")
                .tag("result", result.tag())
                .register(registry)
                .increment();
    }

    /**
     * Records the duration of one sync pass.
     *
     * @param durationNanos duration in nanoseconds
     */
    public void recordSyncPass(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".sync.pass")
                .description("Time taken by one sync pass")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public AttendanceStats stats() {
        return new AttendanceStats(
                (long) eventCounter(kindTag(AttendanceKind.CHECK_IN)).count(),
                (long) eventCounter(kindTag(AttendanceKind.CHECK_OUT)).count(),
                (long) eventCounter(UNKNOWN_FACE).count());
    }

    private Counter eventCounter(String kind) {
        return Counter.builder(METRIC_PREFIX + ".events")
                .description("Number of attendance events stored locally by kind")
                .tag("kind", kind)
                .register(registry);
    }

    private static String kindTag(AttendanceKind kind) {
        return kind.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
