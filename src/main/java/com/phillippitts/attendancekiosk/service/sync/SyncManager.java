package com.phillippitts.attendancekiosk.service.sync;

import com.phillippitts.attendancekiosk.config.properties.SyncProperties;
import com.phillippitts.attendancekiosk.domain.AttendanceEvent;
import com.phillippitts.attendancekiosk.domain.ConnectivityState;
import com.phillippitts.attendancekiosk.exception.BackendRejectionException;
import com.phillippitts.attendancekiosk.exception.EventStoreException;
import com.phillippitts.attendancekiosk.exception.NetworkTransientException;
import com.phillippitts.attendancekiosk.service.connectivity.ConnectivityChangedEvent;
import com.phillippitts.attendancekiosk.service.connectivity.ConnectivityMonitor;
import com.phillippitts.attendancekiosk.service.metrics.AttendanceMetrics;
import com.phillippitts.attendancekiosk.service.metrics.AttendanceMetrics.DeliveryResult;
import com.phillippitts.attendancekiosk.service.store.AttendanceEventStore;
import com.phillippitts.attendancekiosk.service.sync.event.EventRejectedEvent;
import com.phillippitts.attendancekiosk.service.sync.event.SyncStatusChangedEvent;
import com.phillippitts.attendancekiosk.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Delivers pending attendance events to the backend, oldest first.
 *
 * <p><b>Pass protocol:</b> for each pending event, {@code markSyncing} then
 * {@link BackendClient#submit}:
 * <ul>
 *   <li>success: {@code markSynced}, backoff reset</li>
 *   <li>rejection (4xx): {@code markFailed(permanent)}, {@link EventRejectedEvent}, next event</li>
 *   <li>transient failure: {@code markFailed}; the pass stops and resumes after the backoff
 *       delay. When the event has used up its attempts for this retry round it stays FAILED,
 *       the backoff is reset and the pass moves on to the next event.</li>
 * </ul>
 * Exhausted events get a new retry round whenever connectivity recovers from OFFLINE, so a
 * transient failure never discards an event.
 *
 * <p><b>Triggers:</b> a connectivity change to ONLINE, a fixed-delay tick while online and the
 * end of a backoff delay. Passes run on the sync executor; at most one runs at a time and
 * overlapping triggers are dropped.
 *
 * <p>A {@link SyncStatusChangedEvent} is published after every pass and whenever a probe
 * settles on OFFLINE.
 */
public class SyncManager {

    private static final Logger LOG = LogManager.getLogger(SyncManager.class);

    private final AttendanceEventStore store;
    private final BackendClient backend;
    private final ConnectivityMonitor connectivity;
    private final Executor syncExecutor;
    private final TaskScheduler scheduler;
    private final ApplicationEventPublisher publisher;
    private final AttendanceMetrics metrics;
    private final SyncProperties props;
    private final Clock clock;
    private final RetryBackoff backoff;

    private final ReentrantLock passLock = new ReentrantLock();
    private volatile boolean running;
    private volatile boolean stopRequested;
    private volatile String lastError;
    private volatile ScheduledFuture<?> tick;
    private volatile ScheduledFuture<?> purge;
    private volatile TaskDecorator taskDecorator = runnable -> runnable;

    public SyncManager(AttendanceEventStore store,
                       BackendClient backend,
                       ConnectivityMonitor connectivity,
                       Executor syncExecutor,
                       TaskScheduler scheduler,
                       ApplicationEventPublisher publisher,
                       AttendanceMetrics metrics,
                       SyncProperties props,
                       Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.connectivity = Objects.requireNonNull(connectivity, "connectivity");
        this.syncExecutor = Objects.requireNonNull(syncExecutor, "syncExecutor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.backoff = new RetryBackoff(props.getBackoffBase(), props.getBackoffCap());
    }

    /**
     * Decorator applied to the ticks and retries scheduled on the network scheduler.
     */
    public void setTaskDecorator(TaskDecorator taskDecorator) {
        this.taskDecorator = Objects.requireNonNull(taskDecorator, "taskDecorator");
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        stopRequested = false;
        Instant now = clock.instant();
        tick = scheduler.scheduleWithFixedDelay(taskDecorator.decorate(this::trigger),
                now.plus(props.getInterval()), props.getInterval());
        purge = scheduler.scheduleWithFixedDelay(taskDecorator.decorate(this::purgeExpired),
                now.plus(Duration.ofMinutes(1)), Duration.ofDays(1));
        LOG.info("Sync manager started (interval={}, maxAttempts={}, backoff={}..{})",
                props.getInterval(), props.getMaxAttempts(), props.getBackoffBase(), props.getBackoffCap());
    }

    /**
     * Stops scheduling and waits up to {@code shutdownGrace} for an in-flight pass.
     */
    public void stop() {
        synchronized (this) {
            running = false;
            stopRequested = true;
            cancel(tick);
            cancel(purge);
        }
        try {
            if (passLock.tryLock(props.getShutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                passLock.unlock();
                LOG.info("Sync manager stopped");
            } else {
                LOG.warn("Sync pass still running after {}; stopping without it", props.getShutdownGrace());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for sync pass to finish");
        }
    }

    @EventListener
    public void onConnectivityChanged(ConnectivityChangedEvent event) {
        if (event.current() == ConnectivityState.ONLINE) {
            if (event.recovered()) {
                backoff.reset();
                try {
                    int requeued = store.requeueExhausted();
                    if (requeued > 0) {
                        LOG.info("Connectivity recovered; {} exhausted events get a new retry round", requeued);
                    }
                } catch (EventStoreException e) {
                    LOG.error("Could not requeue exhausted events", e);
                }
            }
            trigger();
        } else if (event.current() == ConnectivityState.OFFLINE) {
            publishStatus();
        }
    }

    /**
     * Schedules a pass on the sync executor if running and online. Dropped when a pass is queued.
     */
    public void trigger() {
        if (!running || !connectivity.isOnline()) {
            return;
        }
        try {
            syncExecutor.execute(this::runPass);
        } catch (RejectedExecutionException e) {
            LOG.debug("Sync pass already queued; trigger dropped");
        }
    }

    /**
     * Runs one pass on the calling thread.
     *
     * @return what the pass did; {@link SyncReport#skipped()} when it did not run
     */
    public SyncReport syncOnce() {
        if (!passLock.tryLock()) {
            LOG.debug("Sync pass already running");
            return SyncReport.skipped();
        }
        try {
            if (!connectivity.isOnline()) {
                return SyncReport.skipped();
            }
            if (!backoff.isReady(clock.instant())) {
                LOG.debug("Backoff until {}; pass skipped", backoff.nextAttemptAt().orElse(null));
                return SyncReport.skipped();
            }
            long start = System.nanoTime();
            SyncReport report = deliverPending();
            metrics.recordSyncPass(System.nanoTime() - start);
            if (report.attempted() > 0) {
                LOG.info("Sync pass: attempted={}, synced={}, transient={}, rejected={}",
                        report.attempted(), report.synced(), report.transientFailures(), report.rejected());
            }
            publishStatus();
            return report;
        } finally {
            passLock.unlock();
        }
    }

    public boolean isRunning() {
        return running;
    }

    public String getLastError() {
        return lastError;
    }

    RetryBackoff backoff() {
        return backoff;
    }

    /**
     * Deletes synced events older than the retention period.
     *
     * @return number of events purged, 0 when the store failed
     */
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(props.getRetention());
        try {
            int purged = store.purgeSynced(cutoff);
            if (purged > 0) {
                LOG.info("Purged {} synced events older than {}", purged, cutoff);
            }
            return purged;
        } catch (EventStoreException e) {
            LOG.warn("Purge of synced events failed: {}", e.getMessage());
            return 0;
        }
    }

    private void runPass() {
        ThreadContext.put("syncPass", UUID.randomUUID().toString().substring(0, 8));
        try {
            syncOnce();
        } catch (RuntimeException e) {
            LOG.error("Sync pass failed", e);
        } finally {
            ThreadContext.remove("syncPass");
        }
    }

    private SyncReport deliverPending() {
        int attempted = 0;
        int synced = 0;
        int transientFailures = 0;
        int rejected = 0;
        try {
            List<AttendanceEvent> pending = store.listPending();
            for (AttendanceEvent event : pending) {
                if (stopRequested || !connectivity.isOnline()) {
                    LOG.info("Connectivity lost or stopping; pass ends with {} events left", pending.size() - attempted);
                    break;
                }
                if (!store.markSyncing(event.eventId())) {
                    LOG.debug("Event {} no longer eligible; skipped", event.eventId());
                    continue;
                }
                attempted++;
                try {
                    backend.submit(event);
                    store.markSynced(event.eventId());
                    backoff.reset();
                    lastError = null;
                    synced++;
                    metrics.recordDelivery(DeliveryResult.SYNCED);
                } catch (BackendRejectionException e) {
                    rejected++;
                    reject(event, e);
                } catch (NetworkTransientException e) {
                    transientFailures++;
                    if (!retryLater(event, e)) {
                        break;
                    }
                }
            }
        } catch (EventStoreException e) {
            lastError = e.getMessage();
            LOG.error("Sync pass aborted: local store failed during {}", e.getOperation(), e);
        }
        return new SyncReport(true, attempted, synced, transientFailures, rejected);
    }

    private void reject(AttendanceEvent event, BackendRejectionException e) {
        String error = "rejected by backend: " + e.getReason();
        store.markFailed(event.eventId(), error, true);
        lastError = error;
        metrics.recordDelivery(DeliveryResult.REJECTED);
        LOG.warn("Event {} (person={}) {} (status {})",
                event.eventId(), event.personId(), error, e.getStatusCode());
        publisher.publishEvent(new EventRejectedEvent(
                event.eventId(), event.personId(), e.getStatusCode(), e.getReason(), clock.instant()));
    }

    /**
     * Records a transient failure.
     *
     * @return true when the pass should move on to the next event
     */
    private boolean retryLater(AttendanceEvent event, NetworkTransientException e) {
        String error = LogSanitizer.describe(e);
        store.markFailed(event.eventId(), error, false);
        lastError = error;
        metrics.recordDelivery(DeliveryResult.TRANSIENT_FAILURE);
        if (store.remainingAttempts(event.eventId()) <= 0) {
            LOG.warn("Event {} used up {} attempts this round; kept FAILED until connectivity recovers",
                    event.eventId(), props.getMaxAttempts());
            backoff.reset();
            return true;
        }
        Duration delay = backoff.recordFailure(clock.instant());
        LOG.info("Delivery of event {} failed ({}); retrying in {}", event.eventId(), error, delay);
        scheduleRetry(delay);
        return false;
    }

    private synchronized void scheduleRetry(Duration delay) {
        if (running) {
            scheduler.schedule(taskDecorator.decorate(this::trigger), clock.instant().plus(delay));
        }
    }

    private void publishStatus() {
        int pending;
        try {
            pending = store.countPending();
        } catch (EventStoreException e) {
            LOG.warn("Could not count pending events: {}", e.getMessage());
            pending = -1;
        }
        publisher.publishEvent(new SyncStatusChangedEvent(
                pending, lastError, connectivity.getState(), clock.instant()));
    }

    private static void cancel(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }
}
