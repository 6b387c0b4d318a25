package com.phillippitts.attendancekiosk.service.connectivity;

import com.phillippitts.attendancekiosk.config.properties.ConnectivityProperties;
import com.phillippitts.attendancekiosk.domain.ConnectivityState;
import com.phillippitts.attendancekiosk.service.sync.BackendClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks whether the backend is reachable by probing its health endpoint.
 *
 * <p><b>State model:</b>
 * <pre>
 * OFFLINE (initial) → PROBING → ONLINE | OFFLINE
 * ONLINE            → PROBING → ONLINE | OFFLINE
 * </pre>
 * A timeout, a refused connection and a non-2xx answer all settle on OFFLINE. Every change is
 * published as a {@link ConnectivityChangedEvent}; {@code recovered} marks an OFFLINE to ONLINE
 * cycle.
 *
 * <p>Probes run on the network scheduler: immediately on {@link #start()}, then every
 * {@code offlineProbeInterval} while offline and every {@code onlineProbeInterval} while online.
 */
public class ConnectivityMonitor {

    private static final Logger LOG = LogManager.getLogger(ConnectivityMonitor.class);

    private final BackendClient backend;
    private final ConnectivityProperties props;
    private final TaskScheduler scheduler;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final ReentrantLock probeLock = new ReentrantLock();
    private volatile ConnectivityState state = ConnectivityState.OFFLINE;
    private volatile ConnectivityState settled = ConnectivityState.OFFLINE;
    private volatile boolean running;
    private volatile ScheduledFuture<?> nextProbe;
    private volatile TaskDecorator taskDecorator = runnable -> runnable;

    public ConnectivityMonitor(BackendClient backend,
                               ConnectivityProperties props,
                               TaskScheduler scheduler,
                               ApplicationEventPublisher publisher,
                               Clock clock) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.props = Objects.requireNonNull(props, "props");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Decorator applied to every scheduled probe, e.g. to carry logging context onto the
     * network threads.
     */
    public void setTaskDecorator(TaskDecorator taskDecorator) {
        this.taskDecorator = Objects.requireNonNull(taskDecorator, "taskDecorator");
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        LOG.info("Connectivity monitor started (offline interval={}, online interval={})",
                props.getOfflineProbeInterval(), props.getOnlineProbeInterval());
        scheduleProbe(Duration.ZERO);
    }

    public synchronized void stop() {
        running = false;
        ScheduledFuture<?> f = nextProbe;
        if (f != null) {
            f.cancel(false);
        }
        LOG.info("Connectivity monitor stopped (state={})", state);
    }

    /**
     * Runs one probe cycle and returns the settled state. A cycle already in progress on
     * another thread is not duplicated; its current state is returned.
     */
    public ConnectivityState probeOnce() {
        if (!probeLock.tryLock()) {
            LOG.debug("Probe already in progress");
            return state;
        }
        try {
            ConnectivityState before = settled;
            transition(ConnectivityState.PROBING, false);
            boolean reachable;
            try {
                reachable = backend.checkHealth();
            } catch (RuntimeException e) {
                LOG.warn("Health probe threw unexpectedly: {}", e.toString());
                reachable = false;
            }
            ConnectivityState after = reachable ? ConnectivityState.ONLINE : ConnectivityState.OFFLINE;
            settled = after;
            transition(after, before == ConnectivityState.OFFLINE && after == ConnectivityState.ONLINE);
            logSettled(before, after);
            return after;
        } finally {
            probeLock.unlock();
        }
    }

    public ConnectivityState getState() {
        return state;
    }

    /**
     * @return true when the last completed probe reached the backend
     */
    public boolean isOnline() {
        return settled == ConnectivityState.ONLINE;
    }

    private void cycle() {
        if (!running) {
            return;
        }
        ConnectivityState result;
        try {
            result = probeOnce();
        } catch (RuntimeException e) {
            // a failing listener must not end the probe loop
            LOG.error("Probe cycle failed", e);
            result = settled;
        }
        scheduleProbe(result == ConnectivityState.ONLINE
                ? props.getOnlineProbeInterval()
                : props.getOfflineProbeInterval());
    }

    private synchronized void scheduleProbe(Duration delay) {
        if (!running) {
            return;
        }
        nextProbe = scheduler.schedule(taskDecorator.decorate(this::cycle), clock.instant().plus(delay));
    }

    private void transition(ConnectivityState next, boolean recovered) {
        ConnectivityState previous = state;
        state = next;
        if (previous != next) {
            publisher.publishEvent(new ConnectivityChangedEvent(previous, next, recovered, clock.instant()));
        }
    }

    private void logSettled(ConnectivityState before, ConnectivityState after) {
        if (before == after) {
            LOG.debug("Probe result: {}", after);
        } else if (after == ConnectivityState.ONLINE) {
            LOG.info("Backend reachable; connectivity {} -> {}", before, after);
        } else {
            LOG.warn("Backend unreachable; connectivity {} -> {}", before, after);
        }
    }
}
