package com.phillippitts.attendancekiosk.service.orchestration;

import com.phillippitts.attendancekiosk.config.properties.PipelineProperties;
import com.phillippitts.attendancekiosk.domain.AttendanceDecision;
import com.phillippitts.attendancekiosk.domain.DetectionFrame;
import com.phillippitts.attendancekiosk.exception.EventStoreException;
import com.phillippitts.attendancekiosk.exception.VisionInputException;
import com.phillippitts.attendancekiosk.service.connectivity.ConnectivityMonitor;
import com.phillippitts.attendancekiosk.service.store.AttendanceEventStore;
import com.phillippitts.attendancekiosk.service.sync.SyncManager;
import com.phillippitts.attendancekiosk.service.tracking.DecisionRecorder;
import com.phillippitts.attendancekiosk.service.tracking.FaceTrackStateMachine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Wires the attendance pipeline together and owns its lifecycle.
 *
 * <p><b>Decisioning path:</b> frame → {@link FaceTrackStateMachine} → {@link DecisionRecorder}
 * → store. Frames are serialized under one lock, so tracks and cooldowns have a single writer.
 * Network I/O never happens on this path; delivery is left to the {@link SyncManager}.
 *
 * <p><b>Lifecycle:</b> on start, events interrupted mid-delivery are returned to PENDING, the
 * connectivity monitor and sync manager are started and, when a {@link VisionProvider} is
 * present, it is polled on the frame scheduler at {@code maxFps}. Without one, frames are pushed
 * through {@link #processFrame} and the frame scheduler sweeps track timeouts at the same rate.
 * Stop runs in reverse order.
 * Running in the last lifecycle phase means the data source outlives the pipeline.
 *
 * <p><b>Error Handling:</b> a malformed frame is skipped with a throttled warning; any other
 * failure in one frame is logged and the next frame is processed normally.
 *
 * @since 1.0
 */
public class PipelineCoordinator implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(PipelineCoordinator.class);
    private static final Duration WARN_THROTTLE = Duration.ofSeconds(30);

    private final FaceTrackStateMachine stateMachine;
    private final DecisionRecorder recorder;
    private final AttendanceEventStore store;
    private final ConnectivityMonitor connectivity;
    private final SyncManager syncManager;
    private final VisionProvider vision;
    private final TaskScheduler frameScheduler;
    private final PipelineProperties props;
    private final Clock clock;

    private final ReentrantLock frameLock = new ReentrantLock();
    private volatile boolean running;
    private volatile ScheduledFuture<?> frameLoop;
    private Instant lastInputWarning;
    private long skippedFrames;

    /**
     * @param vision frame source to poll, or {@code null} when frames are pushed through
     *               {@link #processFrame}
     */
    public PipelineCoordinator(FaceTrackStateMachine stateMachine,
                               DecisionRecorder recorder,
                               AttendanceEventStore store,
                               ConnectivityMonitor connectivity,
                               SyncManager syncManager,
                               VisionProvider vision,
                               TaskScheduler frameScheduler,
                               PipelineProperties props,
                               Clock clock) {
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.recorder = Objects.requireNonNull(recorder, "recorder");
        this.store = Objects.requireNonNull(store, "store");
        this.connectivity = Objects.requireNonNull(connectivity, "connectivity");
        this.syncManager = Objects.requireNonNull(syncManager, "syncManager");
        this.vision = vision;
        this.frameScheduler = Objects.requireNonNull(frameScheduler, "frameScheduler");
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Runs one frame through the state machine and records the resulting decisions.
     *
     * @return decisions produced by this frame; empty when the frame was skipped
     */
    public List<AttendanceDecision> processFrame(DetectionFrame frame) {
        frameLock.lock();
        try {
            List<AttendanceDecision> decisions = stateMachine.process(frame);
            decisions.forEach(recorder::record);
            return decisions;
        } catch (VisionInputException e) {
            skipFrame(e);
            return List.of();
        } catch (RuntimeException e) {
            LOG.error("Frame processing failed; continuing with next frame", e);
            return List.of();
        } finally {
            frameLock.unlock();
        }
    }

    /**
     * Applies track timeouts when no frame arrived.
     */
    public List<AttendanceDecision> sweep() {
        frameLock.lock();
        try {
            List<AttendanceDecision> decisions = stateMachine.sweep(clock.instant());
            decisions.forEach(recorder::record);
            return decisions;
        } catch (RuntimeException e) {
            LOG.error("Track sweep failed", e);
            return List.of();
        } finally {
            frameLock.unlock();
        }
    }

    /**
     * Polls the vision provider once. Visible for the frame loop and tests.
     */
    void pollOnce() {
        DetectionFrame frame;
        try {
            frame = vision.detect();
        } catch (VisionInputException e) {
            skipFrame(e);
            return;
        } catch (RuntimeException e) {
            LOG.error("Vision provider failed; continuing with next frame", e);
            return;
        }
        if (frame == null) {
            sweep();
        } else {
            processFrame(frame);
        }
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        try {
            store.recoverInFlight();
        } catch (EventStoreException e) {
            LOG.error("Could not recover in-flight events at start-up; continuing", e);
        }
        connectivity.start();
        syncManager.start();
        Duration period = Duration.ofMillis(Math.max(1, 1000L / props.getMaxFps()));
        if (vision != null) {
            frameLoop = frameScheduler.scheduleAtFixedRate(this::pollOnce, period);
            LOG.info("Attendance pipeline started; polling vision provider every {} ms", period.toMillis());
        } else {
            // Pushed frames may stop at any time, so timeouts are applied on a timer
            frameLoop = frameScheduler.scheduleAtFixedRate(this::sweep, period);
            LOG.info("Attendance pipeline started without a vision provider; frames must be pushed, "
                    + "tracks swept every {} ms", period.toMillis());
        }
        running = true;
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        ScheduledFuture<?> loop = frameLoop;
        if (loop != null) {
            loop.cancel(false);
            frameLoop = null;
        }
        connectivity.stop();
        syncManager.stop();
        running = false;
        LOG.info("Attendance pipeline stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return props.isAutoStart();
    }

    public synchronized long getSkippedFrames() {
        return skippedFrames;
    }

    private synchronized void skipFrame(VisionInputException e) {
        skippedFrames++;
        Instant now = clock.instant();
        if (lastInputWarning == null || Duration.between(lastInputWarning, now).compareTo(WARN_THROTTLE) > 0) {
            lastInputWarning = now;
            LOG.warn("Skipping malformed frame ({} skipped so far): {}", skippedFrames, e.getMessage());
        } else {
            LOG.debug("Skipping malformed frame: {}", e.getMessage());
        }
    }
}
