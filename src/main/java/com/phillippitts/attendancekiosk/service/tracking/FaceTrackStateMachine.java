package com.phillippitts.attendancekiosk.service.tracking;

import com.phillippitts.attendancekiosk.config.properties.TrackingProperties;
import com.phillippitts.attendancekiosk.domain.AttendanceDecision;
import com.phillippitts.attendancekiosk.domain.AttendanceWindow;
import com.phillippitts.attendancekiosk.domain.DecisionOutcome;
import com.phillippitts.attendancekiosk.domain.DetectionFrame;
import com.phillippitts.attendancekiosk.domain.FaceDetection;
import com.phillippitts.attendancekiosk.domain.Identity;
import com.phillippitts.attendancekiosk.domain.TrackStatus;
import com.phillippitts.attendancekiosk.exception.VisionInputException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns per-frame detections into at most one {@link AttendanceDecision} per track.
 *
 * <p><b>Per-track transitions:</b>
 * <pre>
 * SCANNING  → VERIFYING   first detection with a known person at or above the verify threshold
 * VERIFYING → RECOGNIZED  one person holds requiredAgreement votes among the last verifyWindowSize
 * SCANNING/VERIFYING → UNKNOWN  unresolved for longer than verifyTimeout
 * any       → EXPIRED     unreported for longer than trackExpiry (track removed)
 * </pre>
 *
 * <p>A full voting window without a super-majority is cleared and voting starts over; the
 * track itself is kept. Empty frames add no votes, so they never reset a window.
 *
 * <p>Entering RECOGNIZED checks the {@link PersonCooldownRegistry}: a person already recorded in
 * the same attendance window yields {@link DecisionOutcome#SUPPRESSED} instead of
 * {@link DecisionOutcome#RECORDED}.
 *
 * <p><b>Thread Safety:</b> Not thread-safe. All calls must come from the single decisioning
 * path; {@link com.phillippitts.attendancekiosk.service.orchestration.PipelineCoordinator}
 * serializes frames. No I/O is performed here.
 *
 * @since 1.0
 */
public class FaceTrackStateMachine {

    private static final Logger LOG = LogManager.getLogger(FaceTrackStateMachine.class);

    private final TrackingProperties props;
    private final PersonCooldownRegistry cooldowns;
    private final AttendanceWindowResolver windowResolver;

    // Insertion order keeps decision order stable across frames
    private final Map<String, FaceTrack> tracks = new LinkedHashMap<>();
    private Instant lastFrameAt;

    public FaceTrackStateMachine(TrackingProperties props,
                                 PersonCooldownRegistry cooldowns,
                                 AttendanceWindowResolver windowResolver) {
        this.props = Objects.requireNonNull(props, "props");
        this.cooldowns = Objects.requireNonNull(cooldowns, "cooldowns");
        this.windowResolver = Objects.requireNonNull(windowResolver, "windowResolver");
    }

    /**
     * Applies one frame of detections and returns the decisions it produced.
     *
     * @param frame detections of one captured frame (may be empty)
     * @return decisions in track order; empty when nothing resolved
     * @throws VisionInputException if the frame is older than the previous one
     */
    public List<AttendanceDecision> process(DetectionFrame frame) {
        Objects.requireNonNull(frame, "frame");
        Instant now = frame.capturedAt();
        if (lastFrameAt != null && now.isBefore(lastFrameAt)) {
            throw new VisionInputException("Frame at " + now + " is older than previous frame at " + lastFrameAt);
        }
        lastFrameAt = now;

        List<AttendanceDecision> decisions = new ArrayList<>();

        // Known tracks first so new faces cannot push them out of the cap
        List<FaceDetection> newcomers = new ArrayList<>();
        for (FaceDetection d : frame.detections()) {
            FaceTrack track = tracks.get(d.trackId());
            if (track != null) {
                observe(track, d, now, decisions);
            } else {
                newcomers.add(d);
            }
        }
        for (FaceDetection d : newcomers) {
            if (tracks.size() >= props.getMaxTracks()) {
                LOG.debug("Ignoring track {}: {} tracks already active", d.trackId(), tracks.size());
                continue;
            }
            FaceTrack track = new FaceTrack(d.trackId(), now, props.getVerifyWindowSize());
            tracks.put(d.trackId(), track);
            LOG.debug("Track {} started", d.trackId());
            observe(track, d, now, decisions);
        }

        advanceClock(now, decisions);
        return decisions;
    }

    /**
     * Applies timeouts and expiry without new detections.
     *
     * @param now current time on the frame clock
     * @return decisions for tracks that timed out into UNKNOWN
     */
    public List<AttendanceDecision> sweep(Instant now) {
        List<AttendanceDecision> decisions = new ArrayList<>();
        if (lastFrameAt != null && now.isBefore(lastFrameAt)) {
            return decisions;
        }
        advanceClock(now, decisions);
        return decisions;
    }

    /**
     * Releases a person's cooldown for {@code window} after its decision could not be stored,
     * so the next track of that person can record again.
     */
    public void releaseCooldown(String personId, AttendanceWindow window) {
        cooldowns.release(personId, window.key());
    }

    public Optional<TrackStatus> statusOf(String trackId) {
        FaceTrack track = tracks.get(trackId);
        return track == null ? Optional.empty() : Optional.of(track.status());
    }

    public Optional<String> candidateOf(String trackId) {
        FaceTrack track = tracks.get(trackId);
        return track == null ? Optional.empty() : track.candidatePersonId();
    }

    public int activeTrackCount() {
        return tracks.size();
    }

    private void observe(FaceTrack track, FaceDetection d, Instant now, List<AttendanceDecision> decisions) {
        track.seen(now);
        if (track.status().isResolved()) {
            return;
        }

        boolean qualifies = d.identity() instanceof Identity.Known
                && d.confidence() >= props.getVerifyThreshold();
        if (track.status() == TrackStatus.SCANNING) {
            if (!qualifies) {
                return;
            }
            track.startVerifying(now);
            LOG.debug("Track {} verifying candidate {}", track.trackId(), d.identity());
        }

        track.addVote(qualifies ? d.identity().personId().orElseThrow() : null, d.confidence());
        Optional<String> winner = track.majority(props.getRequiredAgreement());
        if (winner.isPresent()) {
            decisions.add(recognize(track, winner.get(), now));
        } else if (track.windowFull()) {
            LOG.debug("Track {} window without agreement; restarting vote", track.trackId());
            track.resetWindow();
        }
    }

    private AttendanceDecision recognize(FaceTrack track, String personId, Instant now) {
        track.recognize(personId);
        AttendanceWindow window = windowResolver.resolve(now);
        DecisionOutcome outcome;
        if (cooldowns.isActive(personId, window, now)) {
            outcome = DecisionOutcome.SUPPRESSED;
            LOG.info("Track {} recognized person {} (cooldown active in {})", track.trackId(), personId, window.key());
        } else {
            cooldowns.record(personId, window, now);
            outcome = DecisionOutcome.RECORDED;
            LOG.info("Track {} recognized person {} in {}", track.trackId(), personId, window.key());
        }
        return new AttendanceDecision(track.trackId(), personId, outcome, now, window);
    }

    private AttendanceDecision markUnknown(FaceTrack track, Instant now) {
        track.markUnknown();
        LOG.info("Track {} resolved as unknown face after {} frames", track.trackId(), track.framesSeen());
        return new AttendanceDecision(track.trackId(), null, DecisionOutcome.UNKNOWN, now, windowResolver.resolve(now));
    }

    private void advanceClock(Instant now, List<AttendanceDecision> decisions) {
        Duration expiry = props.getTrackExpiry();
        Duration verifyTimeout = props.getVerifyTimeout();
        Iterator<FaceTrack> it = tracks.values().iterator();
        while (it.hasNext()) {
            FaceTrack track = it.next();
            if (Duration.between(track.lastSeenAt(), now).compareTo(expiry) > 0) {
                expire(track, decisions);
                it.remove();
                continue;
            }
            if (!track.status().isResolved()
                    && Duration.between(track.phaseStartedAt(), now).compareTo(verifyTimeout) > 0) {
                decisions.add(markUnknown(track, now));
            }
        }
    }

    private void expire(FaceTrack track, List<AttendanceDecision> decisions) {
        // Unresolved tracks are always reported, however short-lived
        if (!track.status().isResolved()) {
            decisions.add(markUnknown(track, track.lastSeenAt()));
        }
        track.expire();
        LOG.debug("Track {} expired (last seen {})", track.trackId(), track.lastSeenAt());
    }
}
