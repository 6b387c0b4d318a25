package com.phillippitts.attendancekiosk.service.tracking;

import com.phillippitts.attendancekiosk.domain.TrackStatus;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable state of one continuously tracked face. Owned by {@link FaceTrackStateMachine};
 * never shared outside the decisioning path.
 */
final class FaceTrack {

    /** One verification vote; {@code personId} is null for an abstention. */
    record Observation(String personId, double confidence) {
    }

    private final String trackId;
    private final Instant firstSeenAt;
    private final int windowSize;
    private final Deque<Observation> confidenceHistory;

    private TrackStatus status = TrackStatus.SCANNING;
    private String candidatePersonId;
    private Instant lastSeenAt;
    private Instant verifyingSince;
    private int framesSeen;

    FaceTrack(String trackId, Instant firstSeenAt, int windowSize) {
        this.trackId = trackId;
        this.firstSeenAt = firstSeenAt;
        this.lastSeenAt = firstSeenAt;
        this.windowSize = windowSize;
        this.confidenceHistory = new ArrayDeque<>(windowSize);
    }

    void seen(Instant at) {
        lastSeenAt = at;
        framesSeen++;
    }

    void startVerifying(Instant at) {
        advance(TrackStatus.VERIFYING);
        verifyingSince = at;
    }

    void addVote(String personId, double confidence) {
        if (confidenceHistory.size() == windowSize) {
            confidenceHistory.removeFirst();
        }
        confidenceHistory.addLast(new Observation(personId, confidence));
    }

    /**
     * Returns the person holding at least {@code required} votes in the current window.
     */
    Optional<String> majority(int required) {
        Map<String, Integer> counts = new HashMap<>();
        for (Observation o : confidenceHistory) {
            if (o.personId() == null) {
                continue;
            }
            int c = counts.merge(o.personId(), 1, Integer::sum);
            if (c >= required) {
                return Optional.of(o.personId());
            }
        }
        return Optional.empty();
    }

    boolean windowFull() {
        return confidenceHistory.size() >= windowSize;
    }

    void resetWindow() {
        confidenceHistory.clear();
    }

    void recognize(String personId) {
        advance(TrackStatus.RECOGNIZED);
        candidatePersonId = personId;
    }

    void markUnknown() {
        advance(TrackStatus.UNKNOWN);
    }

    void expire() {
        status = TrackStatus.EXPIRED;
    }

    /** Forward-only transition. */
    private void advance(TrackStatus next) {
        if (next.ordinal() <= status.ordinal() || status.isResolved()) {
            throw new IllegalStateException("Track " + trackId + " cannot move from " + status + " to " + next);
        }
        status = next;
    }

    /** Start of the current unresolved phase, used for the verify timeout. */
    Instant phaseStartedAt() {
        return status == TrackStatus.VERIFYING ? verifyingSince : firstSeenAt;
    }

    String trackId() {
        return trackId;
    }

    TrackStatus status() {
        return status;
    }

    Optional<String> candidatePersonId() {
        return Optional.ofNullable(candidatePersonId);
    }

    Instant firstSeenAt() {
        return firstSeenAt;
    }

    Instant lastSeenAt() {
        return lastSeenAt;
    }

    int framesSeen() {
        return framesSeen;
    }

    List<Observation> confidenceHistory() {
        return List.copyOf(confidenceHistory);
    }
}
