package com.phillippitts.attendancekiosk.domain;

import com.phillippitts.attendancekiosk.exception.VisionInputException;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * All faces the vision provider reported for one captured frame.
 *
 * <p>An empty detection list is valid and means "no faces this frame".
 *
 * @param capturedAt camera capture time of the frame
 * @param detections detections in provider order
 */
public record DetectionFrame(Instant capturedAt, List<FaceDetection> detections) {

    /**
     * @throws VisionInputException if the timestamp is missing or a trackId repeats
     */
    public DetectionFrame {
        if (capturedAt == null) {
            throw new VisionInputException("Frame without capture timestamp");
        }
        detections = detections == null ? List.of() : List.copyOf(detections);
        Set<String> seen = new HashSet<>();
        for (FaceDetection d : detections) {
            if (!seen.add(d.trackId())) {
                throw new VisionInputException("Duplicate trackId " + d.trackId() + " in frame at " + capturedAt);
            }
        }
    }

    public static DetectionFrame empty(Instant capturedAt) {
        return new DetectionFrame(capturedAt, List.of());
    }

    public boolean isEmpty() {
        return detections.isEmpty();
    }
}
