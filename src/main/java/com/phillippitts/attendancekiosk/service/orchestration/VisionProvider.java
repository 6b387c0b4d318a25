package com.phillippitts.attendancekiosk.service.orchestration;

import com.phillippitts.attendancekiosk.domain.DetectionFrame;
import com.phillippitts.attendancekiosk.exception.VisionInputException;

/**
 * Source of detection frames: camera capture plus face detection, tracking and matching.
 *
 * <p>Called synchronously once per frame from the frame thread. Implementations live outside
 * this project; when a bean is present the {@link PipelineCoordinator} polls it.
 */
public interface VisionProvider {

    /**
     * Captures and analyses the next frame.
     *
     * @return the frame's detections, or {@code null} when no frame is available yet
     * @throws VisionInputException if the provider produced a malformed frame
     */
    DetectionFrame detect();
}
