package com.phillippitts.attendancekiosk.exception;

/**
 * Thrown when a detection frame from the vision provider is malformed
 * (missing trackId, confidence out of range, duplicate track in one frame).
 * The affected frame is skipped; the pipeline keeps running.
 */
public class VisionInputException extends AttendanceKioskException {

    public VisionInputException(String message) {
        super("Invalid detection frame: " + message);
    }
}
