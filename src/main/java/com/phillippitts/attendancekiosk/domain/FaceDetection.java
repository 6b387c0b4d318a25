package com.phillippitts.attendancekiosk.domain;

import com.phillippitts.attendancekiosk.exception.VisionInputException;

/**
 * One face reported by the vision provider for a single frame.
 *
 * @param trackId    provider-assigned id, stable while the face is continuously tracked
 * @param bbox       bounding box of the face
 * @param identity   matched person or {@link Identity#unknown()}
 * @param confidence match confidence between 0.0 and 1.0
 */
public record FaceDetection(
        String trackId,
        BoundingBox bbox,
        Identity identity,
        double confidence
) {

    /**
     * @throws VisionInputException if any field is missing or confidence is out of range
     */
    public FaceDetection {
        if (trackId == null || trackId.isBlank()) {
            throw new VisionInputException("Detection without trackId");
        }
        if (bbox == null) {
            throw new VisionInputException("Detection " + trackId + " has no bounding box");
        }
        if (identity == null) {
            throw new VisionInputException("Detection " + trackId + " has no identity");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new VisionInputException("Detection " + trackId
                    + " confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }

    public static FaceDetection known(String trackId, BoundingBox bbox, String personId, double confidence) {
        return new FaceDetection(trackId, bbox, Identity.known(personId), confidence);
    }

    public static FaceDetection unknown(String trackId, BoundingBox bbox, double confidence) {
        return new FaceDetection(trackId, bbox, Identity.unknown(), confidence);
    }
}
