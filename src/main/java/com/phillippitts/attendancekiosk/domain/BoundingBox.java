package com.phillippitts.attendancekiosk.domain;

/**
 * Face bounding box in frame pixel coordinates, as reported by the vision provider.
 *
 * <p>Only carried through the pipeline for UI collaborators; decisioning never reads it.
 */
public record BoundingBox(int x, int y, int width, int height) {

    public BoundingBox {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Bounding box size must be non-negative, got "
                    + width + "x" + height);
        }
    }
}
