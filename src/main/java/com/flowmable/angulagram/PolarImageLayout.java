package com.flowmable.angulagram;

/**
 * Arrangement of a {@link PolarGrid} when it is rendered to, or read back from, an image.
 */
public enum PolarImageLayout {
    /** One row per angle index (top row = index 0), one column per radius. */
    ANGLE_ROWS,
    /** One column per angle index, one row per radius with the largest radius on top. */
    RADIUS_ROWS_FLIPPED;

    int imageWidth(int angleSteps, int radiusMax) {
        return this == ANGLE_ROWS ? radiusMax : angleSteps;
    }

    int imageHeight(int angleSteps, int radiusMax) {
        return this == ANGLE_ROWS ? angleSteps : radiusMax;
    }

    int x(int angleIndex, int radius) {
        return this == ANGLE_ROWS ? radius : angleIndex;
    }

    int y(int angleIndex, int radius, int radiusMax) {
        return this == ANGLE_ROWS ? angleIndex : radiusMax - radius - 1;
    }
}
