package com.flowmable.angulagram;

/**
 * Where the inlet sits in the source image.
 */
public enum OriginPlacement {
    /** {@code (0, height/2 - 1)}: the inlet at the left edge, used for full-circle scans. */
    LEFT_MIDDLE,
    /** {@code (width/2, height)}: just below the bottom edge, the inlet of an extracted zone. */
    BOTTOM_MIDDLE,
    /** The configured {@code originX, originY}. */
    EXPLICIT;

    double originX(int width, double configured) {
        return switch (this) {
            case LEFT_MIDDLE -> 0;
            case BOTTOM_MIDDLE -> width / 2;
            case EXPLICIT -> configured;
        };
    }

    double originY(int height, double configured) {
        return switch (this) {
            case LEFT_MIDDLE -> height / 2 - 1;
            case BOTTOM_MIDDLE -> height;
            case EXPLICIT -> configured;
        };
    }
}
