package com.flowmable.angulagram;

/**
 * Rounding helpers shared by both mappings.
 */
final class PixelMath {

    private PixelMath() {}

    /** Rounds half away from zero so that mirrored offsets stay mirrored. */
    static long round(double value) {
        return value < 0 ? -Math.round(-value) : Math.round(value);
    }
}
