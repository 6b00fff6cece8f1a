package com.flowmable.angulagram;

/**
 * How {@link ForwardMapping} turns a pixel angle into an angle row.
 * Both agree when the angle step is 1°.
 */
public enum ForwardIndexing {
    /**
     * {@code round(degrees) + offsetIndex}: one row per whole degree regardless of the step,
     * as the full-circle polar images have always been produced. With a step other than 1°
     * the rows no longer line up with {@link AngleAxis#angleAt(int)}.
     */
    WHOLE_DEGREES,
    /** {@code round(degrees / step) + offsetIndex}: rows line up with the inverse mapping's axis. */
    ANGLE_STEPS;

    long angleIndex(double degrees, AngleAxis axis) {
        double units = this == WHOLE_DEGREES ? degrees : degrees / axis.angleStep();
        return PixelMath.round(units) + axis.offsetIndex();
    }
}
