package com.flowmable.angulagram;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discretized angle window {@code [angleMin, angleMin + steps * angleStep)} in degrees.
 * <p>
 * Index {@code i} stands for {@code i * angleStep - offset()}, with {@code offset() = -angleMin}.
 *
 * @param angleMin  first angle of the window, in degrees
 * @param angleStep angular resolution in degrees, never below {@link #MIN_ANGLE_STEP}
 * @param steps     number of angle rows in the polar grid
 */
public record AngleAxis(double angleMin, double angleStep, int steps) {

    private static final Logger logger = LoggerFactory.getLogger(AngleAxis.class);

    /**
     * @throws InvalidGeometryException if the step is not positive and finite, the start is
     *                                  not finite, or {@code steps} is negative
     */
    public AngleAxis {
        if (!Double.isFinite(angleStep) || angleStep <= 0) {
            throw new InvalidGeometryException("Angle step must be positive and finite, got " + angleStep);
        }
        if (!Double.isFinite(angleMin)) {
            throw new InvalidGeometryException("Angle minimum must be finite, got " + angleMin);
        }
        if (steps < 0) {
            throw new InvalidGeometryException("Angle steps must not be negative, got " + steps);
        }
    }

    /** Smallest accepted step; finer requests are clamped to bound memory and loop counts. */
    public static final double MIN_ANGLE_STEP = 0.01;

    // Absorbs representation error in span/step, e.g. 120 / 0.1.
    private static final double STEP_EPSILON = 1e-9;

    /**
     * Build an axis covering {@code angleSpan} degrees from {@code angleMin}.
     *
     * @throws InvalidGeometryException if the step or span are not positive and finite,
     *                                  or the span is narrower than one step
     */
    public static AngleAxis of(double angleMin, double angleSpan, double angleStep) {
        if (!Double.isFinite(angleStep) || angleStep <= 0) {
            throw new InvalidGeometryException("Angle step must be positive and finite, got " + angleStep);
        }
        if (!Double.isFinite(angleSpan) || angleSpan <= 0) {
            throw new InvalidGeometryException("Angle span must be positive and finite, got " + angleSpan);
        }
        if (!Double.isFinite(angleMin)) {
            throw new InvalidGeometryException("Angle minimum must be finite, got " + angleMin);
        }
        double step = angleStep;
        if (step < MIN_ANGLE_STEP) {
            logger.warn("Angle step {}° is below {}°, clamping", angleStep, MIN_ANGLE_STEP);
            step = MIN_ANGLE_STEP;
        }
        long steps = (long) Math.floor(angleSpan / step + STEP_EPSILON);
        if (steps < 1) {
            throw new InvalidGeometryException(
                    "Angle span " + angleSpan + "° is narrower than one step of " + step + "°");
        }
        if (steps > Integer.MAX_VALUE) {
            throw new InvalidGeometryException("Angle span " + angleSpan + "° needs too many steps of " + step + "°");
        }
        return new AngleAxis(angleMin, step, (int) steps);
    }

    /** Degrees subtracted from {@code index * angleStep}. */
    public double offset() {
        return -angleMin;
    }

    /** Index that holds 0°. */
    public int offsetIndex() {
        return (int) Math.floor(offset() / angleStep + STEP_EPSILON);
    }

    public double angleAt(int index) {
        return index * angleStep - offset();
    }

    public double span() {
        return steps * angleStep;
    }
}
