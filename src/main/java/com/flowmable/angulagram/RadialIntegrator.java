package com.flowmable.angulagram;

/**
 * Collapses a {@link PolarGrid} to an {@link AngularProfile} by summing each angle row
 * over all radii.
 */
public final class RadialIntegrator {

    private RadialIntegrator() {}

    /**
     * @param normalize divide every integral by the maximum so the peak is exactly 1.0
     * @throws DegenerateSignalException if {@code normalize} is set and every integral is zero
     */
    public static AngularProfile integrate(PolarGrid grid, boolean normalize) {
        AngleAxis axis = grid.axis();
        int n = grid.angleSteps();
        double[] angles = new double[n];
        long[] integrals = new long[n];
        long max = 0;

        for (int i = 0; i < n; i++) {
            angles[i] = axis.angleAt(i);
            integrals[i] = grid.radialSum(i);
            if (integrals[i] > max) max = integrals[i];
        }

        double[] values = new double[n];
        if (normalize) {
            if (max == 0) {
                throw new DegenerateSignalException(
                        "Cannot normalize: every radial integral of " + grid + " is zero");
            }
            for (int i = 0; i < n; i++) {
                values[i] = (double) integrals[i] / max;
            }
        } else {
            for (int i = 0; i < n; i++) {
                values[i] = integrals[i];
            }
        }
        return new AngularProfile(angles, integrals, values, max, normalize);
    }

    /** Largest radial integral, used to calibrate levels between measurements. */
    public static long maxIntegral(PolarGrid grid) {
        long max = 0;
        for (int i = 0; i < grid.angleSteps(); i++) {
            max = Math.max(max, grid.radialSum(i));
        }
        return max;
    }
}
