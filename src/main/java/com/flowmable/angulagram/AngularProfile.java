package com.flowmable.angulagram;

import java.util.Arrays;

/**
 * Signal versus angle, one entry per angle index of the source grid.
 * <p>
 * The arrays are copied on construction and on every access, so a profile is immutable.
 * Equality compares array contents.
 *
 * @param angles      angle of each entry in degrees ({@code i * step - offset})
 * @param integrals   raw radial sums
 * @param values      reported intensity: {@code integrals / maxIntegral} when normalized, else the raw sums
 * @param maxIntegral largest raw sum
 * @param normalized  whether {@code values} were divided by {@code maxIntegral}
 */
public record AngularProfile(
        double[] angles,
        long[] integrals,
        double[] values,
        long maxIntegral,
        boolean normalized
) {
    public AngularProfile {
        if (angles.length != integrals.length || angles.length != values.length) {
            throw new IllegalArgumentException("Profile arrays differ in length: " + angles.length + ", "
                    + integrals.length + ", " + values.length);
        }
        angles = angles.clone();
        integrals = integrals.clone();
        values = values.clone();
    }

    @Override
    public double[] angles() {
        return angles.clone();
    }

    @Override
    public long[] integrals() {
        return integrals.clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public int size() {
        return angles.length;
    }

    public double angleAt(int index) {
        return angles[index];
    }

    public long integralAt(int index) {
        return integrals[index];
    }

    public double valueAt(int index) {
        return values[index];
    }

    /** First index holding the maximum integral, or -1 for an empty profile. */
    public int peakIndex() {
        int peak = -1;
        for (int i = 0; i < integrals.length; i++) {
            if (peak < 0 || integrals[i] > integrals[peak]) peak = i;
        }
        return peak;
    }

    public double peakAngle() {
        int peak = peakIndex();
        return peak < 0 ? Double.NaN : angles[peak];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AngularProfile other)) return false;
        return maxIntegral == other.maxIntegral && normalized == other.normalized
                && Arrays.equals(angles, other.angles) && Arrays.equals(integrals, other.integrals)
                && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        int h = Arrays.hashCode(angles);
        h = 31 * h + Arrays.hashCode(integrals);
        h = 31 * h + Arrays.hashCode(values);
        h = 31 * h + Long.hashCode(maxIntegral);
        return 31 * h + Boolean.hashCode(normalized);
    }

    @Override
    public String toString() {
        return "AngularProfile[" + angles.length + " angles, peak " + peakAngle() + "°, max " + maxIntegral
                + (normalized ? ", normalized]" : "]");
    }
}
