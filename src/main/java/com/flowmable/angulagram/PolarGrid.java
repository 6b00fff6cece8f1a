package com.flowmable.angulagram;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Polar intensity grid indexed {@code [angleIndex][radius]}.
 * <p>
 * Cells hold signal in {@code [0, 255]}: 0 means no signal. A grid is populated
 * once by a {@link SamplingStrategy} and is immutable afterwards.
 */
public final class PolarGrid {

    private final AngleAxis axis;
    private final int radiusMax;
    private final byte[] cells;

    /** Takes ownership of {@code cells}. */
    PolarGrid(AngleAxis axis, int radiusMax, byte[] cells) {
        if (cells.length != (long) axis.steps() * radiusMax) {
            throw new IllegalArgumentException("Grid of " + axis.steps() + "x" + radiusMax
                    + " cannot hold " + cells.length + " cells");
        }
        this.axis = axis;
        this.radiusMax = radiusMax;
        this.cells = cells;
    }

    /**
     * Read back a polar image written with {@link #toImage(PolarImageLayout)}.
     * Pixel values are taken as signal; they are not inverted again.
     *
     * @param angleMin  angle of the first angle index, in degrees
     * @param angleSpan degrees covered by all angle indices together
     */
    public static PolarGrid fromImage(BufferedImage image, PolarImageLayout layout,
                                      double angleMin, double angleSpan) {
        if (!Double.isFinite(angleMin) || !Double.isFinite(angleSpan) || angleSpan <= 0) {
            throw new InvalidGeometryException(
                    "Angle window must be finite and positive, got " + angleMin + "° + " + angleSpan + "°");
        }
        GrayImage gray = GrayImage.from(image);
        int angleSteps = layout == PolarImageLayout.ANGLE_ROWS ? gray.height() : gray.width();
        int radiusMax = layout == PolarImageLayout.ANGLE_ROWS ? gray.width() : gray.height();
        AngleAxis axis = new AngleAxis(angleMin, angleSpan / angleSteps, angleSteps);

        byte[] cells = new byte[angleSteps * radiusMax];
        for (int a = 0; a < angleSteps; a++) {
            for (int r = 0; r < radiusMax; r++) {
                cells[a * radiusMax + r] = (byte) gray.get(layout.x(a, r), layout.y(a, r, radiusMax));
            }
        }
        return new PolarGrid(axis, radiusMax, cells);
    }

    public AngleAxis axis() {
        return axis;
    }

    public int angleSteps() {
        return axis.steps();
    }

    public int radiusMax() {
        return radiusMax;
    }

    public int get(int angleIndex, int radius) {
        if (angleIndex < 0 || angleIndex >= axis.steps() || radius < 0 || radius >= radiusMax) {
            throw new IndexOutOfBoundsException(
                    "Cell [" + angleIndex + "][" + radius + "] outside " + axis.steps() + "x" + radiusMax);
        }
        return cells[angleIndex * radiusMax + radius] & 0xFF;
    }

    /** Sum of one angle row over all radii. */
    long radialSum(int angleIndex) {
        long sum = 0;
        int base = angleIndex * radiusMax;
        for (int r = 0; r < radiusMax; r++) {
            sum += cells[base + r] & 0xFF;
        }
        return sum;
    }

    /** Number of cells holding any signal. */
    public int countNonZero() {
        int n = 0;
        for (byte c : cells) {
            if (c != 0) n++;
        }
        return n;
    }

    /**
     * Render as an 8-bit gray image for inspection or storage.
     *
     * @throws IllegalStateException if the grid has no cells
     */
    public BufferedImage toImage(PolarImageLayout layout) {
        if (cells.length == 0) {
            throw new IllegalStateException("Cannot render an empty polar grid");
        }
        int w = layout.imageWidth(axis.steps(), radiusMax);
        int h = layout.imageHeight(axis.steps(), radiusMax);
        byte[] pixels = new byte[w * h];
        for (int a = 0; a < axis.steps(); a++) {
            for (int r = 0; r < radiusMax; r++) {
                pixels[layout.y(a, r, radiusMax) * w + layout.x(a, r)] = cells[a * radiusMax + r];
            }
        }
        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_BYTE_GRAY);
        out.getRaster().setDataElements(0, 0, w, h, pixels);
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PolarGrid other)) return false;
        return radiusMax == other.radiusMax && axis.equals(other.axis) && Arrays.equals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * axis.hashCode() + radiusMax) + Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        return "PolarGrid[" + axis.steps() + " angles x " + radiusMax + " radii, " + axis.angleStep() + "° from "
                + axis.angleMin() + "°]";
    }
}
