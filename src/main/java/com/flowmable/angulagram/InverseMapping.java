package com.flowmable.angulagram;

import java.util.stream.IntStream;

/**
 * Target-sampling transform ("algorithm b"): every polar cell looks up the source
 * pixel it corresponds to.
 * <p>
 * For cell {@code (i, r)} with {@code φ = i * step - offset}, the offsets {@code dx, dy}
 * follow the {@link AngleReference} and are rounded to whole pixels; the source pixel is
 * {@code (originX + dx, originY - dy)}. Cells whose pixel lies outside the image get 0.
 * <p>
 * Every cell is written exactly once, so the grid has no gaps. At large radii
 * neighbouring cells read the same pixel or skip pixels between rays, which is the
 * opposite aliasing to {@link ForwardMapping}.
 */
public class InverseMapping implements SamplingStrategy {

    private final SignalPolarity polarity;
    private final boolean parallel;

    public InverseMapping() {
        this(SignalPolarity.DARK_ON_LIGHT, false);
    }

    public InverseMapping(SignalPolarity polarity, boolean parallel) {
        this.polarity = polarity;
        this.parallel = parallel;
    }

    @Override
    public MappingDirection direction() {
        return MappingDirection.INVERSE;
    }

    @Override
    public PolarGrid sample(GrayImage image, ScanGeometry geometry) {
        AngleAxis axis = geometry.axis();
        int radiusMax = geometry.radiusMax();
        byte[] cells = new byte[Math.toIntExact(geometry.cellCount())];

        IntStream angles = IntStream.range(0, axis.steps());
        if (parallel) {
            angles = angles.parallel();
        }
        angles.forEach(i -> gatherRow(image, geometry, i, cells, i * radiusMax));
        return new PolarGrid(axis, radiusMax, cells);
    }

    private void gatherRow(GrayImage image, ScanGeometry geometry, int angleIndex, byte[] cells, int base) {
        double phi = Math.toRadians(geometry.axis().angleAt(angleIndex));
        double cos = Math.cos(phi);
        double sin = Math.sin(phi);
        AngleReference reference = geometry.angleReference();

        for (int r = 0; r < geometry.radiusMax(); r++) {
            int x = (int) Math.floor(geometry.originX() + reference.dx(r, cos, sin));
            int y = (int) Math.floor(geometry.originY() - reference.dy(r, cos, sin));
            cells[base + r] = image.contains(x, y) ? (byte) polarity.signal(image.get(x, y)) : 0;
        }
    }
}
