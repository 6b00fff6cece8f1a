package com.flowmable.angulagram;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicIntegerArray;
import java.util.stream.IntStream;

/**
 * Source-sampling transform ("algorithm a"): every source pixel is projected to the
 * polar cell it falls into.
 * <p>
 * For pixel {@code (x, y)} with {@code (ox, oy) = (x - originX, originY - y)}:
 * <pre>
 *   r     = round(hypot(ox, oy))                       skipped when 0
 *   index = round(deg(asin(s / r))) + offsetIndex
 * </pre>
 * where {@code s} is {@code oy} for {@link AngleReference#HORIZONTAL} and {@code ox} for
 * {@link AngleReference#VERTICAL}. The index above is {@link ForwardIndexing#WHOLE_DEGREES};
 * {@link ForwardIndexing#ANGLE_STEPS} divides the degrees by the step first. Pixels whose
 * cell lies outside the grid are dropped.
 * <p>
 * {@code asin} only spans ±90°, so pixels behind the origin fold onto the front
 * half-plane and cells outside ±90° are never written. The placements in
 * {@link OriginPlacement} keep the whole image in front of the inlet.
 * <p>
 * Several pixels can land on one cell; no averaging is done and the last pixel in
 * column-major scan order ({@code x} outer, {@code y} inner) wins. Cells nobody maps to
 * stay 0. The parallel path yields the same grid.
 */
public class ForwardMapping implements SamplingStrategy {

    private static final Logger logger = LoggerFactory.getLogger(ForwardMapping.class);

    private final SignalPolarity polarity;
    private final ForwardIndexing indexing;
    private final boolean parallel;

    public ForwardMapping() {
        this(SignalPolarity.DARK_ON_LIGHT, false);
    }

    public ForwardMapping(SignalPolarity polarity, boolean parallel) {
        this(polarity, ForwardIndexing.WHOLE_DEGREES, parallel);
    }

    public ForwardMapping(SignalPolarity polarity, ForwardIndexing indexing, boolean parallel) {
        this.polarity = polarity;
        this.indexing = indexing;
        this.parallel = parallel;
    }

    @Override
    public MappingDirection direction() {
        return MappingDirection.FORWARD;
    }

    @Override
    public PolarGrid sample(GrayImage image, ScanGeometry geometry) {
        AngleAxis axis = geometry.axis();
        if (axis.angleMin() < -90 || axis.angleMin() + axis.span() > 90) {
            logger.info("Forward mapping covers ±90° only; cells outside that half-plane stay empty");
        }
        byte[] cells = new byte[Math.toIntExact(geometry.cellCount())];
        if (parallel) {
            scatterParallel(image, geometry, cells);
        } else {
            scatter(image, geometry, cells);
        }
        return new PolarGrid(axis, geometry.radiusMax(), cells);
    }

    private void scatter(GrayImage image, ScanGeometry geometry, byte[] cells) {
        for (int x = 0; x < image.width(); x++) {
            for (int y = 0; y < image.height(); y++) {
                int cell = cellOf(x, y, geometry, indexing);
                if (cell >= 0) {
                    cells[cell] = (byte) polarity.signal(image.get(x, y));
                }
            }
        }
    }

    /*
     * Each cell remembers the highest scan index that hit it, which is the pixel the
     * sequential pass would have written last.
     */
    private void scatterParallel(GrayImage image, ScanGeometry geometry, byte[] cells) {
        int w = image.width();
        int h = image.height();
        AtomicIntegerArray winners = new AtomicIntegerArray(cells.length);

        IntStream.range(0, w).parallel().forEach(x -> {
            for (int y = 0; y < h; y++) {
                int cell = cellOf(x, y, geometry, indexing);
                if (cell >= 0) {
                    int scan = x * h + y + 1; // 0 marks an untouched cell
                    winners.accumulateAndGet(cell, scan, Math::max);
                }
            }
        });

        IntStream.range(0, cells.length).parallel().forEach(cell -> {
            int scan = winners.get(cell);
            if (scan > 0) {
                int x = (scan - 1) / h;
                int y = (scan - 1) % h;
                cells[cell] = (byte) polarity.signal(image.get(x, y));
            }
        });
    }

    /** Flat cell index for a source pixel, or -1 when it maps nowhere. */
    static int cellOf(int x, int y, ScanGeometry geometry, ForwardIndexing indexing) {
        double ox = x - geometry.originX();
        double oy = geometry.originY() - y;

        long r = PixelMath.round(Math.hypot(ox, oy));
        if (r == 0) {
            return -1; // angle undefined at the origin
        }
        if (r >= geometry.radiusMax()) {
            return -1;
        }

        AngleAxis axis = geometry.axis();
        double s = geometry.angleReference().sineComponent(ox, oy);
        double degrees = Math.toDegrees(Math.asin(Math.max(-1.0, Math.min(1.0, s / r))));
        long angleIndex = indexing.angleIndex(degrees, axis);
        if (angleIndex < 0 || angleIndex >= axis.steps()) {
            return -1;
        }
        return (int) angleIndex * geometry.radiusMax() + (int) r;
    }
}
