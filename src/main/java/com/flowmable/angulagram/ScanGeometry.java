package com.flowmable.angulagram;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Constants shared by both mappings and the integrator for one image.
 * <p>
 * {@code radiusMax} is the distance from the origin to the farthest image corner, rounded
 * half away from zero, so the grid may reach past the image; such samples are rejected by
 * the mappings. This differs from truncating {@code hypot(width - 1, originY)}, which gives
 * one radius less for a 41x41 image with a left-middle inlet (44 rather than 45) and only
 * looks at the top-right corner.
 *
 * @param originX        inlet x in pixels
 * @param originY        inlet y in pixels (image rows grow downward)
 * @param angleReference axis angles are measured from
 * @param axis           angle window and resolution
 * @param radiusMax      number of radius columns; valid radii are {@code [0, radiusMax)}
 */
public record ScanGeometry(
        double originX,
        double originY,
        AngleReference angleReference,
        AngleAxis axis,
        int radiusMax
) {
    private static final Logger logger = LoggerFactory.getLogger(ScanGeometry.class);

    // Largest byte[] most VMs will allocate.
    private static final long MAX_ARRAY_CELLS = Integer.MAX_VALUE - 8;

    /**
     * Derive the geometry for an image of the given shape.
     *
     * @throws InvalidGeometryException if the settings do not describe a usable grid
     */
    public static ScanGeometry resolve(ScanSettings settings, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new InvalidGeometryException("Image must be non-empty, got " + width + "x" + height);
        }
        double originX = settings.originPlacement().originX(width, settings.originX());
        double originY = settings.originPlacement().originY(height, settings.originY());
        if (!Double.isFinite(originX) || !Double.isFinite(originY)) {
            throw new InvalidGeometryException("Origin must be finite, got (" + originX + ", " + originY + ")");
        }

        AngleAxis axis = AngleAxis.of(settings.angleMin(), settings.angleSpan(), settings.angleStep());

        double farthest = 0;
        for (int cx : new int[]{0, width - 1}) {
            for (int cy : new int[]{0, height - 1}) {
                farthest = Math.max(farthest, Math.hypot(cx - originX, cy - originY));
            }
        }
        int radiusMax = (int) Math.round(farthest);

        long cells = (long) axis.steps() * radiusMax;
        long limit = Math.min(settings.maxGridCells(), MAX_ARRAY_CELLS);
        if (cells > limit) {
            throw new InvalidGeometryException(String.format(
                    "Polar grid of %d angles x %d radii (%d cells) exceeds the limit of %d cells",
                    axis.steps(), radiusMax, cells, limit));
        }

        logger.info("Image {}x{}, origin ({}, {}), max radius {}, {} angle steps of {}° from {}°",
                width, height, originX, originY, radiusMax, axis.steps(), axis.angleStep(), axis.angleMin());
        return new ScanGeometry(originX, originY, settings.angleReference(), axis, radiusMax);
    }

    public int angleSteps() {
        return axis.steps();
    }

    public long cellCount() {
        return (long) axis.steps() * radiusMax;
    }
}
