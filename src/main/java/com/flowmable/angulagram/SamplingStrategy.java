package com.flowmable.angulagram;

/**
 * Resamples a Cartesian image into a polar grid for a given geometry.
 * <p>
 * Implementations are stateless apart from their configuration and may be reused
 * across images. The returned grid is fully populated and never modified afterwards.
 */
public interface SamplingStrategy {

    /**
     * @param image    source raster; never modified
     * @param geometry origin, angle window and radius range, typically resolved from {@code image}
     * @return a grid of {@code geometry.angleSteps() x geometry.radiusMax()} cells
     */
    PolarGrid sample(GrayImage image, ScanGeometry geometry);

    MappingDirection direction();
}
