package com.flowmable.angulagram;

/**
 * Output of one transform.
 *
 * @param geometry resolved scan geometry
 * @param mapping  resampling formulation that filled the grid
 * @param grid     polar signal, {@code angleSteps x radiusMax}
 * @param profile  radial integrals per angle
 */
public record AngulagramResult(
        ScanGeometry geometry,
        MappingDirection mapping,
        PolarGrid grid,
        AngularProfile profile
) {}
