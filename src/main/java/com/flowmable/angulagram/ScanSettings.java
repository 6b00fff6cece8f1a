package com.flowmable.angulagram;

/**
 * Configuration of the polar scan: where the inlet is, which angles are sampled,
 * and which resampling formulation fills the grid.
 * <p>
 * Validated when resolved against an image by {@link ScanGeometry#resolve}.
 *
 * @param originPlacement how the origin is derived from the image shape
 * @param originX         origin x in pixels, used only with {@link OriginPlacement#EXPLICIT}
 * @param originY         origin y in pixels, used only with {@link OriginPlacement#EXPLICIT}
 * @param angleReference  axis angles are measured from
 * @param angleMin        first angle of the window in degrees (e.g. -60)
 * @param angleSpan       width of the window in degrees (e.g. 120)
 * @param angleStep       angular resolution in degrees, clamped to {@link AngleAxis#MIN_ANGLE_STEP}
 * @param mapping         forward (scatter) or inverse (gather) resampling
 * @param forwardIndexing how the forward mapping turns an angle into a row index
 * @param polarity        whether dark or light pixels carry the signal
 * @param normalize       divide the profile by its maximum
 * @param parallel        spread the per-column / per-angle loops over the common pool
 * @param maxGridCells    upper bound on {@code angleSteps * radiusMax} checked before allocation
 */
public record ScanSettings(
        OriginPlacement originPlacement,
        double originX,
        double originY,
        AngleReference angleReference,
        double angleMin,
        double angleSpan,
        double angleStep,
        MappingDirection mapping,
        ForwardIndexing forwardIndexing,
        SignalPolarity polarity,
        boolean normalize,
        boolean parallel,
        long maxGridCells
) {
    public static final long DEFAULT_MAX_GRID_CELLS = 50_000_000L;

    /** Angulagram of an extracted separation zone: ±60° from vertical at 0.1°. */
    public static final ScanSettings DEFAULT = new ScanSettings(
            OriginPlacement.BOTTOM_MIDDLE,
            0.0, 0.0,
            AngleReference.VERTICAL,
            -60.0, // angleMin
            120.0, // angleSpan
            0.1,   // angleStep
            MappingDirection.INVERSE,
            ForwardIndexing.WHOLE_DEGREES,
            SignalPolarity.DARK_ON_LIGHT,
            true,  // normalize
            true,  // parallel
            DEFAULT_MAX_GRID_CELLS
    );

    /** Full circle around a left-edge inlet, -180° to +180° from +x at 1°. */
    public static final ScanSettings FULL_CIRCLE = new ScanSettings(
            OriginPlacement.LEFT_MIDDLE,
            0.0, 0.0,
            AngleReference.HORIZONTAL,
            -180.0,
            360.0,
            1.0,
            MappingDirection.INVERSE,
            ForwardIndexing.WHOLE_DEGREES,
            SignalPolarity.DARK_ON_LIGHT,
            true,
            true,
            DEFAULT_MAX_GRID_CELLS
    );

    public ScanSettings withMapping(MappingDirection mapping) {
        return new ScanSettings(originPlacement, originX, originY, angleReference, angleMin, angleSpan,
                angleStep, mapping, forwardIndexing, polarity, normalize, parallel, maxGridCells);
    }

    public ScanSettings withAngleStep(double angleStep) {
        return new ScanSettings(originPlacement, originX, originY, angleReference, angleMin, angleSpan,
                angleStep, mapping, forwardIndexing, polarity, normalize, parallel, maxGridCells);
    }

    public ScanSettings withAngleWindow(double angleMin, double angleSpan) {
        return new ScanSettings(originPlacement, originX, originY, angleReference, angleMin, angleSpan,
                angleStep, mapping, forwardIndexing, polarity, normalize, parallel, maxGridCells);
    }

    public ScanSettings withOrigin(double originX, double originY) {
        return new ScanSettings(OriginPlacement.EXPLICIT, originX, originY, angleReference, angleMin, angleSpan,
                angleStep, mapping, forwardIndexing, polarity, normalize, parallel, maxGridCells);
    }

    public ScanSettings withForwardIndexing(ForwardIndexing forwardIndexing) {
        return new ScanSettings(originPlacement, originX, originY, angleReference, angleMin, angleSpan,
                angleStep, mapping, forwardIndexing, polarity, normalize, parallel, maxGridCells);
    }

    public ScanSettings withPolarity(SignalPolarity polarity) {
        return new ScanSettings(originPlacement, originX, originY, angleReference, angleMin, angleSpan,
                angleStep, mapping, forwardIndexing, polarity, normalize, parallel, maxGridCells);
    }

    public ScanSettings withNormalize(boolean normalize) {
        return new ScanSettings(originPlacement, originX, originY, angleReference, angleMin, angleSpan,
                angleStep, mapping, forwardIndexing, polarity, normalize, parallel, maxGridCells);
    }

    public ScanSettings withParallel(boolean parallel) {
        return new ScanSettings(originPlacement, originX, originY, angleReference, angleMin, angleSpan,
                angleStep, mapping, forwardIndexing, polarity, normalize, parallel, maxGridCells);
    }

    public ScanSettings withMaxGridCells(long maxGridCells) {
        return new ScanSettings(originPlacement, originX, originY, angleReference, angleMin, angleSpan,
                angleStep, mapping, forwardIndexing, polarity, normalize, parallel, maxGridCells);
    }
}
