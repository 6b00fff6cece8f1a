package com.flowmable.angulagram;

/**
 * How the separation zone is cut out of a photograph before evaluation.
 * <p>
 * Applied in order: rotation, crop around the inlet, optional mirror, saturation
 * increase, grayscale, level remap. Preview brightness and contrast only affect the
 * preview image and never the evaluated data.
 *
 * @param rotation          clockwise rotation in degrees applied to the whole photograph
 * @param saturation        HLS saturation increase (may be negative)
 * @param inletX            inlet x in the rotated photograph, in pixels
 * @param inletY            inlet y in the rotated photograph, in pixels
 * @param zoneWidth         width of the zone, centred on the inlet
 * @param zoneHeight        height of the zone, ending at the inlet row
 * @param levelLow          gray level mapped to 0
 * @param levelHigh         gray level mapped to 255
 * @param previewBrightness added to every preview channel
 * @param previewContrast   preview contrast in roughly -100..100
 * @param mirror            flip the zone horizontally
 */
public record ZoneSettings(
        double rotation,
        int saturation,
        double inletX,
        double inletY,
        double zoneWidth,
        double zoneHeight,
        double levelLow,
        double levelHigh,
        double previewBrightness,
        double previewContrast,
        boolean mirror
) {
    public static final ZoneSettings DEFAULT = new ZoneSettings(
            0.0,             // rotation
            0,               // saturation
            0.0, 0.0,        // inlet
            1000.0, 1000.0,  // zone size
            0.0, 255.0,      // levels
            25.0, 25.0,      // preview brightness / contrast
            false            // mirror
    );
}
