package com.flowmable.angulagram;

/**
 * Colour conversions used when preparing a separation zone.
 * <p>
 * Gray uses the ITU-R BT.601 luma weights. HLS follows the usual hexcone model with
 * hue in degrees and lightness / saturation scaled to 0–255.
 */
public final class ColorSpaceUtils {

    private ColorSpaceUtils() {}

    private static final double WEIGHT_R = 0.299;
    private static final double WEIGHT_G = 0.587;
    private static final double WEIGHT_B = 0.114;

    /**
     * BT.601 luma of an sRGB pixel (0–255 per channel), rounded to 0–255.
     */
    public static int gray(int r, int g, int b) {
        return clamp8(Math.round(WEIGHT_R * r + WEIGHT_G * g + WEIGHT_B * b));
    }

    /**
     * Convert sRGB (0–255 per channel) to [H (0–360), L (0–255), S (0–255)].
     */
    public static double[] rgbToHls(int r, int g, int b) {
        double rn = r / 255.0;
        double gn = g / 255.0;
        double bn = b / 255.0;
        double max = Math.max(rn, Math.max(gn, bn));
        double min = Math.min(rn, Math.min(gn, bn));
        double l = (max + min) / 2.0;

        if (max == min) {
            return new double[]{0.0, l * 255.0, 0.0};
        }

        double d = max - min;
        double s = l < 0.5 ? d / (max + min) : d / (2.0 - max - min);
        double h;
        if (max == rn) {
            h = 60.0 * (gn - bn) / d;
            if (h < 0) h += 360.0;
        } else if (max == gn) {
            h = 60.0 * ((bn - rn) / d + 2.0);
        } else {
            h = 60.0 * ((rn - gn) / d + 4.0);
        }
        return new double[]{h, l * 255.0, s * 255.0};
    }

    /**
     * Convert [H (0–360), L (0–255), S (0–255)] back to packed {@code 0xRRGGBB}.
     */
    public static int hlsToRgb(double h, double l, double s) {
        double ln = l / 255.0;
        double sn = s / 255.0;
        if (sn <= 0) {
            int v = clamp8(Math.round(ln * 255.0));
            return (v << 16) | (v << 8) | v;
        }
        double q = ln < 0.5 ? ln * (1.0 + sn) : ln + sn - ln * sn;
        double p = 2.0 * ln - q;
        int r = clamp8(Math.round(hueToChannel(p, q, h + 120.0) * 255.0));
        int g = clamp8(Math.round(hueToChannel(p, q, h) * 255.0));
        int b = clamp8(Math.round(hueToChannel(p, q, h - 120.0) * 255.0));
        return (r << 16) | (g << 8) | b;
    }

    /**
     * Add {@code delta} to the HLS saturation of a packed RGB pixel, saturating at 0 and 255.
     */
    public static int adjustSaturation(int rgb, int delta) {
        int r = (rgb >> 16) & 0xFF;
        int g = (rgb >> 8) & 0xFF;
        int b = rgb & 0xFF;
        double[] hls = rgbToHls(r, g, b);
        double s = clamp8(Math.round(hls[2]) + delta);
        return hlsToRgb(hls[0], hls[1], s);
    }

    private static double hueToChannel(double p, double q, double h) {
        if (h < 0) h += 360.0;
        if (h >= 360.0) h -= 360.0;
        if (h < 60.0) return p + (q - p) * h / 60.0;
        if (h < 180.0) return q;
        if (h < 240.0) return p + (q - p) * (240.0 - h) / 60.0;
        return p;
    }

    static int clamp8(long v) {
        return (int) Math.max(0, Math.min(255, v));
    }
}
