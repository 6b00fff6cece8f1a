package com.flowmable.angulagram;

import java.awt.image.BufferedImage;

/**
 * Brightness / contrast boost for the preview of a separation zone.
 * The result is for figures only and never feeds the evaluation.
 */
public final class PreviewRenderer {

    private PreviewRenderer() {}

    /**
     * Per channel: {@code saturate(|alpha * v + brightness|)} with {@code alpha = (contrast + 100) / 100}.
     */
    public static BufferedImage adjust(BufferedImage src, double brightness, double contrast) {
        double alpha = (contrast + 100.0) / 100.0;
        int w = src.getWidth();
        int h = src.getHeight();
        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        int[] row = new int[w];
        for (int y = 0; y < h; y++) {
            src.getRGB(0, y, w, 1, row, 0, w);
            for (int x = 0; x < w; x++) {
                int rgb = row[x];
                int r = scale((rgb >> 16) & 0xFF, alpha, brightness);
                int g = scale((rgb >> 8) & 0xFF, alpha, brightness);
                int b = scale(rgb & 0xFF, alpha, brightness);
                row[x] = (r << 16) | (g << 8) | b;
            }
            out.setRGB(0, y, w, 1, row, 0, w);
        }
        return out;
    }

    private static int scale(int v, double alpha, double beta) {
        return ColorSpaceUtils.clamp8(Math.round(Math.abs(alpha * v + beta)));
    }
}
