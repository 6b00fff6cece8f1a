package com.flowmable.angulagram;

import java.awt.image.BufferedImage;
import java.util.Random;

/**
 * Synthetic separation patterns shared by the tests.
 */
final class PatternImages {

    private PatternImages() {}

    static final int WHITE = 255;
    static final int BLACK = 0;

    /** White plate with one dark pixel. */
    static GrayImage singleDarkPixel(int w, int h, int x, int y) {
        byte[] px = filledSamples(w, h, WHITE);
        px[y * w + x] = (byte) BLACK;
        return GrayImage.of(w, h, px);
    }

    /**
     * White plate with a dark straight stream leaving {@code (ox, oy)} at {@code degrees},
     * measured the way {@code reference} measures angles, for radii {@code 1..length}.
     */
    static GrayImage darkRay(int w, int h, int ox, int oy, AngleReference reference, double degrees, int length) {
        byte[] px = filledSamples(w, h, WHITE);
        double phi = Math.toRadians(degrees);
        for (int r = 1; r <= length; r++) {
            double along = r * Math.cos(phi);
            double across = r * Math.sin(phi);
            long dx = Math.round(reference == AngleReference.HORIZONTAL ? along : across);
            long dy = Math.round(reference == AngleReference.HORIZONTAL ? across : along);
            int x = (int) (ox + dx);
            int y = (int) (oy - dy);
            if (x >= 0 && x < w && y >= 0 && y < h) {
                px[y * w + x] = (byte) BLACK;
            }
        }
        return GrayImage.of(w, h, px);
    }

    /** Horizontal ramp: value equals the column index (mod 256). */
    static GrayImage columnRamp(int w, int h) {
        byte[] px = new byte[w * h];
        for (int y = 0; y < h; y++)
            for (int x = 0; x < w; x++)
                px[y * w + x] = (byte) (x & 0xFF);
        return GrayImage.of(w, h, px);
    }

    static GrayImage noise(int w, int h, long seed) {
        byte[] px = new byte[w * h];
        new Random(seed).nextBytes(px);
        return GrayImage.of(w, h, px);
    }

    static BufferedImage solidRgb(int w, int h, int rgb) {
        BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < h; y++)
            for (int x = 0; x < w; x++)
                img.setRGB(x, y, rgb);
        return img;
    }

    /** Every pixel encodes its own position: red = x, green = y. */
    static BufferedImage positionCoded(int w, int h) {
        BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < h; y++)
            for (int x = 0; x < w; x++)
                img.setRGB(x, y, ((x & 0xFF) << 16) | ((y & 0xFF) << 8));
        return img;
    }

    private static byte[] filledSamples(int w, int h, int value) {
        byte[] px = new byte[w * h];
        java.util.Arrays.fill(px, (byte) value);
        return px;
    }
}
