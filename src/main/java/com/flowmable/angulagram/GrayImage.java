package com.flowmable.angulagram;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Immutable 8-bit grayscale raster, row-major with the origin at the top-left.
 * <p>
 * This is the only image type the polar transforms read. Colour images are
 * collapsed with {@link ColorSpaceUtils#gray(int, int, int)}.
 */
public final class GrayImage {

    private final int width;
    private final int height;
    private final byte[] samples;

    private GrayImage(int width, int height, byte[] samples) {
        this.width = width;
        this.height = height;
        this.samples = samples;
    }

    /**
     * Wrap a copy of raw samples.
     *
     * @param samples row-major, {@code width * height} unsigned bytes
     */
    public static GrayImage of(int width, int height, byte[] samples) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image must be non-empty, got " + width + "x" + height);
        }
        if (samples.length != width * height) {
            throw new IllegalArgumentException(
                    "Expected " + (width * height) + " samples for " + width + "x" + height + ", got " + samples.length);
        }
        return new GrayImage(width, height, samples.clone());
    }

    /** Uniform image, mostly useful for calibration and tests. */
    public static GrayImage filled(int width, int height, int value) {
        byte[] samples = new byte[width * height];
        Arrays.fill(samples, (byte) value);
        return of(width, height, samples);
    }

    /**
     * Collapse a decoded image to gray. Alpha is ignored.
     */
    public static GrayImage from(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        byte[] samples = new byte[w * h];
        if (image.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            // getRGB would push these through the linear gray colour space
            image.getRaster().getDataElements(0, 0, w, h, samples);
            return new GrayImage(w, h, samples);
        }
        if (image.getType() == BufferedImage.TYPE_USHORT_GRAY) {
            // 16-bit gray keeps its high byte
            int[] wide = image.getRaster().getSamples(0, 0, w, h, 0, (int[]) null);
            for (int i = 0; i < wide.length; i++) {
                samples[i] = (byte) (wide[i] >> 8);
            }
            return new GrayImage(w, h, samples);
        }
        int[] row = new int[w];
        for (int y = 0; y < h; y++) {
            image.getRGB(0, y, w, 1, row, 0, w);
            for (int x = 0; x < w; x++) {
                int argb = row[x];
                int r = (argb >> 16) & 0xFF;
                int g = (argb >> 8) & 0xFF;
                int b = argb & 0xFF;
                samples[y * w + x] = (byte) ColorSpaceUtils.gray(r, g, b);
            }
        }
        return new GrayImage(w, h, samples);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public boolean contains(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    /** Sample at {@code (x, y)} in {@code [0, 255]}. */
    public int get(int x, int y) {
        return samples[y * width + x] & 0xFF;
    }

    public BufferedImage toBufferedImage() {
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        out.getRaster().setDataElements(0, 0, width, height, samples.clone());
        return out;
    }
}
