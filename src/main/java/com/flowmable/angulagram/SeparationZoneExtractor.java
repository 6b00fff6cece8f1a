package com.flowmable.angulagram;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;

/**
 * Cuts the separation zone out of a photograph and turns it into the gray image the
 * polar transform reads.
 * <p>
 * The zone is the rectangle of {@code zoneWidth x zoneHeight} whose bottom edge sits on
 * the inlet row, centred on the inlet column; after extraction the inlet is therefore at
 * the bottom middle ({@link OriginPlacement#BOTTOM_MIDDLE}).
 */
public class SeparationZoneExtractor {

    private static final Logger logger = LoggerFactory.getLogger(SeparationZoneExtractor.class);

    /**
     * Cropped colour zone (for the preview) and its evaluated gray counterpart.
     */
    public record SeparationZone(BufferedImage colorZone, GrayImage grayZone) {}

    /**
     * @throws InvalidGeometryException if the zone does not overlap the rotated image
     * @throws IllegalArgumentException if {@code levelHigh <= levelLow}
     */
    public SeparationZone extract(BufferedImage photo, ZoneSettings zone) {
        if (!(zone.levelHigh() > zone.levelLow())) {
            throw new IllegalArgumentException(
                    "Upper gray level must exceed the lower one, got " + zone.levelLow() + " - " + zone.levelHigh());
        }

        // 1. Rotate
        BufferedImage rotated = rotateBound(photo, zone.rotation());

        // 2. Crop
        BufferedImage cut = crop(rotated, zone);

        // 3. Mirror
        if (zone.mirror()) {
            cut = mirror(cut);
        }

        // 4-6. Saturation, gray, levels
        GrayImage gray = toEvaluatedGray(cut, zone);
        logger.info("Separation zone {}x{} extracted (rotation {}°, inlet ({}, {}), {})",
                gray.width(), gray.height(), zone.rotation(), zone.inletX(), zone.inletY(),
                zone.mirror() ? "mirrored" : "not mirrored");
        return new SeparationZone(cut, gray);
    }

    /**
     * Rotate clockwise by {@code degrees}, growing the canvas so no corner is cut off.
     * Uncovered areas are black.
     */
    static BufferedImage rotateBound(BufferedImage src, double degrees) {
        int w = src.getWidth();
        int h = src.getHeight();
        double theta = Math.toRadians(degrees);
        double cos = Math.abs(Math.cos(theta));
        double sin = Math.abs(Math.sin(theta));
        int nw = Math.max(1, (int) (h * sin + w * cos));
        int nh = Math.max(1, (int) (h * cos + w * sin));

        BufferedImage dst = new BufferedImage(nw, nh, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2 = dst.createGraphics();
        g2.setColor(Color.BLACK);
        g2.fillRect(0, 0, nw, nh);
        if (degrees != 0) {
            g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        }
        AffineTransform at = new AffineTransform();
        at.translate(nw / 2, nh / 2);
        at.rotate(theta);
        at.translate(-(w / 2), -(h / 2));
        g2.drawImage(src, at, null);
        g2.dispose();
        return dst;
    }

    static BufferedImage crop(BufferedImage src, ZoneSettings zone) {
        int x0 = (int) (zone.inletX() - zone.zoneWidth() / 2);
        int x1 = (int) (zone.inletX() + zone.zoneWidth() / 2);
        int y0 = (int) (zone.inletY() - zone.zoneHeight());
        int y1 = (int) zone.inletY();

        int cx0 = Math.max(0, x0);
        int cx1 = Math.min(src.getWidth(), x1);
        int cy0 = Math.max(0, y0);
        int cy1 = Math.min(src.getHeight(), y1);
        if (cx1 <= cx0 || cy1 <= cy0) {
            throw new InvalidGeometryException(String.format(
                    "Separation zone [%d, %d) x [%d, %d) does not overlap the %dx%d image",
                    x0, x1, y0, y1, src.getWidth(), src.getHeight()));
        }
        if (cx0 != x0 || cx1 != x1 || cy0 != y0 || cy1 != y1) {
            logger.warn("Separation zone [{}, {}) x [{}, {}) clipped to the {}x{} image",
                    x0, x1, y0, y1, src.getWidth(), src.getHeight());
        }

        int w = cx1 - cx0;
        int h = cy1 - cy0;
        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        int[] row = new int[w];
        for (int y = 0; y < h; y++) {
            src.getRGB(cx0, cy0 + y, w, 1, row, 0, w);
            out.setRGB(0, y, w, 1, row, 0, w);
        }
        return out;
    }

    static BufferedImage mirror(BufferedImage src) {
        int w = src.getWidth();
        int h = src.getHeight();
        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                out.setRGB(w - 1 - x, y, src.getRGB(x, y));
            }
        }
        return out;
    }

    static GrayImage toEvaluatedGray(BufferedImage zoneImage, ZoneSettings zone) {
        int w = zoneImage.getWidth();
        int h = zoneImage.getHeight();
        double window = zone.levelHigh() - zone.levelLow();
        byte[] samples = new byte[w * h];

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int rgb = zoneImage.getRGB(x, y);
                if (zone.saturation() != 0) {
                    rgb = ColorSpaceUtils.adjustSaturation(rgb, zone.saturation());
                }
                int g = ColorSpaceUtils.gray((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
                int shifted = ColorSpaceUtils.clamp8(Math.round(g - zone.levelLow()));
                samples[y * w + x] = (byte) ColorSpaceUtils.clamp8(Math.round(shifted * 255.0 / window));
            }
        }
        return GrayImage.of(w, h, samples);
    }
}
