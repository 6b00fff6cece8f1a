package com.flowmable.angulagram;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Path2D;
import java.awt.image.BufferedImage;
import java.util.Locale;

/**
 * Draws an {@link AngularProfile} as a line chart with light guides every 15°.
 */
public final class AngulagramPlotRenderer {

    private AngulagramPlotRenderer() {}

    private static final int WIDTH = 800;
    private static final int HEIGHT = 600;
    private static final int MARGIN_LEFT = 80;
    private static final int MARGIN_RIGHT = 30;
    private static final int MARGIN_TOP = 30;
    private static final int MARGIN_BOTTOM = 70;
    private static final double GUIDE_SPACING_DEG = 15.0;

    private static final Color GUIDE = new Color(211, 211, 211);
    private static final Color LINE = new Color(31, 119, 180);

    /**
     * @param angleFrom left edge of the angle axis in degrees
     * @param angleTo   right edge of the angle axis in degrees
     */
    public static BufferedImage render(AngularProfile profile, double angleFrom, double angleTo,
                                       String xLabel, String yLabel) {
        if (!(angleTo > angleFrom)) {
            throw new IllegalArgumentException("Empty angle range " + angleFrom + " - " + angleTo);
        }
        BufferedImage img = new BufferedImage(WIDTH, HEIGHT, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2 = img.createGraphics();
        g2.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g2.setColor(Color.WHITE);
        g2.fillRect(0, 0, WIDTH, HEIGHT);

        int plotW = WIDTH - MARGIN_LEFT - MARGIN_RIGHT;
        int plotH = HEIGHT - MARGIN_TOP - MARGIN_BOTTOM;

        double yMin = 0;
        double yMax = 0;
        for (double v : profile.values()) {
            yMin = Math.min(yMin, v);
            yMax = Math.max(yMax, v);
        }
        if (yMax <= yMin) yMax = yMin + 1;

        g2.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 12));
        FontMetrics fm = g2.getFontMetrics();

        // Guides and tick labels
        double first = Math.ceil(angleFrom / GUIDE_SPACING_DEG) * GUIDE_SPACING_DEG;
        for (double a = first; a <= angleTo; a += GUIDE_SPACING_DEG) {
            int x = MARGIN_LEFT + (int) Math.round((a - angleFrom) / (angleTo - angleFrom) * plotW);
            g2.setColor(GUIDE);
            g2.drawLine(x, MARGIN_TOP, x, MARGIN_TOP + plotH);
            String label = String.format(Locale.ROOT, "%.0f", a);
            g2.setColor(Color.BLACK);
            g2.drawString(label, x - fm.stringWidth(label) / 2, MARGIN_TOP + plotH + fm.getHeight() + 2);
        }
        for (int i = 0; i <= 4; i++) {
            double v = yMin + (yMax - yMin) * i / 4.0;
            int y = MARGIN_TOP + plotH - (int) Math.round(plotH * i / 4.0);
            String label = formatValue(v);
            g2.drawString(label, MARGIN_LEFT - fm.stringWidth(label) - 6, y + fm.getAscent() / 2);
        }

        g2.setColor(Color.BLACK);
        g2.drawRect(MARGIN_LEFT, MARGIN_TOP, plotW, plotH);
        g2.drawString(xLabel, MARGIN_LEFT + (plotW - fm.stringWidth(xLabel)) / 2, HEIGHT - 20);
        Graphics2D rotatedLabel = (Graphics2D) g2.create();
        rotatedLabel.rotate(-Math.PI / 2);
        rotatedLabel.drawString(yLabel, -(MARGIN_TOP + (plotH + fm.stringWidth(yLabel)) / 2), 20);
        rotatedLabel.dispose();

        // Profile
        Path2D.Double path = new Path2D.Double();
        boolean started = false;
        double[] angles = profile.angles();
        double[] values = profile.values();
        for (int i = 0; i < angles.length; i++) {
            if (angles[i] < angleFrom || angles[i] > angleTo) continue;
            double px = MARGIN_LEFT + (angles[i] - angleFrom) / (angleTo - angleFrom) * plotW;
            double py = MARGIN_TOP + plotH - (values[i] - yMin) / (yMax - yMin) * plotH;
            if (started) {
                path.lineTo(px, py);
            } else {
                path.moveTo(px, py);
                started = true;
            }
        }
        g2.setClip(MARGIN_LEFT, MARGIN_TOP, plotW + 1, plotH + 1);
        g2.setColor(LINE);
        g2.setStroke(new BasicStroke(1.5f));
        g2.draw(path);
        g2.dispose();
        return img;
    }

    private static String formatValue(double v) {
        return Math.abs(v) >= 1000 ? String.format(Locale.ROOT, "%.3g", v) : String.format(Locale.ROOT, "%.2f", v);
    }
}
