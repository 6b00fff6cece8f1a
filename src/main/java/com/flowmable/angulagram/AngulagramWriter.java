package com.flowmable.angulagram;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Writes images, profile tables and parameter reports next to the input file.
 * <p>
 * Text files use tab separators and CRLF line ends so they open unchanged in
 * spreadsheet tools on any platform.
 */
public final class AngulagramWriter {

    private static final Logger logger = LoggerFactory.getLogger(AngulagramWriter.class);

    private static final String EOL = "\r\n";

    public static final String PROFILE_HEADER = "Angle (deg)\tIntensity (a.u.)";

    private AngulagramWriter() {}

    /**
     * {@code dir/name.ext} with {@code suffix} → {@code dir/name + suffix}.
     */
    public static Path siblingOf(Path input, String suffix) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return input.resolveSibling(base + suffix);
    }

    public static void writePng(BufferedImage image, Path out) throws IOException {
        if (!ImageIO.write(image, "png", out.toFile())) {
            throw new IOException("No PNG writer available for " + out);
        }
        logger.info("Wrote {} ({}x{})", out, image.getWidth(), image.getHeight());
    }

    /**
     * One {@code angle<TAB>value} row per profile entry. Raw profiles are written as integers.
     *
     * @param withHeader prepend {@link #PROFILE_HEADER}
     */
    public static void writeProfile(AngularProfile profile, Path out, boolean withHeader) throws IOException {
        try (BufferedWriter w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            if (withHeader) {
                w.write(PROFILE_HEADER);
                w.write(EOL);
            }
            for (int i = 0; i < profile.size(); i++) {
                w.write(Double.toString(profile.angleAt(i)));
                w.write('\t');
                w.write(profile.normalized()
                        ? Double.toString(profile.valueAt(i))
                        : Long.toString(profile.integralAt(i)));
                w.write(EOL);
            }
        }
        logger.info("Wrote {} ({} angles)", out, profile.size());
    }

    /**
     * Human-readable record of the settings an angulagram was extracted with.
     */
    public static void writeParameters(Path input, ZoneSettings zone, ScanGeometry geometry,
                                       MappingDirection mapping, Path out) throws IOException {
        AngleAxis axis = geometry.axis();
        try (BufferedWriter w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            line(w, input.getFileName().toString());
            line(w, String.format(Locale.ROOT, "Rotated by %.2f°", zone.rotation()));
            line(w, String.format(Locale.ROOT, "Inlet at (%d, %d)", (int) zone.inletX(), (int) zone.inletY()));
            line(w, String.format(Locale.ROOT, "Zone rectangle width and height (%d, %d)",
                    (int) zone.zoneWidth(), (int) zone.zoneHeight()));
            line(w, "Zone was " + (zone.mirror() ? "mirrored" : "not mirrored") + " horizontally");
            line(w, String.format(Locale.ROOT, "Saturation increase by %d", zone.saturation()));
            line(w, String.format(Locale.ROOT, "Gray levels mapped to %.0f - %.0f", zone.levelLow(), zone.levelHigh()));
            line(w, String.format(Locale.ROOT, "Angles from %.2f° to %.2f° in steps of %.2f° (%s mapping)",
                    axis.angleMin(), axis.angleMin() + axis.span(), axis.angleStep(),
                    mapping.name().toLowerCase(Locale.ROOT)));
        }
        logger.info("Wrote {}", out);
    }

    private static void line(BufferedWriter w, String text) throws IOException {
        w.write(text);
        w.write(EOL);
    }
}
