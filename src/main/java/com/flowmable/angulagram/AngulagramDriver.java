package com.flowmable.angulagram;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;

/**
 * Command-line driver.
 * <pre>
 *   angulagram &lt;image&gt; [-c config.json] [-r N] [-s N] [-i X Y] [-z W H] [-l L H] [-p B C] [-m]
 *                      [--step N] [--forward]
 *   polar      &lt;image&gt; [angleStep] [forward|inverse]
 *   integrate  &lt;polarImage&gt; [noscaling]
 * </pre>
 * Exit status: 0 on success, 1 on a processing error, 2 on a usage error.
 */
public class AngulagramDriver {

    private static final Logger logger = LoggerFactory.getLogger(AngulagramDriver.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  angulagram <image> [-c config.json] [-r N] [-s N] [-i X Y] [-z W H] [-l L H] [-p B C] [-m]"
                    + " [--step N] [--forward]",
            "      Extracts the separation zone and writes .preview.png, .evaluated.png, .angulagram.png,",
            "      .parameters.txt and .angudata.txt next to the image.",
            "  polar <image> [angleStep] [forward|inverse]",
            "      Full-circle polar image around a left-edge inlet (.polar.1.png / .polar.2.png).",
            "  integrate <polarImage> [noscaling]",
            "      Radial integration of a full-circle polar image (.integrated.txt / .integrated.png).");

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length < 2) {
            System.err.println(USAGE);
            return EXIT_USAGE;
        }
        String mode = args[0].toLowerCase(Locale.ROOT);
        Path image = Path.of(args[1]);
        String[] rest = Arrays.copyOfRange(args, 2, args.length);
        try {
            switch (mode) {
                case "angulagram" -> runAngulagram(image, rest);
                case "polar" -> runPolar(image, rest);
                case "integrate" -> runIntegrate(image, rest);
                default -> {
                    System.err.println("Unknown mode: " + args[0]);
                    System.err.println(USAGE);
                    return EXIT_USAGE;
                }
            }
            return EXIT_OK;
        } catch (UsageException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        } catch (AngulagramException | IllegalArgumentException e) {
            logger.error("Cannot evaluate {}: {}", image, e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.error("I/O failure on {}", image, e);
            return EXIT_ERROR;
        }
    }

    static void runAngulagram(Path imageFile, String[] opts) throws IOException {
        AngulagramConfig config = AngulagramConfig.DEFAULT;
        for (int i = 0; i < opts.length; i++) {
            if (opts[i].equals("-c") || opts[i].equals("--config")) {
                config = AngulagramConfig.load(Path.of(value(opts, i, 1)));
            }
        }
        config = applyOptions(config, opts);

        BufferedImage photo = read(imageFile);
        ZoneSettings zone = config.zone();
        SeparationZoneExtractor.SeparationZone extracted = new SeparationZoneExtractor().extract(photo, zone);

        AngulagramWriter.writePng(
                PreviewRenderer.adjust(extracted.colorZone(), zone.previewBrightness(), zone.previewContrast()),
                AngulagramWriter.siblingOf(imageFile, ".preview.png"));

        AngulagramResult result = new AngulagramTransformer(config.scan()).transform(extracted.grayZone());
        AngleAxis axis = result.geometry().axis();

        AngulagramWriter.writePng(result.grid().toImage(PolarImageLayout.RADIUS_ROWS_FLIPPED),
                AngulagramWriter.siblingOf(imageFile, ".evaluated.png"));
        AngulagramWriter.writePng(
                AngulagramPlotRenderer.render(result.profile(), axis.angleMin(), axis.angleMin() + axis.span(),
                        "angle (deg)", result.profile().normalized() ? "rel. signal" : "signal (a.u.)"),
                AngulagramWriter.siblingOf(imageFile, ".angulagram.png"));
        AngulagramWriter.writeParameters(imageFile, zone, result.geometry(), result.mapping(),
                AngulagramWriter.siblingOf(imageFile, ".parameters.txt"));
        AngulagramWriter.writeProfile(result.profile(), AngulagramWriter.siblingOf(imageFile, ".angudata.txt"), true);
    }

    static void runPolar(Path imageFile, String[] opts) throws IOException {
        ScanSettings settings = ScanSettings.FULL_CIRCLE.withNormalize(false);
        for (String opt : opts) {
            switch (opt.toLowerCase(Locale.ROOT)) {
                case "forward" -> settings = settings.withMapping(MappingDirection.FORWARD);
                case "inverse" -> settings = settings.withMapping(MappingDirection.INVERSE);
                default -> settings = settings.withAngleStep(number(opt));
            }
        }
        GrayImage gray = GrayImage.from(read(imageFile));
        PolarGrid grid = new AngulagramTransformer(settings).toPolar(gray);
        String suffix = settings.mapping() == MappingDirection.FORWARD ? ".polar.1.png" : ".polar.2.png";
        AngulagramWriter.writePng(grid.toImage(PolarImageLayout.ANGLE_ROWS), AngulagramWriter.siblingOf(imageFile, suffix));
    }

    static void runIntegrate(Path imageFile, String[] opts) throws IOException {
        boolean scaling = !(opts.length > 0 && opts[0].equals("noscaling"));
        PolarGrid grid = PolarGrid.fromImage(read(imageFile), PolarImageLayout.ANGLE_ROWS, -180.0, 360.0);
        AngularProfile profile = RadialIntegrator.integrate(grid, scaling);
        if (!scaling) {
            logger.info("Maximum intensity: {}", profile.maxIntegral());
        }
        AngulagramWriter.writePng(
                AngulagramPlotRenderer.render(profile, -90.0, 90.0, "angle (deg)", "S(φ) (a.u.)"),
                AngulagramWriter.siblingOf(imageFile, ".integrated.png"));
        AngulagramWriter.writeProfile(profile, AngulagramWriter.siblingOf(imageFile, ".integrated.txt"), false);
    }

    static AngulagramConfig applyOptions(AngulagramConfig config, String[] opts) {
        ZoneSettings z = config.zone();
        ScanSettings scan = config.scan();
        double rotation = z.rotation();
        int saturation = z.saturation();
        double inletX = z.inletX(), inletY = z.inletY();
        double zoneW = z.zoneWidth(), zoneH = z.zoneHeight();
        double low = z.levelLow(), high = z.levelHigh();
        double brightness = z.previewBrightness(), contrast = z.previewContrast();
        boolean mirror = z.mirror();

        for (int i = 0; i < opts.length; i++) {
            switch (opts[i]) {
                case "-c", "--config" -> i++;
                case "-r", "--rot" -> rotation = number(value(opts, i++, 1));
                case "-s", "--sat" -> saturation = (int) number(value(opts, i++, 1));
                case "-i", "--inlet" -> {
                    inletX = number(value(opts, i, 1));
                    inletY = number(value(opts, i, 2));
                    i += 2;
                }
                case "-z", "--zone" -> {
                    zoneW = number(value(opts, i, 1));
                    zoneH = number(value(opts, i, 2));
                    i += 2;
                }
                case "-l", "--levels" -> {
                    low = number(value(opts, i, 1));
                    high = number(value(opts, i, 2));
                    i += 2;
                }
                case "-p", "--preview" -> {
                    brightness = number(value(opts, i, 1));
                    contrast = number(value(opts, i, 2));
                    i += 2;
                }
                case "-m", "--mirror" -> mirror = true;
                case "--step" -> scan = scan.withAngleStep(number(value(opts, i++, 1)));
                // angulagram rows must follow the angle axis, so the forward index counts steps
                case "--forward" -> scan = scan.withMapping(MappingDirection.FORWARD)
                        .withForwardIndexing(ForwardIndexing.ANGLE_STEPS);
                default -> throw new UsageException("Unknown option: " + opts[i]);
            }
        }
        ZoneSettings zone = new ZoneSettings(rotation, saturation, inletX, inletY, zoneW, zoneH,
                low, high, brightness, contrast, mirror);
        return new AngulagramConfig(scan, zone);
    }

    private static BufferedImage read(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("No such image: " + file);
        }
        BufferedImage image = ImageIO.read(file.toFile());
        if (image == null) {
            throw new IOException("Failed to decode image: " + file);
        }
        return image;
    }

    private static String value(String[] opts, int i, int ahead) {
        if (i + ahead >= opts.length) {
            throw new UsageException("Missing value for " + opts[i]);
        }
        return opts[i + ahead];
    }

    private static double number(String s) {
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            throw new UsageException("Not a number: " + s);
        }
    }

    static class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}
