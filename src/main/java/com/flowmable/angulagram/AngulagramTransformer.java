package com.flowmable.angulagram;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Top-level entry point of the angulagram pipeline.
 * <p>
 * 1. Resolve the scan geometry from the settings and the image shape.
 * 2. Resample into a polar grid with the configured {@link SamplingStrategy}.
 * 3. Integrate over radius into a profile, normalized if requested.
 * <p>
 * Holds no state between calls; one instance can serve any number of images.
 */
public class AngulagramTransformer {

    private static final Logger logger = LoggerFactory.getLogger(AngulagramTransformer.class);

    private final ScanSettings settings;
    private final SamplingStrategy strategy;

    public AngulagramTransformer() {
        this(ScanSettings.DEFAULT);
    }

    public AngulagramTransformer(ScanSettings settings) {
        this(settings, settings.mapping().createStrategy(settings));
    }

    /** Use a caller-supplied strategy in place of the one named by {@code settings.mapping()}. */
    public AngulagramTransformer(ScanSettings settings, SamplingStrategy strategy) {
        this.settings = settings;
        this.strategy = strategy;
    }

    public AngulagramResult transform(Path imageFile) throws IOException {
        BufferedImage image = ImageIO.read(imageFile.toFile());
        if (image == null) {
            throw new IOException("Failed to decode image: " + imageFile);
        }
        return transform(image);
    }

    public AngulagramResult transform(BufferedImage image) {
        return transform(GrayImage.from(image));
    }

    /**
     * @throws InvalidGeometryException  if the settings cannot describe a grid for this image
     * @throws DegenerateSignalException if normalization is on and the grid holds no signal
     */
    public AngulagramResult transform(GrayImage image) {
        ScanGeometry geometry = resolveGeometry(image);
        PolarGrid grid = toPolar(image, geometry);
        AngularProfile profile = RadialIntegrator.integrate(grid, settings.normalize());
        logger.info("Profile peak at {}° (integral {})", profile.peakAngle(), profile.maxIntegral());
        return new AngulagramResult(geometry, strategy.direction(), grid, profile);
    }

    public ScanGeometry resolveGeometry(GrayImage image) {
        return ScanGeometry.resolve(settings, image.width(), image.height());
    }

    /** Resample only, without integrating. */
    public PolarGrid toPolar(GrayImage image) {
        return toPolar(image, resolveGeometry(image));
    }

    private PolarGrid toPolar(GrayImage image, ScanGeometry geometry) {
        long t0 = System.nanoTime();
        PolarGrid grid = strategy.sample(image, geometry);
        logger.info("{} mapping filled {} in {} ms ({} cells with signal)",
                strategy.direction(), grid, (System.nanoTime() - t0) / 1_000_000, grid.countNonZero());
        return grid;
    }

    public ScanSettings settings() {
        return settings;
    }
}
