package com.flowmable.angulagram;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AngulagramDriverTest {

    private static Path writePlate(Path dir) throws IOException {
        GrayImage plate = PatternImages.darkRay(41, 41, 0, 19, AngleReference.HORIZONTAL, 10.0, 35);
        Path file = dir.resolve("plate.png");
        ImageIO.write(plate.toBufferedImage(), "png", file.toFile());
        return file;
    }

    @Test
    void missingArguments_isUsageError() {
        assertEquals(AngulagramDriver.EXIT_USAGE, AngulagramDriver.run(new String[0]));
        assertEquals(AngulagramDriver.EXIT_USAGE, AngulagramDriver.run(new String[]{"polar"}));
    }

    @Test
    void unknownMode_isUsageError() {
        assertEquals(AngulagramDriver.EXIT_USAGE, AngulagramDriver.run(new String[]{"spin", "plate.png"}));
    }

    @Test
    void unknownOption_isUsageError(@TempDir Path dir) throws IOException {
        Path plate = writePlate(dir);
        assertEquals(AngulagramDriver.EXIT_USAGE,
                AngulagramDriver.run(new String[]{"angulagram", plate.toString(), "--bogus"}));
        assertEquals(AngulagramDriver.EXIT_USAGE,
                AngulagramDriver.run(new String[]{"angulagram", plate.toString(), "-r"}));
    }

    @Test
    void missingImage_isProcessingError(@TempDir Path dir) {
        assertEquals(AngulagramDriver.EXIT_ERROR,
                AngulagramDriver.run(new String[]{"polar", dir.resolve("absent.png").toString()}));
    }

    @Test
    void polarMode_writesInversePolarImage(@TempDir Path dir) throws IOException {
        Path plate = writePlate(dir);

        assertEquals(AngulagramDriver.EXIT_OK, AngulagramDriver.run(new String[]{"polar", plate.toString(), "5"}));

        Path out = dir.resolve("plate.polar.2.png");
        assertTrue(Files.isRegularFile(out));
        BufferedImage polar = ImageIO.read(out.toFile());
        assertEquals(72, polar.getHeight(), "360° in 5° rows");
        assertEquals(45, polar.getWidth(), "farthest corner (40, 40) from the inlet (0, 19)");
    }

    @Test
    void polarMode_forwardUsesOwnSuffix(@TempDir Path dir) throws IOException {
        Path plate = writePlate(dir);

        assertEquals(AngulagramDriver.EXIT_OK,
                AngulagramDriver.run(new String[]{"polar", plate.toString(), "forward"}));

        assertTrue(Files.isRegularFile(dir.resolve("plate.polar.1.png")));
        assertFalse(Files.exists(dir.resolve("plate.polar.2.png")));
    }

    @Test
    void badStep_isProcessingError(@TempDir Path dir) throws IOException {
        Path plate = writePlate(dir);
        assertEquals(AngulagramDriver.EXIT_ERROR,
                AngulagramDriver.run(new String[]{"polar", plate.toString(), "-1"}));
    }

    @Test
    void options_overrideConfiguration() {
        String[] opts = {"-r", "12.5", "-s", "40", "-i", "300", "400", "-z", "100", "200",
                "-l", "20", "230", "-p", "10", "15", "-m", "--step", "0.5", "--forward"};

        AngulagramConfig config = AngulagramDriver.applyOptions(AngulagramConfig.DEFAULT, opts);

        assertEquals(new ZoneSettings(12.5, 40, 300, 400, 100, 200, 20, 230, 10, 15, true), config.zone());
        assertEquals(0.5, config.scan().angleStep());
        assertEquals(MappingDirection.FORWARD, config.scan().mapping());
        assertEquals(ForwardIndexing.ANGLE_STEPS, config.scan().forwardIndexing());
        assertEquals(ScanSettings.DEFAULT.angleMin(), config.scan().angleMin());
    }

    @Test
    void options_rejectNonNumbers() {
        assertThrows(AngulagramDriver.UsageException.class,
                () -> AngulagramDriver.applyOptions(AngulagramConfig.DEFAULT, new String[]{"-s", "lots"}));
    }
}
