package com.flowmable.angulagram;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InverseMappingTest {

    @Test
    void zeroDegreeRow_readsAlongTheInletRow() {
        // 20x11, inlet (0,4): the 0° ray runs along row 4
        GrayImage image = PatternImages.columnRamp(20, 11);
        ScanGeometry g = ScanGeometry.resolve(ScanSettings.FULL_CIRCLE.withOrigin(0, 4), 20, 11);
        assertEquals(20, g.radiusMax());

        PolarGrid grid = new InverseMapping().sample(image, g);

        int zero = g.axis().offsetIndex();
        for (int r = 0; r < grid.radiusMax(); r++) {
            assertEquals(255 - r, grid.get(zero, r), "radius " + r);
        }
    }

    @Test
    void samplesOutsideTheImage_areZero() {
        GrayImage image = GrayImage.filled(20, 11, 0);
        ScanGeometry g = ScanGeometry.resolve(ScanSettings.FULL_CIRCLE.withOrigin(0, 4), 20, 11);

        PolarGrid grid = new InverseMapping().sample(image, g);

        // -180° points off the left edge right after the origin
        assertEquals(255, grid.get(0, 0));
        for (int r = 1; r < grid.radiusMax(); r++) {
            assertEquals(0, grid.get(0, r), "radius " + r);
        }
    }

    @Test
    void verticalReference_zeroDegreesPointsUp() {
        // 21x10 zone with a dark column above the inlet (10,10)
        byte[] px = new byte[21 * 10];
        java.util.Arrays.fill(px, (byte) PatternImages.WHITE);
        for (int y = 0; y < 10; y++) {
            px[y * 21 + 10] = (byte) PatternImages.BLACK;
        }
        GrayImage image = GrayImage.of(21, 10, px);
        ScanGeometry g = ScanGeometry.resolve(ScanSettings.DEFAULT.withAngleStep(1.0), 21, 10);
        assertEquals(10.0, g.originX());
        assertEquals(10.0, g.originY());
        assertEquals(14, g.radiusMax());

        PolarGrid grid = new InverseMapping().sample(image, g);

        int zero = g.axis().offsetIndex();
        assertEquals(60, zero);
        assertEquals(0, grid.get(zero, 0), "origin lies below the last row");
        for (int r = 1; r <= 10; r++) {
            assertEquals(255, grid.get(zero, r), "radius " + r);
        }
        for (int r = 11; r < 14; r++) {
            assertEquals(0, grid.get(zero, r), "radius " + r);
        }
    }

    @Test
    void allWhitePlate_givesEmptyGrid() {
        GrayImage image = GrayImage.filled(4, 4, 255);
        ScanGeometry g = ScanGeometry.resolve(ScanSettings.FULL_CIRCLE.withOrigin(0, 1).withAngleStep(90), 4, 4);

        PolarGrid grid = new InverseMapping().sample(image, g);

        assertEquals(4, grid.angleSteps());
        assertEquals(4, grid.radiusMax());
        assertEquals(0, grid.countNonZero());
    }

    @Test
    void parallelGather_matchesSequential() {
        GrayImage image = PatternImages.noise(80, 60, 7L);
        for (ScanSettings settings : new ScanSettings[]{ScanSettings.FULL_CIRCLE, ScanSettings.DEFAULT}) {
            ScanGeometry g = ScanGeometry.resolve(settings, image.width(), image.height());
            PolarGrid sequential = new InverseMapping(SignalPolarity.DARK_ON_LIGHT, false).sample(image, g);
            PolarGrid parallel = new InverseMapping(SignalPolarity.DARK_ON_LIGHT, true).sample(image, g);
            assertEquals(sequential, parallel);
        }
    }

    @Test
    void lightOnDark_keepsPixelValues() {
        GrayImage image = PatternImages.columnRamp(20, 11);
        ScanGeometry g = ScanGeometry.resolve(ScanSettings.FULL_CIRCLE.withOrigin(0, 4), 20, 11);

        PolarGrid grid = new InverseMapping(SignalPolarity.LIGHT_ON_DARK, false).sample(image, g);

        assertEquals(7, grid.get(g.axis().offsetIndex(), 7));
    }
}
