package com.flowmable.angulagram;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.*;

class PolarGridTest {

    // 3 angles x 4 radii, cell value = 10 * angle + radius
    private static PolarGrid sample() {
        byte[] cells = new byte[12];
        for (int a = 0; a < 3; a++)
            for (int r = 0; r < 4; r++)
                cells[a * 4 + r] = (byte) (10 * a + r);
        return new PolarGrid(AngleAxis.of(-90, 180, 60), 4, cells);
    }

    @Test
    void angleRows_putsRadiusAlongX() {
        BufferedImage img = sample().toImage(PolarImageLayout.ANGLE_ROWS);

        assertEquals(BufferedImage.TYPE_BYTE_GRAY, img.getType());
        assertEquals(4, img.getWidth());
        assertEquals(3, img.getHeight());
        assertEquals(23, img.getRaster().getSample(3, 2, 0));
        assertEquals(1, img.getRaster().getSample(1, 0, 0));
    }

    @Test
    void radiusRowsFlipped_putsLargestRadiusOnTop() {
        BufferedImage img = sample().toImage(PolarImageLayout.RADIUS_ROWS_FLIPPED);

        assertEquals(3, img.getWidth());
        assertEquals(4, img.getHeight());
        assertEquals(13, img.getRaster().getSample(1, 0, 0), "top row is radius 3");
        assertEquals(20, img.getRaster().getSample(2, 3, 0), "bottom row is radius 0");
    }

    @Test
    void fromImage_derivesAxisFromWindow() {
        PolarGrid original = sample();
        PolarGrid read = PolarGrid.fromImage(original.toImage(PolarImageLayout.ANGLE_ROWS),
                PolarImageLayout.ANGLE_ROWS, -90, 180);

        assertEquals(original, read);
        assertEquals(60.0, read.axis().angleStep());
        assertEquals(30.0, read.axis().angleAt(2));
    }

    @Test
    void fromImage_rejectsEmptyWindow() {
        BufferedImage img = sample().toImage(PolarImageLayout.ANGLE_ROWS);
        assertThrows(InvalidGeometryException.class,
                () -> PolarGrid.fromImage(img, PolarImageLayout.ANGLE_ROWS, -180, 0));
    }

    @Test
    void get_outsideGrid_throws() {
        PolarGrid grid = sample();
        assertEquals(12, grid.get(1, 2));
        assertThrows(IndexOutOfBoundsException.class, () -> grid.get(3, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> grid.get(0, 4));
        assertThrows(IndexOutOfBoundsException.class, () -> grid.get(-1, 0));
    }

    @Test
    void cellCount_mustMatchShape() {
        assertThrows(IllegalArgumentException.class,
                () -> new PolarGrid(AngleAxis.of(-90, 180, 60), 4, new byte[11]));
    }

    @Test
    void singlePixelAtOrigin_givesEmptyGrid() {
        // origin on the only pixel: farthest corner is at distance 0
        ScanGeometry g = ScanGeometry.resolve(ScanSettings.FULL_CIRCLE.withOrigin(0, 0), 1, 1);
        assertEquals(0, g.radiusMax());

        PolarGrid grid = new InverseMapping().sample(GrayImage.filled(1, 1, 0), g);

        assertEquals(0, grid.countNonZero());
        assertThrows(IllegalStateException.class, () -> grid.toImage(PolarImageLayout.ANGLE_ROWS));
        assertThrows(DegenerateSignalException.class, () -> RadialIntegrator.integrate(grid, true));
    }
}
