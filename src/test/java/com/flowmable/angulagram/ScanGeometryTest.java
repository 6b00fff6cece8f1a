package com.flowmable.angulagram;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScanGeometryTest {

    @Test
    void leftMiddle_originSitsOneRowAboveCentre() {
        ScanGeometry g = ScanGeometry.resolve(ScanSettings.FULL_CIRCLE, 10, 6);
        assertEquals(0.0, g.originX());
        assertEquals(2.0, g.originY());
        assertEquals(AngleReference.HORIZONTAL, g.angleReference());
    }

    @Test
    void bottomMiddle_originSitsBelowLastRow() {
        ScanGeometry g = ScanGeometry.resolve(ScanSettings.DEFAULT, 11, 7);
        assertEquals(5.0, g.originX());
        assertEquals(7.0, g.originY());
        assertEquals(AngleReference.VERTICAL, g.angleReference());
        assertEquals(1200, g.angleSteps());
    }

    @Test
    void explicitOrigin_isUsedAsGiven() {
        ScanGeometry g = ScanGeometry.resolve(ScanSettings.FULL_CIRCLE.withOrigin(3.5, 1.0), 10, 5);
        assertEquals(3.5, g.originX());
        assertEquals(1.0, g.originY());
    }

    @Test
    void radiusMax_reachesFarthestCorner() {
        // (0,1) in a 4x4 image: farthest corner (3,3) at 3.61
        ScanGeometry small = ScanGeometry.resolve(ScanSettings.FULL_CIRCLE.withOrigin(0, 1), 4, 4);
        assertEquals(4, small.radiusMax());

        // (0,2) in a 10x5 image: both right corners at hypot(9, 2) = 9.22
        ScanGeometry wide = ScanGeometry.resolve(ScanSettings.FULL_CIRCLE.withOrigin(0, 2), 10, 5);
        assertEquals(9, wide.radiusMax());

        // bottom middle of 100x50: (0,0) at hypot(50, 50)
        ScanGeometry zone = ScanGeometry.resolve(ScanSettings.DEFAULT, 100, 50);
        assertEquals(71, zone.radiusMax());
    }

    @Test
    void radiusMax_looksPastTopRightCorner() {
        // left middle of 41x41 is (0,19): top-right hypot(40, 19) = 44.28, bottom-right hypot(40, 21) = 45.18
        ScanGeometry g = ScanGeometry.resolve(ScanSettings.FULL_CIRCLE, 41, 41);
        assertEquals(19.0, g.originY());
        assertEquals(45, g.radiusMax());
    }

    @Test
    void cellCount_isAnglesTimesRadii() {
        ScanGeometry g = ScanGeometry.resolve(ScanSettings.FULL_CIRCLE.withAngleStep(90), 4, 4);
        assertEquals(4, g.angleSteps());
        assertEquals(g.angleSteps() * (long) g.radiusMax(), g.cellCount());
    }

    @Test
    void nonFiniteOrigin_isRejected() {
        ScanSettings settings = ScanSettings.FULL_CIRCLE.withOrigin(Double.NaN, 0);
        assertThrows(InvalidGeometryException.class, () -> ScanGeometry.resolve(settings, 10, 10));
    }

    @Test
    void oversizedGrid_isRejectedBeforeAllocation() {
        ScanSettings settings = ScanSettings.FULL_CIRCLE.withAngleStep(0.01).withMaxGridCells(1_000);
        InvalidGeometryException e = assertThrows(InvalidGeometryException.class,
                () -> ScanGeometry.resolve(settings, 100, 100));
        assertTrue(e.getMessage().contains("exceeds"), e.getMessage());
    }

    @Test
    void emptyImage_isRejected() {
        assertThrows(InvalidGeometryException.class, () -> ScanGeometry.resolve(ScanSettings.DEFAULT, 0, 10));
    }
}
