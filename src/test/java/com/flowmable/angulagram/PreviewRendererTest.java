package com.flowmable.angulagram;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.*;

class PreviewRendererTest {

    @Test
    void defaultBoost_brightensAndStretches() {
        BufferedImage src = PatternImages.solidRgb(2, 2, 0x640A00); // (100, 10, 0)

        BufferedImage out = PreviewRenderer.adjust(src, 25, 25);

        int rgb = out.getRGB(1, 1);
        assertEquals(150, (rgb >> 16) & 0xFF, "1.25 * 100 + 25");
        assertEquals(38, (rgb >> 8) & 0xFF, "1.25 * 10 + 25 = 37.5");
        assertEquals(25, rgb & 0xFF);
    }

    @Test
    void brightChannels_saturate() {
        BufferedImage out = PreviewRenderer.adjust(PatternImages.solidRgb(1, 1, 0xFAFAFA), 25, 25);
        assertEquals(0xFFFFFF, out.getRGB(0, 0) & 0xFFFFFF);
    }

    @Test
    void negativeResults_areFoldedToMagnitude() {
        BufferedImage out = PreviewRenderer.adjust(PatternImages.solidRgb(1, 1, 0x000000), -30, 0);
        assertEquals(30, out.getRGB(0, 0) & 0xFF);
    }

    @Test
    void neutralSettings_keepImage() {
        BufferedImage src = PatternImages.positionCoded(8, 8);
        BufferedImage out = PreviewRenderer.adjust(src, 0, 0);
        assertEquals(src.getRGB(5, 3), out.getRGB(5, 3));
    }
}
