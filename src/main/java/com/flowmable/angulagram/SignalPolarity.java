package com.flowmable.angulagram;

/**
 * How a gray sample becomes signal in the polar grid ({@code 0 = no signal, 255 = max}).
 */
public enum SignalPolarity {
    /** Dark streams on a bright plate: {@code 255 - pixel}. */
    DARK_ON_LIGHT,
    /** Already inverted or emissive images: {@code pixel}. */
    LIGHT_ON_DARK;

    int signal(int pixel) {
        return this == DARK_ON_LIGHT ? 255 - pixel : pixel;
    }
}
