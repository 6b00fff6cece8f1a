package com.flowmable.angulagram;

/**
 * Axis from which scan angles are measured. In both cases a polar offset
 * {@code (dx, dy)} lands on pixel {@code (originX + dx, originY - dy)}.
 */
public enum AngleReference {
    /** Counter-clockwise from +x: {@code dx = r cos φ, dy = r sin φ}. */
    HORIZONTAL,
    /** From "up", positive toward +x: {@code dx = r sin φ, dy = r cos φ}. */
    VERTICAL;

    /** Component of an origin-relative offset that carries {@code sin φ}. */
    double sineComponent(double ox, double oy) {
        return this == HORIZONTAL ? oy : ox;
    }

    int dx(int radius, double cos, double sin) {
        return (int) PixelMath.round(radius * (this == HORIZONTAL ? cos : sin));
    }

    int dy(int radius, double cos, double sin) {
        return (int) PixelMath.round(radius * (this == HORIZONTAL ? sin : cos));
    }
}
