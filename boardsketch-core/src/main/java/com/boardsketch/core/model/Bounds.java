package com.boardsketch.core.model;

/**
 * Axis-aligned bounding box of a laid-out diagram.
 *
 * @param x left edge
 * @param y top edge
 * @param width box width
 * @param height box height
 */
public record Bounds(double x, double y, double width, double height) {

    /** Bounds of a diagram that has not been laid out. */
    public static final Bounds EMPTY = new Bounds(0, 0, 0, 0);

    /**
     * Compact constructor with validation.
     */
    public Bounds {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("width and height must not be negative");
        }
    }

    public double maxX() {
        return x + width;
    }

    public double maxY() {
        return y + height;
    }
}
