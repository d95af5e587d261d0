package com.boardsketch.core.convert;

import java.util.Objects;

/**
 * A shape to create on the board. Coordinates are the shape's center.
 *
 * @param role what the shape represents
 * @param sourceId id of the node or participant the shape belongs to
 * @param shape board shape name (e.g., "rectangle", "rhombus", "flow_chart_decision")
 * @param label text content, empty for lifelines and anchors
 * @param x center X
 * @param y center Y
 * @param width shape width
 * @param height shape height
 * @param fillColor fill color as {@code #RRGGBB}
 * @param borderColor border color as {@code #RRGGBB}, or null for the board default
 * @param stencil whether {@code shape} names a flowchart stencil
 */
public record ShapePlacement(
    ShapeRole role,
    String sourceId,
    String shape,
    String label,
    double x,
    double y,
    double width,
    double height,
    String fillColor,
    String borderColor,
    boolean stencil
) implements Placement {
    /**
     * Compact constructor with validation.
     */
    public ShapePlacement {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(shape, "shape must not be null");
        Objects.requireNonNull(fillColor, "fillColor must not be null");
        if (label == null) {
            label = "";
        }
    }
}
