package com.boardsketch.core.convert;

/**
 * A connector between two shapes of the same {@link PlacementPlan}.
 *
 * @param startIndex plan index of the shape the connector starts at
 * @param endIndex plan index of the shape the connector ends at
 * @param label caption, or null
 * @param connectorShape routing ("elbowed" or "straight")
 * @param strokeStyle "normal", "dashed" or "dotted"
 * @param strokeWidth line width
 * @param startCap cap at the start ("none", "arrow", ...)
 * @param endCap cap at the end
 */
public record ConnectorPlacement(
    int startIndex,
    int endIndex,
    String label,
    String connectorShape,
    String strokeStyle,
    double strokeWidth,
    String startCap,
    String endCap
) implements Placement {
    /**
     * Compact constructor with validation.
     */
    public ConnectorPlacement {
        if (startIndex < 0 || endIndex < 0) {
            throw new IllegalArgumentException("connector indices must not be negative");
        }
    }
}
