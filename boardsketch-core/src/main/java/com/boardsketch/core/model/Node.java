package com.boardsketch.core.model;

import java.util.Objects;

/**
 * A node of a diagram: a flowchart box or a sequence-diagram participant.
 *
 * <p>Identity ({@link #id()}, {@link #label()}, {@link #shape()}) is fixed by the parser.
 * The placement fields (layer, order, position and size) start unassigned and are written
 * by a layout engine. Coordinates describe the top-left corner.
 */
public final class Node {

    /** Value of {@link #layer()} and {@link #order()} before layout assigns them. */
    public static final int UNASSIGNED = -1;

    private final String id;
    private final String label;
    private final NodeShape shape;

    private int layer = UNASSIGNED;
    private int order = UNASSIGNED;
    private double x;
    private double y;
    private double width;
    private double height;

    public Node(String id, String label, NodeShape shape) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.label = label != null ? label : id;
        this.shape = shape != null ? shape : NodeShape.RECTANGLE;
    }

    public String id() {
        return id;
    }

    public String label() {
        return label;
    }

    public NodeShape shape() {
        return shape;
    }

    public int layer() {
        return layer;
    }

    public int order() {
        return order;
    }

    public double x() {
        return x;
    }

    public double y() {
        return y;
    }

    public double width() {
        return width;
    }

    public double height() {
        return height;
    }

    public double centerX() {
        return x + width / 2;
    }

    public double centerY() {
        return y + height / 2;
    }

    /**
     * Records the rank assignment computed by a layered layout.
     *
     * @param layer discrete rank, 0 for sources
     * @param order position within the layer
     */
    public void assignRank(int layer, int order) {
        this.layer = layer;
        this.order = order;
    }

    /**
     * Records the pixel placement computed by a layout engine.
     *
     * @param x left edge
     * @param y top edge
     * @param width node width
     * @param height node height
     */
    public void place(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    @Override
    public String toString() {
        return "Node[" + id + " '" + label + "' " + shape + " layer=" + layer + " order=" + order
            + " at (" + x + ", " + y + ")]";
    }
}
