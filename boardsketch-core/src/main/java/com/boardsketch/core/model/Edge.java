package com.boardsketch.core.model;

import java.util.Objects;

/**
 * A directed connection between two nodes of the same diagram.
 *
 * <p>For sequence diagrams the edge is a message: {@link #slot()} is its 0-based
 * appearance index, assigned by the parser, and {@link #y()} the vertical position assigned
 * by the sequence layout. Flowchart edges carry slot {@value #NO_SLOT}.
 */
public final class Edge {

    /** Slot value of edges that are not sequence messages. */
    public static final int NO_SLOT = -1;

    private final String from;
    private final String to;
    private final String label;
    private final EdgeStyle style;
    private final ArrowCap startCap;
    private final ArrowCap endCap;
    private final int slot;

    private double y;

    public Edge(String from, String to, String label, EdgeStyle style,
                ArrowCap startCap, ArrowCap endCap, int slot) {
        this.from = Objects.requireNonNull(from, "from must not be null");
        this.to = Objects.requireNonNull(to, "to must not be null");
        this.label = label == null || label.isBlank() ? null : label;
        this.style = style != null ? style : EdgeStyle.SOLID;
        this.startCap = startCap != null ? startCap : ArrowCap.NONE;
        this.endCap = endCap != null ? endCap : ArrowCap.ARROW;
        this.slot = slot;
    }

    /**
     * Creates a plain flowchart edge with an arrow at the target end.
     *
     * @param from source node id
     * @param to target node id
     * @return solid edge without label
     */
    public static Edge of(String from, String to) {
        return new Edge(from, to, null, EdgeStyle.SOLID, ArrowCap.NONE, ArrowCap.ARROW, NO_SLOT);
    }

    public String from() {
        return from;
    }

    public String to() {
        return to;
    }

    /**
     * @return edge label, or null when the edge has none
     */
    public String label() {
        return label;
    }

    public EdgeStyle style() {
        return style;
    }

    public ArrowCap startCap() {
        return startCap;
    }

    public ArrowCap endCap() {
        return endCap;
    }

    public int slot() {
        return slot;
    }

    public double y() {
        return y;
    }

    public boolean isSelfLoop() {
        return from.equals(to);
    }

    /**
     * Records the vertical position of a sequence message.
     *
     * @param y message row position
     */
    public void placeAt(double y) {
        this.y = y;
    }

    @Override
    public String toString() {
        return "Edge[" + from + " -> " + to + (label != null ? " '" + label + "'" : "") + " " + style
            + (slot != NO_SLOT ? " slot=" + slot : "") + "]";
    }
}
