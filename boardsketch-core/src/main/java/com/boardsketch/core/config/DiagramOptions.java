package com.boardsketch.core.config;

import com.boardsketch.core.model.DiagramKind;
import com.boardsketch.core.model.Direction;

/**
 * Options controlling parsing, layout and conversion of a single diagram.
 *
 * <p>Non-positive sizes, spacings and limits fall back to their defaults in the compact
 * constructor, so callers only need to set what they want to change.
 *
 * @param kind forces a diagram kind instead of detecting it from the header, or null
 * @param direction overrides the direction declared in the header, or null
 * @param nodeWidth width of a node or participant header
 * @param nodeHeight height of a node or participant header
 * @param horizontalSpacing horizontal gap between neighboring nodes
 * @param verticalSpacing vertical gap between neighboring nodes
 * @param messageSpacing vertical distance between sequence messages
 * @param startX X offset applied to the whole diagram
 * @param startY Y offset applied to the whole diagram
 * @param margin padding added around the node bounding box
 * @param maxNodes node-count ceiling checked before layout
 * @param crossingPasses number of down/up barycenter sweeps
 * @param strictReferences reject edge endpoints that are neither declared nor mentioned elsewhere
 *        with INVALID_EDGE; when off, such endpoints become implicit rectangle nodes
 * @param requireAcyclic reject flowcharts that contain a directed cycle
 * @param useStencils map flowchart shapes to flowchart stencil shapes
 */
public record DiagramOptions(
    DiagramKind kind,
    Direction direction,
    double nodeWidth,
    double nodeHeight,
    double horizontalSpacing,
    double verticalSpacing,
    double messageSpacing,
    double startX,
    double startY,
    double margin,
    int maxNodes,
    int crossingPasses,
    boolean strictReferences,
    boolean requireAcyclic,
    boolean useStencils
) {
    public static final double DEFAULT_NODE_WIDTH = 180;
    public static final double DEFAULT_NODE_HEIGHT = 70;
    public static final double DEFAULT_HORIZONTAL_SPACING = 80;
    public static final double DEFAULT_VERTICAL_SPACING = 120;
    public static final double DEFAULT_MESSAGE_SPACING = 60;
    public static final double DEFAULT_MARGIN = 40;
    public static final int DEFAULT_MAX_NODES = 200;
    public static final int DEFAULT_CROSSING_PASSES = 4;

    /**
     * Compact constructor applying defaults.
     */
    public DiagramOptions {
        if (nodeWidth <= 0) {
            nodeWidth = DEFAULT_NODE_WIDTH;
        }
        if (nodeHeight <= 0) {
            nodeHeight = DEFAULT_NODE_HEIGHT;
        }
        if (horizontalSpacing < 0) {
            horizontalSpacing = DEFAULT_HORIZONTAL_SPACING;
        }
        if (verticalSpacing < 0) {
            verticalSpacing = DEFAULT_VERTICAL_SPACING;
        }
        if (messageSpacing <= 0) {
            messageSpacing = DEFAULT_MESSAGE_SPACING;
        }
        if (margin < 0) {
            margin = DEFAULT_MARGIN;
        }
        if (maxNodes <= 0) {
            maxNodes = DEFAULT_MAX_NODES;
        }
        if (crossingPasses < 0) {
            crossingPasses = DEFAULT_CROSSING_PASSES;
        }
    }

    /**
     * Creates the default options.
     *
     * @return default options
     */
    public static DiagramOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-filled with these options.
     *
     * @return builder copy
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.kind = kind;
        b.direction = direction;
        b.nodeWidth = nodeWidth;
        b.nodeHeight = nodeHeight;
        b.horizontalSpacing = horizontalSpacing;
        b.verticalSpacing = verticalSpacing;
        b.messageSpacing = messageSpacing;
        b.startX = startX;
        b.startY = startY;
        b.margin = margin;
        b.maxNodes = maxNodes;
        b.crossingPasses = crossingPasses;
        b.strictReferences = strictReferences;
        b.requireAcyclic = requireAcyclic;
        b.useStencils = useStencils;
        return b;
    }

    /**
     * Builder for {@link DiagramOptions}.
     */
    public static final class Builder {
        private DiagramKind kind;
        private Direction direction;
        private double nodeWidth = DEFAULT_NODE_WIDTH;
        private double nodeHeight = DEFAULT_NODE_HEIGHT;
        private double horizontalSpacing = DEFAULT_HORIZONTAL_SPACING;
        private double verticalSpacing = DEFAULT_VERTICAL_SPACING;
        private double messageSpacing = DEFAULT_MESSAGE_SPACING;
        private double startX;
        private double startY;
        private double margin = DEFAULT_MARGIN;
        private int maxNodes = DEFAULT_MAX_NODES;
        private int crossingPasses = DEFAULT_CROSSING_PASSES;
        private boolean strictReferences;
        private boolean requireAcyclic;
        private boolean useStencils;

        private Builder() {
        }

        public Builder kind(DiagramKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder direction(Direction direction) {
            this.direction = direction;
            return this;
        }

        public Builder nodeSize(double width, double height) {
            this.nodeWidth = width;
            this.nodeHeight = height;
            return this;
        }

        public Builder spacing(double horizontal, double vertical) {
            this.horizontalSpacing = horizontal;
            this.verticalSpacing = vertical;
            return this;
        }

        public Builder messageSpacing(double messageSpacing) {
            this.messageSpacing = messageSpacing;
            return this;
        }

        public Builder origin(double startX, double startY) {
            this.startX = startX;
            this.startY = startY;
            return this;
        }

        public Builder margin(double margin) {
            this.margin = margin;
            return this;
        }

        public Builder maxNodes(int maxNodes) {
            this.maxNodes = maxNodes;
            return this;
        }

        public Builder crossingPasses(int crossingPasses) {
            this.crossingPasses = crossingPasses;
            return this;
        }

        public Builder strictReferences(boolean strictReferences) {
            this.strictReferences = strictReferences;
            return this;
        }

        public Builder requireAcyclic(boolean requireAcyclic) {
            this.requireAcyclic = requireAcyclic;
            return this;
        }

        public Builder useStencils(boolean useStencils) {
            this.useStencils = useStencils;
            return this;
        }

        public DiagramOptions build() {
            return new DiagramOptions(kind, direction, nodeWidth, nodeHeight, horizontalSpacing,
                verticalSpacing, messageSpacing, startX, startY, margin, maxNodes, crossingPasses,
                strictReferences, requireAcyclic, useStencils);
        }
    }
}
