package com.boardsketch.core.convert;

import com.boardsketch.core.model.ArrowCap;
import com.boardsketch.core.model.EdgeStyle;
import com.boardsketch.core.model.NodeShape;

import java.util.EnumMap;
import java.util.Map;

/**
 * Lookup tables mapping diagram shapes and styles to board shape names and colors.
 */
public final class ShapeStyles {

    public static final String DEFAULT_FILL = "#E3F2FD";
    public static final String DEFAULT_BORDER = "#1976D2";
    public static final String PARTICIPANT_FILL = "#E3F2FD";
    public static final String ACTOR_FILL = "#FFF9C4";
    public static final String LIFELINE_COLOR = "#90CAF9";
    public static final String ANCHOR_COLOR = LIFELINE_COLOR;

    public static final double LIFELINE_WIDTH = 10;
    public static final double ANCHOR_SIZE = 8;
    public static final double DEFAULT_STROKE_WIDTH = 2;
    public static final double THICK_STROKE_WIDTH = 4;

    public static final String ELBOWED = "elbowed";
    public static final String STRAIGHT = "straight";

    private static final Map<NodeShape, String> SHAPE_NAMES = new EnumMap<>(Map.of(
        NodeShape.RECTANGLE, "rectangle",
        NodeShape.ROUNDED_RECTANGLE, "round_rectangle",
        NodeShape.DIAMOND, "rhombus",
        NodeShape.CIRCLE, "circle",
        NodeShape.HEXAGON, "hexagon",
        NodeShape.STADIUM, "pill",
        NodeShape.CYLINDER, "can",
        NodeShape.PARALLELOGRAM, "parallelogram",
        NodeShape.TRAPEZOID, "trapezoid"
    ));

    private static final Map<NodeShape, String> FILL_COLORS = new EnumMap<>(Map.of(
        NodeShape.DIAMOND, "#FFE066",
        NodeShape.CIRCLE, "#B8E986",
        NodeShape.STADIUM, "#B3E5FC",
        NodeShape.PARALLELOGRAM, "#E1BEE7",
        NodeShape.HEXAGON, "#FFCCBC"
    ));

    private static final Map<NodeShape, Stencil> STENCILS = new EnumMap<>(Map.of(
        NodeShape.CIRCLE, new Stencil("flow_chart_terminator", "#C8E6C9", "#4CAF50"),
        NodeShape.STADIUM, new Stencil("flow_chart_terminator", "#C8E6C9", "#4CAF50"),
        NodeShape.DIAMOND, new Stencil("flow_chart_decision", "#FFF9C4", "#FFC107"),
        NodeShape.RECTANGLE, new Stencil("flow_chart_process", "#BBDEFB", "#2196F3"),
        NodeShape.ROUNDED_RECTANGLE, new Stencil("flow_chart_process", "#BBDEFB", "#2196F3"),
        NodeShape.PARALLELOGRAM, new Stencil("flow_chart_input_output", "#E1BEE7", "#9C27B0"),
        NodeShape.HEXAGON, new Stencil("flow_chart_preparation", "#FFE0B2", "#FF9800"),
        NodeShape.CYLINDER, new Stencil("flow_chart_database", "#B3E5FC", "#00BCD4"),
        NodeShape.TRAPEZOID, new Stencil("flow_chart_manual_operation", "#FFCCBC", "#FF5722")
    ));

    private static final Map<EdgeStyle, String> STROKE_STYLES = new EnumMap<>(Map.of(
        EdgeStyle.SOLID, "normal",
        EdgeStyle.THICK, "normal",
        EdgeStyle.DASHED, "dashed",
        EdgeStyle.DOTTED, "dotted"
    ));

    // the board has no cross cap; a diamond marks lost messages
    private static final Map<ArrowCap, String> CAPS = new EnumMap<>(Map.of(
        ArrowCap.NONE, "none",
        ArrowCap.ARROW, "arrow",
        ArrowCap.CROSS, "diamond"
    ));

    private static final Stencil DEFAULT_STENCIL = new Stencil("flow_chart_process", DEFAULT_FILL, DEFAULT_BORDER);

    private ShapeStyles() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    public static String shapeName(NodeShape shape) {
        return SHAPE_NAMES.getOrDefault(shape, "rectangle");
    }

    public static String fillColor(NodeShape shape) {
        return FILL_COLORS.getOrDefault(shape, DEFAULT_FILL);
    }

    public static Stencil stencil(NodeShape shape) {
        return STENCILS.getOrDefault(shape, DEFAULT_STENCIL);
    }

    public static String strokeStyle(EdgeStyle style) {
        return STROKE_STYLES.getOrDefault(style, "normal");
    }

    public static double strokeWidth(EdgeStyle style) {
        return style == EdgeStyle.THICK ? THICK_STROKE_WIDTH : DEFAULT_STROKE_WIDTH;
    }

    public static String cap(ArrowCap cap) {
        return CAPS.getOrDefault(cap, "none");
    }

    /**
     * Flowchart stencil appearance.
     *
     * @param name stencil shape name
     * @param fillColor fill color
     * @param borderColor border color
     */
    public record Stencil(String name, String fillColor, String borderColor) {}
}
