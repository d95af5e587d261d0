package com.boardsketch.core.renderer.impl;

import com.boardsketch.core.convert.ConnectorPlacement;
import com.boardsketch.core.convert.Placement;
import com.boardsketch.core.convert.PlacementPlan;
import com.boardsketch.core.convert.ShapePlacement;
import com.boardsketch.core.model.Bounds;
import com.boardsketch.core.pipeline.DiagramResult;
import com.boardsketch.core.renderer.PlacementRenderer;
import com.boardsketch.core.renderer.RenderContext;

import java.io.PrintWriter;
import java.util.Locale;

/**
 * Renderer that prints a human-readable placement listing with optional ANSI colors.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors ("true"/"false", default: "true")</li>
 * </ul>
 */
public class ConsolePlacementRenderer implements PlacementRenderer {

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(DiagramResult result, RenderContext context) {
        boolean useColors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "true"));
        PrintWriter out = context.out();
        PlacementPlan plan = result.plan();

        printSummary(out, plan, useColors);
        for (int i = 0; i < plan.size(); i++) {
            Placement placement = plan.get(i);
            if (placement instanceof ShapePlacement shape) {
                printShape(out, i, shape, useColors);
            } else if (placement instanceof ConnectorPlacement connector) {
                printConnector(out, i, connector, useColors);
            }
        }
        out.flush();
    }

    private void printSummary(PrintWriter out, PlacementPlan plan, boolean useColors) {
        String prefix = useColors ? ANSI_BOLD + ANSI_GREEN : "";
        String suffix = useColors ? ANSI_RESET : "";
        Bounds bounds = plan.bounds();

        out.println(prefix + plan.kind().name().toLowerCase(Locale.ROOT) + ": " + plan.shapes().size()
            + " shape(s), " + plan.connectors().size() + " connector(s)" + suffix);
        out.println(String.format(Locale.ROOT, "bounds: x=%.1f y=%.1f width=%.1f height=%.1f",
            bounds.x(), bounds.y(), bounds.width(), bounds.height()));
    }

    private void printShape(PrintWriter out, int index, ShapePlacement shape, boolean useColors) {
        String color = useColors ? ANSI_CYAN : "";
        String reset = useColors ? ANSI_RESET : "";
        out.println(String.format(Locale.ROOT, "%s#%d %s %s%s '%s' at (%.1f, %.1f) %.0fx%.0f %s",
            color, index, shape.role().name().toLowerCase(Locale.ROOT), shape.shape(), reset,
            shape.label(), shape.x(), shape.y(), shape.width(), shape.height(), shape.fillColor()));
    }

    private void printConnector(PrintWriter out, int index, ConnectorPlacement connector, boolean useColors) {
        String color = useColors ? ANSI_YELLOW : "";
        String reset = useColors ? ANSI_RESET : "";
        String label = connector.label() != null ? " '" + connector.label() + "'" : "";
        out.println(String.format(Locale.ROOT, "%s#%d connector #%d -> #%d%s%s %s %s",
            color, index, connector.startIndex(), connector.endIndex(), reset, label,
            connector.connectorShape(), connector.strokeStyle()));
    }
}
