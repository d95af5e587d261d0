package com.boardsketch.cli;

import com.boardsketch.core.layout.LayoutEngine;
import com.boardsketch.core.parser.DiagramParser;
import com.boardsketch.core.renderer.PlacementRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list available parsers, layout engines, or renderers.
 *
 * <p>Discovers plugins via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * boardsketch list parsers
 * boardsketch list layouts
 * boardsketch list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available parsers, layouts, or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Type to list: parsers, layouts, or renderers"
    )
    private String type;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        int result = switch (type.toLowerCase(Locale.ROOT)) {
            case "parsers", "parser" -> listParsers(out);
            case "layouts", "layout" -> listLayouts(out);
            case "renderers", "renderer" -> listRenderers(out);
            default -> {
                log.error("Unknown type: {}. Use: parsers, layouts, or renderers", type);
                yield 1;
            }
        };
        out.flush();
        return result;
    }

    private int listParsers(PrintWriter out) {
        out.println("Available Parsers:");
        out.println();
        for (DiagramParser parser : ServiceLoader.load(DiagramParser.class)) {
            out.printf("  • %s (kind: %s)%n", parser.getId(), parser.getKind());
        }
        return 0;
    }

    private int listLayouts(PrintWriter out) {
        out.println("Available Layouts:");
        out.println();
        for (LayoutEngine layout : ServiceLoader.load(LayoutEngine.class)) {
            out.printf("  • %s (kind: %s)%n", layout.getId(), layout.getKind());
        }
        return 0;
    }

    private int listRenderers(PrintWriter out) {
        out.println("Available Renderers:");
        out.println();
        for (PlacementRenderer renderer : ServiceLoader.load(PlacementRenderer.class)) {
            out.printf("  • %s%n", renderer.getId());
        }
        return 0;
    }
}
