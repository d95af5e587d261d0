package com.boardsketch.cli;

import com.boardsketch.BoardSketchCLI;
import com.boardsketch.core.config.DiagramOptions;
import com.boardsketch.core.config.EngineConfig;
import com.boardsketch.core.error.DiagramException;
import com.boardsketch.core.pipeline.DiagramPipeline;
import com.boardsketch.core.pipeline.DiagramResult;
import com.boardsketch.core.renderer.PlacementRenderer;
import com.boardsketch.core.renderer.PlacementRenderers;
import com.boardsketch.core.renderer.RenderContext;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to lay out a diagram and print its placement plan.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # JSON placements on stdout
 * boardsketch render flow.mmd
 *
 * # Readable listing without colors, left-to-right
 * boardsketch render flow.mmd --format console --no-color -d LR
 *
 * # Write JSON to a file
 * boardsketch render seq.mmd -o placements.json
 * }</pre>
 */
@Command(
    name = "render",
    description = "Lay out a diagram and print its placements",
    mixinStandardHelpOptions = true
)
public class RenderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private DiagramInput input;

    @Option(names = {"-f", "--format"}, description = "Output format: json or console (default: from config, else json)")
    private String format;

    @Option(names = {"-o", "--output"}, description = "Write output to this file instead of stdout")
    private Path outputFile;

    @Option(names = "--no-color", description = "Disable ANSI colors in console output")
    private boolean noColor;

    @Option(names = "--compact", description = "Print JSON on a single line")
    private boolean compact;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        try {
            EngineConfig config = input.loadConfig();
            DiagramOptions options = input.resolveOptions(config);
            String formatId = format != null ? format
                : config.output().format() != null ? config.output().format() : "json";
            PlacementRenderer renderer = PlacementRenderers.find(formatId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown format: " + formatId));

            String text = input.readText(System.in);
            DiagramResult result = DiagramPipeline.fromServiceLoader().run(text, options);

            Map<String, String> settings = Map.of(
                "console.colors", String.valueOf(!noColor && outputFile == null),
                "json.pretty", String.valueOf(!compact));
            if (outputFile != null) {
                try (Writer writer = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8);
                     PrintWriter out = new PrintWriter(writer)) {
                    renderer.render(result, new RenderContext(out, settings));
                }
                log.info("Wrote {} placements to {}", result.plan().size(), outputFile);
            } else {
                renderer.render(result, new RenderContext(spec.commandLine().getOut(), settings));
            }
            return 0;
        } catch (DiagramException e) {
            ErrorReporter.report(err, input.source(), e.getError());
            return BoardSketchCLI.EXIT_INVALID_DIAGRAM;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        } catch (IOException e) {
            log.error("Failed to read or write diagram: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
