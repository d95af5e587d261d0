package com.boardsketch.cli;

import com.boardsketch.BoardSketchCLI;
import com.boardsketch.core.config.DiagramOptions;
import com.boardsketch.core.error.DiagramException;
import com.boardsketch.core.model.Diagram;
import com.boardsketch.core.pipeline.DiagramPipeline;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to check a diagram without producing placements.
 *
 * <p>Parses and lays out the diagram, then prints a one-line summary. Exits with
 * {@value BoardSketchCLI#EXIT_INVALID_DIAGRAM} and the error details when the diagram is
 * invalid.
 */
@Command(
    name = "validate",
    description = "Check a diagram and report the first error",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private DiagramInput input;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            DiagramOptions options = input.resolveOptions(input.loadConfig());
            log.info("Validating diagram: {}", input.source());
            Diagram diagram = DiagramPipeline.fromServiceLoader().layout(input.readText(System.in), options);
            out.printf("Valid %s diagram: %d nodes, %d edges%n",
                diagram.kind().name().toLowerCase(Locale.ROOT), diagram.nodeCount(), diagram.edges().size());
            out.flush();
            return 0;
        } catch (DiagramException e) {
            ErrorReporter.report(err, input.source(), e.getError());
            return BoardSketchCLI.EXIT_INVALID_DIAGRAM;
        } catch (IllegalArgumentException | IOException e) {
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
