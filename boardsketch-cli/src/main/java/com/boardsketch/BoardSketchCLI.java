package com.boardsketch;

import com.boardsketch.cli.ListCommand;
import com.boardsketch.cli.RenderCommand;
import com.boardsketch.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for BoardSketch.
 *
 * <p>BoardSketch turns Mermaid flowcharts and sequence diagrams into laid-out placement
 * plans: positioned shapes and connectors ready to be created on a whiteboard.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code render} - Lay out a diagram and print its placements</li>
 *   <li>{@code validate} - Check a diagram and report the first error</li>
 *   <li>{@code list} - List available parsers, layouts, or renderers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Render a flowchart as JSON
 * boardsketch render flow.mmd
 *
 * # Read from stdin and print a readable listing
 * cat seq.mmd | boardsketch render --format console
 *
 * # Validate with verbose output
 * boardsketch -v validate flow.mmd
 * }</pre>
 */
@Command(
    name = "boardsketch",
    mixinStandardHelpOptions = true,
    version = "BoardSketch 1.0.0-SNAPSHOT",
    description = "Mermaid diagram layout engine for whiteboards",
    subcommands = {
        RenderCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class BoardSketchCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BoardSketchCLI.class);

    /** Exit code for input that is not a valid diagram. */
    public static final int EXIT_INVALID_DIAGRAM = 2;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("BoardSketch - Mermaid diagram layout engine for whiteboards");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'boardsketch --help' to see available commands");
        System.out.println("Use 'boardsketch <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        BoardSketchCLI cli = new BoardSketchCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
