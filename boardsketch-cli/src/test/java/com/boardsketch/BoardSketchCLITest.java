package com.boardsketch;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link BoardSketchCLI}.
 */
class BoardSketchCLITest {

    private CommandLine commandLine;
    private StringWriter out;

    @BeforeEach
    void setUp() {
        commandLine = BoardSketchCLI.commandLine();
        out = new StringWriter();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(new StringWriter()));
    }

    @Test
    void execute_version_printsVersion() {
        int exitCode = commandLine.execute("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("BoardSketch 1.0.0-SNAPSHOT");
    }

    @Test
    void execute_help_listsSubcommands() {
        int exitCode = commandLine.execute("--help");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("render", "validate", "list");
    }

    @Test
    void execute_verboseAndQuiet_areParsed() {
        commandLine.parseArgs("-v");
        BoardSketchCLI cli = commandLine.getCommand();

        assertThat(cli.isVerbose()).isTrue();
        assertThat(cli.isQuiet()).isFalse();
    }

    @Test
    void execute_unknownSubcommand_returnsUsageError() {
        int exitCode = commandLine.execute("draw");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
    }
}
