package com.boardsketch.cli;

import com.boardsketch.core.error.DiagramError;

import java.io.PrintWriter;

/**
 * Prints diagram errors in the format shared by all commands.
 */
final class ErrorReporter {

    private ErrorReporter() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    static void report(PrintWriter err, String source, DiagramError error) {
        StringBuilder line = new StringBuilder()
            .append("Error [").append(error.code()).append("] in ").append(source);
        if (error.hasLine()) {
            line.append(" line ").append(error.line());
        }
        line.append(": ").append(error.message());
        err.println(line);
        if (error.input() != null && !error.input().isEmpty()) {
            err.println("  near: " + error.input());
        }
        if (error.suggestion() != null && !error.suggestion().isEmpty()) {
            err.println("  hint: " + error.suggestion());
        }
        err.flush();
    }
}
