package com.boardsketch.core.error;

import java.util.Objects;

/**
 * A user-facing diagram failure.
 *
 * @param code error code for programmatic handling
 * @param message user-friendly description
 * @param suggestion actionable hint to fix the input, or null
 * @param line 1-based line number, 0 when unknown
 * @param input offending input fragment (at most {@value #MAX_INPUT_LENGTH} characters), or null
 */
public record DiagramError(
    DiagramErrorCode code,
    String message,
    String suggestion,
    int line,
    String input
) {
    /** Longest input fragment kept on an error. */
    public static final int MAX_INPUT_LENGTH = 50;

    /**
     * Compact constructor with validation.
     */
    public DiagramError {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (line < 0) {
            line = 0;
        }
        if (input != null && input.length() > MAX_INPUT_LENGTH) {
            input = input.substring(0, MAX_INPUT_LENGTH - 3) + "...";
        }
    }

    public static DiagramError of(DiagramErrorCode code, String message) {
        return new DiagramError(code, message, null, 0, null);
    }

    public DiagramError withSuggestion(String suggestion) {
        return new DiagramError(code, message, suggestion, line, input);
    }

    public DiagramError withLine(int line) {
        return new DiagramError(code, message, suggestion, line, input);
    }

    public DiagramError withInput(String input) {
        return new DiagramError(code, message, suggestion, line, input);
    }

    public boolean hasLine() {
        return line > 0;
    }

    /**
     * Renders the error as {@code message (line N). suggestion}.
     *
     * @return display text
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(message);
        if (hasLine()) {
            sb.append(" (line ").append(line).append(')');
        }
        if (suggestion != null && !suggestion.isEmpty()) {
            sb.append(". ").append(suggestion);
        }
        return sb.toString();
    }
}
