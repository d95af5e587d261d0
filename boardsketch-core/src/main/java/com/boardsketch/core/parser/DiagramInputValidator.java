package com.boardsketch.core.parser;

import com.boardsketch.core.error.DiagramErrors;
import com.boardsketch.core.error.DiagramException;

import java.nio.charset.StandardCharsets;

/**
 * Size guards applied to diagram text before any pattern matching runs.
 *
 * <p>Bounds the cost of the line regexes on hostile input: total size, line count and
 * line length are capped.
 */
public final class DiagramInputValidator {

    /** Maximum input size in bytes (50 KiB). */
    public static final int MAX_INPUT_BYTES = 50 * 1024;

    /** Maximum number of lines. */
    public static final int MAX_LINES = 500;

    /** Maximum length of a single line. */
    public static final int MAX_LINE_LENGTH = 2000;

    private DiagramInputValidator() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Validates diagram input size and shape.
     *
     * @param text diagram text
     * @throws DiagramException with EMPTY_DIAGRAM, INPUT_TOO_LARGE, TOO_MANY_LINES or LINE_TOO_LONG
     */
    public static void validate(String text) {
        if (text == null || text.isBlank()) {
            throw DiagramErrors.emptyDiagram();
        }
        if (text.getBytes(StandardCharsets.UTF_8).length > MAX_INPUT_BYTES) {
            throw DiagramErrors.inputTooLarge(MAX_INPUT_BYTES);
        }

        String[] lines = ParserPatterns.rawLines(text.strip());
        if (lines.length > MAX_LINES) {
            throw DiagramErrors.tooManyLines(lines.length, MAX_LINES);
        }

        String[] original = ParserPatterns.rawLines(text);
        for (int i = 0; i < original.length; i++) {
            if (original[i].length() > MAX_LINE_LENGTH) {
                throw DiagramErrors.lineTooLong(i + 1, original[i].length(), MAX_LINE_LENGTH);
            }
        }
    }
}
