package com.boardsketch.core.parser;

/**
 * A trimmed, non-blank, non-comment line of diagram text.
 *
 * @param number 1-based line number in the original text
 * @param text trimmed line content
 */
public record SourceLine(int number, String text) {
}
