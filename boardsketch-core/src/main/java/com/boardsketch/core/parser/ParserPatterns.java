package com.boardsketch.core.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Shared patterns and line handling for diagram parsers.
 */
public final class ParserPatterns {

    /** Mermaid comment prefix. */
    public static final String COMMENT_PREFIX = "%%";

    public static final Pattern FLOWCHART_HEADER =
        Pattern.compile("(?i)^(flowchart|graph)(?:\\s+([^\\s;]+))?\\s*;?$");

    public static final Pattern SEQUENCE_HEADER =
        Pattern.compile("(?i)^sequenceDiagram\\s*$");

    public static final Pattern MINDMAP_HEADER =
        Pattern.compile("(?i)^mindmap\\s*$");

    /** Other Mermaid diagram headers the engine recognizes but cannot lay out. */
    public static final Pattern OTHER_MERMAID_HEADER = Pattern.compile(
        "(?i)^(classDiagram(?:-v2)?|stateDiagram(?:-v2)?|erDiagram|gantt|pie|journey|gitGraph"
            + "|quadrantChart|requirementDiagram|timeline|C4Context|sankey-beta|xychart-beta|block-beta)\\b.*$");

    public static final Pattern NODE_ID = Pattern.compile("[A-Za-z0-9_]+");

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n|\\r");

    private ParserPatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Splits text into lines, keeping original line numbers.
     *
     * @param text diagram text
     * @return all lines, untrimmed
     */
    public static String[] rawLines(String text) {
        return LINE_BREAK.split(text, -1);
    }

    /**
     * Returns the trimmed lines that carry content, skipping blanks and {@code %%} comments.
     *
     * @param text diagram text
     * @return meaningful lines in order
     */
    public static List<SourceLine> meaningfulLines(String text) {
        String[] lines = rawLines(text);
        List<SourceLine> result = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty() || line.startsWith(COMMENT_PREFIX)) {
                continue;
            }
            result.add(new SourceLine(i + 1, line));
        }
        return result;
    }

    /**
     * Removes one pair of surrounding double or single quotes.
     *
     * @param label raw label
     * @return unquoted, trimmed label
     */
    public static String unquote(String label) {
        String trimmed = label.trim();
        if (trimmed.length() >= 2) {
            char first = trimmed.charAt(0);
            char last = trimmed.charAt(trimmed.length() - 1);
            if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
                return trimmed.substring(1, trimmed.length() - 1).trim();
            }
        }
        return trimmed;
    }
}
