package com.boardsketch.core.error;

/**
 * Machine-readable codes of diagram parsing, layout and conversion failures.
 */
public enum DiagramErrorCode {
    NO_NODES,
    INVALID_SYNTAX,
    MISSING_HEADER,
    EMPTY_DIAGRAM,
    INVALID_SHAPE,
    CIRCULAR_REFERENCE,
    TOO_MANY_NODES,
    INVALID_EDGE,
    UNKNOWN_DIAGRAM_TYPE,
    INPUT_TOO_LARGE,
    TOO_MANY_LINES,
    LINE_TOO_LONG
}
