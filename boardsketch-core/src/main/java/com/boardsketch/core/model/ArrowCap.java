package com.boardsketch.core.model;

/**
 * Decoration at either end of an edge.
 */
public enum ArrowCap {
    NONE,
    ARROW,
    /** Lost message marker ({@code A-xB}) */
    CROSS
}
