package com.boardsketch.core.model;

/**
 * Line style of an edge.
 */
public enum EdgeStyle {
    SOLID,
    /** Asynchronous sequence messages */
    DASHED,
    THICK,
    DOTTED
}
