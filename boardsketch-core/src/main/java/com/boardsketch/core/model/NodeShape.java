package com.boardsketch.core.model;

/**
 * Visual shape of a node, derived from the bracket pair used in the diagram text.
 */
public enum NodeShape {
    /** {@code A[label]} */
    RECTANGLE,

    /** {@code A(label)} */
    ROUNDED_RECTANGLE,

    /** {@code A{label}} */
    DIAMOND,

    /** {@code A((label))}; also used for sequence-diagram actors */
    CIRCLE,

    /** {@code A{{label}}} */
    HEXAGON,

    /** {@code A([label])} */
    STADIUM,

    /** {@code A[(label)]} */
    CYLINDER,

    /** {@code A[/label/]} */
    PARALLELOGRAM,

    /** {@code A[\label\]} */
    TRAPEZOID
}
