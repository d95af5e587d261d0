package com.boardsketch.core.convert;

/**
 * What a {@link ShapePlacement} stands for in the source diagram.
 */
public enum ShapeRole {
    /** A flowchart node. */
    NODE,
    /** A sequence diagram participant header. */
    PARTICIPANT,
    /** The vertical timeline below a participant header. */
    LIFELINE,
    /** A small point on a lifeline where a message connector attaches. */
    ANCHOR
}
