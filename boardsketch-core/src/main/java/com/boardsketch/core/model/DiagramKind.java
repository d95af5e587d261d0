package com.boardsketch.core.model;

/**
 * Diagram dialects recognized by the engine.
 */
public enum DiagramKind {
    /** Mermaid {@code flowchart} / {@code graph} */
    FLOWCHART,

    /** Mermaid {@code sequenceDiagram} */
    SEQUENCE,

    /** Mermaid {@code mindmap}; recognized but not supported by any parser or converter */
    MINDMAP
}
