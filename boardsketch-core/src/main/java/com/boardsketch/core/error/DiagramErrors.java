package com.boardsketch.core.error;

/**
 * Factory for the standard diagram errors and their suggestions.
 *
 * <p>Suggestions are static strings keyed by error code. The one exception is
 * {@link #sequenceSyntax(int, String, String)}, whose suggestion echoes the offending
 * fragment.
 */
public final class DiagramErrors {

    public static final String SHAPE_SUGGESTION =
        "Use valid shapes: [text] for rectangle, (text) for rounded, {text} for diamond, "
            + "((text)) for circle, {{text}} for hexagon";

    private DiagramErrors() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    public static DiagramException emptyDiagram() {
        return new DiagramException(DiagramError.of(DiagramErrorCode.EMPTY_DIAGRAM, "diagram input is empty")
            .withSuggestion("Provide Mermaid diagram code starting with 'flowchart TB' or 'sequenceDiagram'"));
    }

    public static DiagramException missingHeader(String hint) {
        String suggestion = "Use 'flowchart TB', 'flowchart LR', 'graph TD', or 'sequenceDiagram'";
        if (hint != null && !hint.isEmpty()) {
            suggestion += ". " + hint;
        }
        return new DiagramException(DiagramError.of(DiagramErrorCode.MISSING_HEADER,
            "diagram must start with a valid header").withSuggestion(suggestion));
    }

    public static DiagramException missingFlowchartHeader(int line, String input) {
        return new DiagramException(DiagramError.of(DiagramErrorCode.MISSING_HEADER, "missing diagram header")
            .withSuggestion("Start your diagram with 'flowchart TB' (top-bottom) or 'flowchart LR' (left-right)")
            .withLine(line)
            .withInput(input));
    }

    public static DiagramException missingSequenceHeader(int line, String input) {
        return new DiagramException(DiagramError.of(DiagramErrorCode.MISSING_HEADER,
                "not a sequence diagram: missing 'sequenceDiagram' header")
            .withSuggestion("Start your sequence diagram with 'sequenceDiagram' on the first line")
            .withLine(line)
            .withInput(input));
    }

    public static DiagramException noNodes() {
        return new DiagramException(DiagramError.of(DiagramErrorCode.NO_NODES, "no nodes found in diagram")
            .withSuggestion("Add node definitions like 'A[Label]' or edges like 'A --> B'"));
    }

    public static DiagramException noParticipants() {
        return new DiagramException(DiagramError.of(DiagramErrorCode.NO_NODES,
                "no participants found in sequence diagram")
            .withSuggestion("Add participants using 'participant A' or messages like 'A->>B: Hello'"));
    }

    public static DiagramException tooManyNodes(int count, int limit) {
        return new DiagramException(DiagramError.of(DiagramErrorCode.TOO_MANY_NODES,
                "diagram has " + count + " nodes, exceeding limit of " + limit)
            .withSuggestion("Split the diagram into smaller diagrams or reduce the number of nodes"));
    }

    public static DiagramException invalidShape(int line, String input) {
        return new DiagramException(DiagramError.of(DiagramErrorCode.INVALID_SHAPE,
                "unrecognized node shape: " + input)
            .withSuggestion(SHAPE_SUGGESTION)
            .withLine(line)
            .withInput(input));
    }

    public static DiagramException invalidEdge(int line, String input, String reason) {
        return new DiagramException(DiagramError.of(DiagramErrorCode.INVALID_EDGE, "invalid edge: " + reason)
            .withSuggestion("Ensure every edge connects two nodes, and declare nodes like 'A[Label]' before relying on them")
            .withLine(line)
            .withInput(input));
    }

    public static DiagramException circularReference(String cycle) {
        return new DiagramException(DiagramError.of(DiagramErrorCode.CIRCULAR_REFERENCE,
                "diagram contains a cycle: " + cycle)
            .withSuggestion("Remove one of the edges in the cycle or disable the acyclic requirement"));
    }

    public static DiagramException syntax(int line, String input, String reason) {
        return new DiagramException(DiagramError.of(DiagramErrorCode.INVALID_SYNTAX, "syntax error: " + reason)
            .withSuggestion("Check Mermaid syntax at https://mermaid.js.org/syntax/flowchart.html")
            .withLine(line)
            .withInput(input));
    }

    public static DiagramException sequenceSyntax(int line, String input, String hint) {
        return new DiagramException(DiagramError.of(DiagramErrorCode.INVALID_SYNTAX,
                "syntax error: unrecognized sequence diagram statement")
            .withSuggestion(hint + " (near '" + input + "')")
            .withLine(line)
            .withInput(input));
    }

    public static DiagramException unknownDiagramType(String type) {
        return new DiagramException(DiagramError.of(DiagramErrorCode.UNKNOWN_DIAGRAM_TYPE,
                "unsupported diagram type: " + type)
            .withSuggestion("Supported diagram types are 'flowchart' (or 'graph') and 'sequenceDiagram'"));
    }

    public static DiagramException inputTooLarge(int limit) {
        return new DiagramException(DiagramError.of(DiagramErrorCode.INPUT_TOO_LARGE,
                "diagram input exceeds maximum size of " + limit + " bytes")
            .withSuggestion("Reduce diagram size or split into multiple smaller diagrams"));
    }

    public static DiagramException tooManyLines(int count, int limit) {
        return new DiagramException(DiagramError.of(DiagramErrorCode.TOO_MANY_LINES,
                "diagram has " + count + " lines, exceeding limit of " + limit)
            .withSuggestion("Reduce the number of lines or split into multiple diagrams"));
    }

    public static DiagramException lineTooLong(int line, int length, int limit) {
        return new DiagramException(DiagramError.of(DiagramErrorCode.LINE_TOO_LONG,
                "line " + line + " has " + length + " characters, exceeding limit of " + limit)
            .withSuggestion("Split long labels or node names into shorter segments")
            .withLine(line));
    }
}
