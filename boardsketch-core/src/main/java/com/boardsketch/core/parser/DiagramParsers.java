package com.boardsketch.core.parser;

import com.boardsketch.core.config.DiagramOptions;
import com.boardsketch.core.error.DiagramErrors;
import com.boardsketch.core.error.DiagramException;
import com.boardsketch.core.model.Diagram;
import com.boardsketch.core.model.DiagramKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Detects the dialect of diagram text and dispatches to the matching {@link DiagramParser}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DiagramParsers parsers = DiagramParsers.fromServiceLoader();
 * Diagram diagram = parsers.parse("flowchart TB\nA --> B", DiagramOptions.defaults());
 * }</pre>
 */
public final class DiagramParsers {

    private static final Logger log = LoggerFactory.getLogger(DiagramParsers.class);

    private final Map<DiagramKind, DiagramParser> parsers = new EnumMap<>(DiagramKind.class);

    /**
     * Creates a registry from explicit parsers.
     *
     * @param parsers parsers, at most one per kind
     * @throws IllegalArgumentException if two parsers claim the same kind
     */
    public DiagramParsers(Collection<? extends DiagramParser> parsers) {
        Objects.requireNonNull(parsers, "parsers must not be null");
        for (DiagramParser parser : parsers) {
            DiagramParser previous = this.parsers.putIfAbsent(parser.getKind(), parser);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate parser for " + parser.getKind() + ": "
                    + previous.getId() + " and " + parser.getId());
            }
        }
    }

    /**
     * Creates a registry of every parser registered in
     * {@code META-INF/services/com.boardsketch.core.parser.DiagramParser}.
     *
     * @return registry
     */
    public static DiagramParsers fromServiceLoader() {
        List<DiagramParser> found = ServiceLoader.load(DiagramParser.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();
        log.debug("Discovered {} diagram parsers", found.size());
        return new DiagramParsers(found);
    }

    public Set<DiagramKind> supportedKinds() {
        return Set.copyOf(parsers.keySet());
    }

    /**
     * Validates and parses diagram text.
     *
     * <p>The options' kind override, when set, takes precedence over header detection.
     *
     * @param text diagram text
     * @param options parse options
     * @return parsed diagram
     * @throws DiagramException for invalid input or an unsupported diagram kind
     */
    public Diagram parse(String text, DiagramOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        DiagramInputValidator.validate(text);

        DiagramKind kind = options.kind() != null ? options.kind() : detect(text);
        DiagramParser parser = parsers.get(kind);
        if (parser == null) {
            throw DiagramErrors.unknownDiagramType(kind.name().toLowerCase(Locale.ROOT));
        }

        log.debug("Parsing {} diagram with parser '{}'", kind, parser.getId());
        return parser.parse(text, options);
    }

    /**
     * Detects the diagram kind from the first meaningful line.
     *
     * @param text diagram text
     * @return detected kind
     * @throws DiagramException EMPTY_DIAGRAM, UNKNOWN_DIAGRAM_TYPE or MISSING_HEADER
     */
    public static DiagramKind detect(String text) {
        if (text == null || text.isBlank()) {
            throw DiagramErrors.emptyDiagram();
        }
        List<SourceLine> lines = ParserPatterns.meaningfulLines(text);
        if (lines.isEmpty()) {
            throw DiagramErrors.emptyDiagram();
        }

        String first = lines.get(0).text();
        if (ParserPatterns.FLOWCHART_HEADER.matcher(first).matches()) {
            return DiagramKind.FLOWCHART;
        }
        if (ParserPatterns.SEQUENCE_HEADER.matcher(first).matches()) {
            return DiagramKind.SEQUENCE;
        }
        if (ParserPatterns.MINDMAP_HEADER.matcher(first).matches()) {
            return DiagramKind.MINDMAP;
        }
        Matcher other = ParserPatterns.OTHER_MERMAID_HEADER.matcher(first);
        if (other.matches()) {
            throw DiagramErrors.unknownDiagramType(other.group(1));
        }
        throw DiagramErrors.missingHeader(headerHint(text));
    }

    /**
     * Returns a hint for common header mistakes, or an empty string.
     *
     * @param text diagram text
     * @return hint text
     */
    static String headerHint(String text) {
        String input = text.strip().toLowerCase(Locale.ROOT);
        if (input.contains("->") && !input.contains("-->")) {
            if (input.contains("->>")) {
                return "Sequence diagrams must start with 'sequenceDiagram'";
            }
            return "Flowcharts use '-->': A --> B";
        }
        if (input.contains("participant") || input.contains("->>")) {
            return "Sequence diagrams must start with 'sequenceDiagram'";
        }
        if (input.contains("-->") || input.contains("subgraph")) {
            return "Flowcharts must start with 'flowchart TB' or 'graph TD'";
        }
        return "";
    }
}
