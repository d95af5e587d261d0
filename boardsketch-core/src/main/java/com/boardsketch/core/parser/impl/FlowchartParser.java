package com.boardsketch.core.parser.impl;

import com.boardsketch.core.config.DiagramOptions;
import com.boardsketch.core.error.DiagramErrors;
import com.boardsketch.core.model.ArrowCap;
import com.boardsketch.core.model.Diagram;
import com.boardsketch.core.model.DiagramKind;
import com.boardsketch.core.model.Direction;
import com.boardsketch.core.model.Edge;
import com.boardsketch.core.model.EdgeStyle;
import com.boardsketch.core.model.Node;
import com.boardsketch.core.model.NodeShape;
import com.boardsketch.core.parser.DiagramParser;
import com.boardsketch.core.parser.ParserPatterns;
import com.boardsketch.core.parser.SourceLine;
import com.boardsketch.core.util.DirectedGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses Mermaid flowchart syntax ({@code flowchart} or legacy {@code graph}).
 *
 * <h2>Supported Syntax</h2>
 * <ul>
 *   <li><b>Header:</b> {@code flowchart TB}, {@code graph LR}; direction TB, TD, BT, LR, RL</li>
 *   <li><b>Nodes:</b> {@code A}, {@code A[text]}, {@code A(text)}, {@code A{text}},
 *       {@code A((text))}, {@code A{{text}}}, {@code A([text])}, {@code A[(text)]},
 *       {@code A[/text/]}, {@code A[\text\]}, flag {@code A>text]} (drawn as a parallelogram)</li>
 *   <li><b>Edges:</b> {@code -->}, {@code ---}, {@code -.->}, {@code ==>}, chains
 *       {@code A --> B --> C}, fan-out {@code A --> B & C}, labels {@code -->|text|} and
 *       {@code -- text -->}</li>
 *   <li><b>Ignored directives:</b> {@code style}, {@code classDef}, {@code class},
 *       {@code click}, {@code linkStyle}, {@code subgraph}, {@code end}, {@code direction}</li>
 * </ul>
 *
 * <h2>Two-Pass Resolution</h2>
 * <p>The first pass turns every line into statements: node references in order of first
 * appearance and edge statements. The second pass resolves node declarations, applies the
 * reference policy and builds the edges. A node mentioned only in edges is created with its
 * id as label, unless {@link DiagramOptions#strictReferences()} is set and the node is
 * mentioned by a single statement without ever being declared.
 */
public class FlowchartParser implements DiagramParser {

    private static final Logger log = LoggerFactory.getLogger(FlowchartParser.class);

    private static final Pattern DIRECTIVE = Pattern.compile(
        "(?i)^(?:(style|classDef|class|click|linkStyle|subgraph|direction)(?:\\s+.*)?|end)$");

    private static final Pattern NODE_REFERENCE = Pattern.compile("^([A-Za-z0-9_]+)(.*)$");
    private static final Pattern CLASS_SUFFIX = Pattern.compile(":::[\\w-]+$");

    private static final Pattern LABELED_LINK = Pattern.compile(
        "\\s*(<)?(--|==|-\\.)\\s+([^|]+?)\\s+(-{2,}>|-{3,}|={2,}>|={3,}|\\.-+>|\\.-+)\\s*");
    private static final Pattern PLAIN_LINK = Pattern.compile(
        "\\s*(<)?(-{2,}>|-{3,}|={2,}>|={3,}|-\\.+->|-\\.+-)\\s*");
    private static final Pattern PIPE_LABEL = Pattern.compile("\\|([^|]*)\\|\\s*");

    private static final List<ShapeSyntax> SHAPES = List.of(
        new ShapeSyntax(Pattern.compile("^\\(\\((.+)\\)\\)$"), NodeShape.CIRCLE),
        new ShapeSyntax(Pattern.compile("^\\{\\{(.+)}}$"), NodeShape.HEXAGON),
        new ShapeSyntax(Pattern.compile("^\\(\\[(.+)]\\)$"), NodeShape.STADIUM),
        new ShapeSyntax(Pattern.compile("^\\[\\((.+)\\)]$"), NodeShape.CYLINDER),
        new ShapeSyntax(Pattern.compile("^\\[/(.+)/]$"), NodeShape.PARALLELOGRAM),
        new ShapeSyntax(Pattern.compile("^>(.+)]$"), NodeShape.PARALLELOGRAM),
        new ShapeSyntax(Pattern.compile("^\\[\\\\(.+)\\\\]$"), NodeShape.TRAPEZOID),
        new ShapeSyntax(Pattern.compile("^\\{(.+)}$"), NodeShape.DIAMOND),
        new ShapeSyntax(Pattern.compile("^\\((.+)\\)$"), NodeShape.ROUNDED_RECTANGLE),
        new ShapeSyntax(Pattern.compile("^\\[(.+)]$"), NodeShape.RECTANGLE)
    );

    @Override
    public String getId() {
        return "flowchart";
    }

    @Override
    public DiagramKind getKind() {
        return DiagramKind.FLOWCHART;
    }

    @Override
    public Diagram parse(String text, DiagramOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        if (text == null || text.isBlank()) {
            throw DiagramErrors.emptyDiagram();
        }

        List<SourceLine> lines = ParserPatterns.meaningfulLines(text);
        if (lines.isEmpty()) {
            throw DiagramErrors.emptyDiagram();
        }

        Direction direction = parseHeader(lines.get(0));
        if (options.direction() != null) {
            direction = options.direction();
        }

        Statements statements = collectStatements(lines.subList(1, lines.size()));
        Diagram diagram = resolve(statements, direction, options);

        if (options.requireAcyclic()) {
            Optional<List<String>> cycle = DirectedGraph.of(diagram).findCycle();
            if (cycle.isPresent()) {
                throw DiagramErrors.circularReference(String.join(" -> ", cycle.get()));
            }
        }

        log.debug("Parsed flowchart: {} nodes, {} edges, direction {}",
            diagram.nodeCount(), diagram.edges().size(), direction.code());
        return diagram;
    }

    private Direction parseHeader(SourceLine header) {
        Matcher matcher = ParserPatterns.FLOWCHART_HEADER.matcher(header.text());
        if (!matcher.matches()) {
            throw DiagramErrors.missingFlowchartHeader(header.number(), header.text());
        }
        String code = matcher.group(2);
        if (code == null) {
            return Direction.TOP_TO_BOTTOM;
        }
        return Direction.fromCode(code)
            .orElseThrow(() -> DiagramErrors.syntax(header.number(), header.text(),
                "unknown direction '" + code + "', expected TB, TD, BT, LR or RL"));
    }

    // ---------------------------------------------------------------------
    // Pass 1: lines -> statements
    // ---------------------------------------------------------------------

    private Statements collectStatements(List<SourceLine> lines) {
        Statements statements = new Statements();
        for (SourceLine line : lines) {
            String content = stripTrailingSemicolon(line.text());
            if (content.isEmpty()) {
                continue;
            }
            Matcher directive = DIRECTIVE.matcher(content);
            if (directive.matches()) {
                if (PLAIN_LINK.matcher(content).find()) {
                    throw DiagramErrors.syntax(line.number(), line.text(),
                        "'" + directive.group(1) + "' is a reserved keyword and cannot be used as a node id");
                }
                log.trace("Skipping directive on line {}: {}", line.number(), content);
                continue;
            }
            collectLine(line, content, statements);
        }
        return statements;
    }

    private void collectLine(SourceLine line, String content, Statements statements) {
        Chain chain = splitChain(content);
        int statementIndex = statements.nextStatementIndex++;

        if (chain.links().isEmpty()) {
            for (String part : splitFan(chain.segments().get(0))) {
                NodeRef ref = parseNodeRef(part, line, true);
                statements.mention(ref, statementIndex);
            }
            return;
        }

        List<List<NodeRef>> groups = new ArrayList<>();
        for (int i = 0; i < chain.segments().size(); i++) {
            String segment = chain.segments().get(i);
            if (segment.isEmpty()) {
                String reason = i == 0 ? "edge is missing its source node"
                    : "edge is missing its target node";
                throw DiagramErrors.invalidEdge(line.number(), content, reason);
            }
            List<NodeRef> group = new ArrayList<>();
            for (String part : splitFan(segment)) {
                NodeRef ref = parseNodeRef(part, line, false);
                statements.mention(ref, statementIndex);
                group.add(ref);
            }
            groups.add(group);
        }

        for (int i = 0; i < chain.links().size(); i++) {
            Link link = chain.links().get(i);
            for (NodeRef from : groups.get(i)) {
                for (NodeRef to : groups.get(i + 1)) {
                    statements.edges.add(new EdgeStatement(from.id(), to.id(), link, line, content));
                }
            }
        }
    }

    /**
     * Splits a line into node segments and the links between them, ignoring link-like text
     * inside brackets and quotes.
     */
    private Chain splitChain(String content) {
        List<String> segments = new ArrayList<>();
        List<Link> links = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        boolean quoted = false;
        int i = 0;

        while (i < content.length()) {
            if (depth == 0 && !quoted) {
                LinkMatch match = matchLink(content, i);
                if (match != null) {
                    segments.add(current.toString().trim());
                    current.setLength(0);
                    links.add(match.link());
                    i = match.end();
                    continue;
                }
            }
            char c = content.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (!quoted && (c == '[' || c == '(' || c == '{' || opensFlag(content, i, depth))) {
                depth++;
            } else if (!quoted && depth > 0 && (c == ']' || c == ')' || c == '}')) {
                depth--;
            }
            current.append(c);
            i++;
        }
        segments.add(current.toString().trim());
        return new Chain(segments, links);
    }

    /**
     * Splits {@code A & B} groups at top-level ampersands.
     */
    private static List<String> splitFan(String segment) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        boolean quoted = false;
        int start = 0;
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (!quoted && (c == '[' || c == '(' || c == '{' || opensFlag(segment, i, depth))) {
                depth++;
            } else if (!quoted && depth > 0 && (c == ']' || c == ')' || c == '}')) {
                depth--;
            } else if (!quoted && depth == 0 && c == '&') {
                parts.add(segment.substring(start, i).trim());
                start = i + 1;
            }
        }
        parts.add(segment.substring(start).trim());
        return parts;
    }

    /**
     * A top-level {@code >} directly after a node id opens a flag shape {@code A>text]}.
     */
    private static boolean opensFlag(String text, int i, int depth) {
        if (depth != 0 || i == 0 || text.charAt(i) != '>') {
            return false;
        }
        char previous = text.charAt(i - 1);
        return Character.isLetterOrDigit(previous) || previous == '_';
    }

    private LinkMatch matchLink(String content, int start) {
        Matcher labeled = LABELED_LINK.matcher(content).region(start, content.length());
        if (labeled.lookingAt()) {
            Link link = toLink(labeled.group(1) != null, labeled.group(2), labeled.group(4),
                ParserPatterns.unquote(labeled.group(3)));
            return withPipeLabel(content, link, labeled.end());
        }
        Matcher plain = PLAIN_LINK.matcher(content).region(start, content.length());
        if (plain.lookingAt()) {
            String operator = plain.group(2);
            Link link = toLink(plain.group(1) != null, operator, operator, null);
            return withPipeLabel(content, link, plain.end());
        }
        return null;
    }

    private LinkMatch withPipeLabel(String content, Link link, int end) {
        Matcher pipe = PIPE_LABEL.matcher(content).region(end, content.length());
        if (pipe.lookingAt()) {
            Link labeled = new Link(link.style(), link.startCap(), link.endCap(),
                ParserPatterns.unquote(pipe.group(1)));
            return new LinkMatch(labeled, pipe.end());
        }
        return new LinkMatch(link, end);
    }

    private Link toLink(boolean startArrow, String opening, String closing, String label) {
        EdgeStyle style;
        if (opening.startsWith("=")) {
            style = EdgeStyle.THICK;
        } else if (opening.contains(".")) {
            style = EdgeStyle.DOTTED;
        } else {
            style = EdgeStyle.SOLID;
        }
        ArrowCap endCap = closing.endsWith(">") ? ArrowCap.ARROW : ArrowCap.NONE;
        ArrowCap startCap = startArrow ? ArrowCap.ARROW : ArrowCap.NONE;
        return new Link(style, startCap, endCap, label);
    }

    private NodeRef parseNodeRef(String text, SourceLine line, boolean standalone) {
        String token = CLASS_SUFFIX.matcher(text.trim()).replaceFirst("");
        Matcher matcher = NODE_REFERENCE.matcher(token);
        if (!matcher.matches()) {
            throw DiagramErrors.syntax(line.number(), line.text(), "expected a node id but found '" + token + "'");
        }
        String id = matcher.group(1);
        String shapeText = matcher.group(2);

        if (shapeText.isEmpty()) {
            return new NodeRef(id, id, NodeShape.RECTANGLE, standalone, false, line);
        }
        for (ShapeSyntax syntax : SHAPES) {
            Matcher shapeMatcher = syntax.pattern().matcher(shapeText);
            if (shapeMatcher.matches()) {
                String label = ParserPatterns.unquote(shapeMatcher.group(1));
                return new NodeRef(id, label.isEmpty() ? id : label, syntax.shape(), true, true, line);
            }
        }
        char first = shapeText.charAt(0);
        if (first == '[' || first == '(' || first == '{' || first == '>') {
            throw DiagramErrors.invalidShape(line.number(), token);
        }
        throw DiagramErrors.syntax(line.number(), line.text(), "unexpected text after node '" + id + "'");
    }

    private static String stripTrailingSemicolon(String text) {
        return text.endsWith(";") ? text.substring(0, text.length() - 1).trim() : text;
    }

    // ---------------------------------------------------------------------
    // Pass 2: statements -> diagram
    // ---------------------------------------------------------------------

    private Diagram resolve(Statements statements, Direction direction, DiagramOptions options) {
        Map<String, NodeRef> declarations = new HashMap<>();
        for (NodeRef ref : statements.references) {
            // a bare standalone id declares the node but never resets an earlier shape
            if (ref.shaped() || (ref.declared() && !declarations.containsKey(ref.id()))) {
                declarations.put(ref.id(), ref);
            }
        }

        if (options.strictReferences()) {
            for (EdgeStatement edge : statements.edges) {
                requireResolvable(edge.from(), edge, declarations, statements);
                requireResolvable(edge.to(), edge, declarations, statements);
            }
        }

        Map<String, Node> nodes = new LinkedHashMap<>();
        for (NodeRef ref : statements.references) {
            if (nodes.containsKey(ref.id())) {
                continue;
            }
            NodeRef declaration = declarations.get(ref.id());
            if (declaration != null) {
                nodes.put(ref.id(), new Node(ref.id(), declaration.label(), declaration.shape()));
            } else {
                log.trace("Implicitly creating node '{}' from edge on line {}", ref.id(), ref.line().number());
                nodes.put(ref.id(), new Node(ref.id(), ref.id(), NodeShape.RECTANGLE));
            }
        }

        if (nodes.isEmpty()) {
            throw DiagramErrors.noNodes();
        }
        if (nodes.size() > options.maxNodes()) {
            throw DiagramErrors.tooManyNodes(nodes.size(), options.maxNodes());
        }

        List<Edge> edges = statements.edges.stream()
            .map(e -> new Edge(e.from(), e.to(), e.link().label(), e.link().style(),
                e.link().startCap(), e.link().endCap(), Edge.NO_SLOT))
            .toList();

        return new Diagram(DiagramKind.FLOWCHART, direction, List.copyOf(nodes.values()), edges);
    }

    private void requireResolvable(String id, EdgeStatement edge, Map<String, NodeRef> declarations,
                                   Statements statements) {
        if (declarations.containsKey(id)) {
            return;
        }
        if (statements.mentionCount(id) < 2) {
            throw DiagramErrors.invalidEdge(edge.line().number(), edge.text(),
                "edge references undefined node '" + id + "'");
        }
    }

    // ---------------------------------------------------------------------
    // Intermediate representation
    // ---------------------------------------------------------------------

    private record ShapeSyntax(Pattern pattern, NodeShape shape) {}

    private record Link(EdgeStyle style, ArrowCap startCap, ArrowCap endCap, String label) {}

    private record LinkMatch(Link link, int end) {}

    private record Chain(List<String> segments, List<Link> links) {}

    /**
     * A node reference; {@code declared} is true for standalone node lines and for
     * references that carry a shape.
     */
    private record NodeRef(String id, String label, NodeShape shape, boolean declared, boolean shaped,
                           SourceLine line) {}

    private record EdgeStatement(String from, String to, Link link, SourceLine line, String text) {}

    private static final class Statements {
        private final List<NodeRef> references = new ArrayList<>();
        private final List<EdgeStatement> edges = new ArrayList<>();
        private final Map<String, Set<Integer>> mentions = new HashMap<>();
        private int nextStatementIndex;

        void mention(NodeRef ref, int statementIndex) {
            references.add(ref);
            mentions.computeIfAbsent(ref.id(), id -> new HashSet<>()).add(statementIndex);
        }

        int mentionCount(String id) {
            Set<Integer> found = mentions.get(id);
            return found == null ? 0 : found.size();
        }
    }
}
