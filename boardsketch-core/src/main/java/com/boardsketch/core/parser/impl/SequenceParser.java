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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses Mermaid sequence diagram syntax.
 *
 * <h2>Supported Syntax</h2>
 * <ul>
 *   <li><b>Participants:</b> {@code participant Alice}, {@code participant A as Alice},
 *       {@code actor User}; first mention in a message declares a participant too</li>
 *   <li><b>Messages:</b> {@code A->>B: text} (synchronous), {@code A-->>B: text}
 *       (asynchronous), {@code A-)B}, {@code A--)B} (async open arrow), {@code A-xB},
 *       {@code A--xB} (lost message); {@code +}/{@code -} activation markers are accepted</li>
 *   <li><b>Numbering:</b> {@code autonumber} prefixes message labels with their number</li>
 *   <li><b>Ignored:</b> notes, activate/deactivate, loop/alt/opt/par/critical/break/rect/box
 *       blocks with else/and/end, title</li>
 * </ul>
 *
 * <p>Participants keep the order of their first occurrence. Every message receives the next
 * slot index, which fixes its vertical order independently of layout.
 */
public class SequenceParser implements DiagramParser {

    private static final Logger log = LoggerFactory.getLogger(SequenceParser.class);

    private static final String ARROWS = "(-->>|->>|--\\)|-\\)|--x|-x)";

    /**
     * Participant id: any run of characters other than whitespace, {@code :}, {@code >} and
     * {@code +}. Senders are matched lazily so that an inner {@code -} belongs to the id
     * unless an arrow starts there.
     */
    private static final String PARTICIPANT_ID = "[^\\s:>+]+";
    private static final String SENDER = "(" + PARTICIPANT_ID + "?)";
    private static final String RECEIVER = "(" + PARTICIPANT_ID + ")";

    private static final Pattern PARTICIPANT = Pattern.compile(
        "(?i)^(participant|actor)\\s+(" + PARTICIPANT_ID + ")(?:\\s+as\\s+(.+?))?\\s*$");
    private static final Pattern MESSAGE = Pattern.compile(
        "^" + SENDER + "\\s*" + ARROWS + "([+-]?)\\s*" + RECEIVER + "\\s*:\\s*(.*)$");
    private static final Pattern AUTONUMBER = Pattern.compile("(?i)^autonumber\\b.*$");
    private static final Pattern IGNORED = Pattern.compile(
        "(?i)^(?:note\\s+(?:left of|right of|over)\\b.*"
            + "|(?:activate|deactivate)\\s+\\S+"
            + "|(?:loop|alt|opt|par|critical|break|rect|box)\\b.*"
            + "|(?:else|and)\\b.*"
            + "|end"
            + "|title\\b.*)$");

    private static final List<SyntaxHint> MISTAKES = List.of(
        new SyntaxHint(Pattern.compile("^" + SENDER + "\\s*(-->|->)(?!>)\\s*" + RECEIVER + ".*$"),
            "Sequence diagrams use '->>' for messages: A->>B: text"),
        new SyntaxHint(Pattern.compile("^" + SENDER + "\\s*" + ARROWS + "[+-]?\\s*" + RECEIVER + "\\s*$"),
            "Add ': message text' after the receiver: A->>B: text"),
        new SyntaxHint(Pattern.compile("(?i)^(participant|actor)\\s*$"),
            "Name the participant: participant Alice"),
        new SyntaxHint(Pattern.compile("(?i)^(flowchart|graph)\\b.*$"),
            "A diagram has exactly one header; flowchart statements cannot be mixed into a sequence diagram")
    );

    private static final String DEFAULT_HINT =
        "Use 'participant A' declarations and messages like 'A->>B: text'";

    @Override
    public String getId() {
        return "sequence";
    }

    @Override
    public DiagramKind getKind() {
        return DiagramKind.SEQUENCE;
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
        SourceLine header = lines.get(0);
        if (!ParserPatterns.SEQUENCE_HEADER.matcher(header.text()).matches()) {
            throw DiagramErrors.missingSequenceHeader(header.number(), header.text());
        }

        Map<String, Participant> participants = new LinkedHashMap<>();
        List<Message> messages = new ArrayList<>();
        boolean autonumber = false;

        for (SourceLine line : lines.subList(1, lines.size())) {
            String content = line.text();

            Matcher participant = PARTICIPANT.matcher(content);
            if (participant.matches()) {
                boolean actor = participant.group(1).toLowerCase(Locale.ROOT).equals("actor");
                String id = participant.group(2);
                String label = participant.group(3) != null ? ParserPatterns.unquote(participant.group(3)) : id;
                declare(participants, id, label, actor);
                continue;
            }

            Matcher message = MESSAGE.matcher(content);
            if (message.matches()) {
                String from = message.group(1);
                String to = message.group(4);
                mention(participants, from);
                mention(participants, to);
                messages.add(new Message(from, to, message.group(2), message.group(5).trim()));
                continue;
            }

            if (AUTONUMBER.matcher(content).matches()) {
                autonumber = true;
                continue;
            }

            if (IGNORED.matcher(content).matches()) {
                log.trace("Ignoring sequence statement on line {}: {}", line.number(), content);
                continue;
            }

            throw DiagramErrors.sequenceSyntax(line.number(), content, hintFor(content));
        }

        if (participants.isEmpty()) {
            throw DiagramErrors.noParticipants();
        }
        if (participants.size() > options.maxNodes()) {
            throw DiagramErrors.tooManyNodes(participants.size(), options.maxNodes());
        }

        List<Node> nodes = participants.values().stream()
            .map(p -> new Node(p.id(), p.label(), p.actor() ? NodeShape.CIRCLE : NodeShape.RECTANGLE))
            .toList();

        List<Edge> edges = new ArrayList<>(messages.size());
        for (int slot = 0; slot < messages.size(); slot++) {
            edges.add(toEdge(messages.get(slot), slot, autonumber));
        }

        log.debug("Parsed sequence diagram: {} participants, {} messages", nodes.size(), edges.size());
        return new Diagram(DiagramKind.SEQUENCE, Direction.LEFT_TO_RIGHT, nodes, edges);
    }

    private void declare(Map<String, Participant> participants, String id, String label, boolean actor) {
        // Explicit declarations refine label and type but never move an existing participant.
        participants.put(id, new Participant(id, label, actor));
    }

    private void mention(Map<String, Participant> participants, String id) {
        participants.putIfAbsent(id, new Participant(id, id, false));
    }

    private Edge toEdge(Message message, int slot, boolean autonumber) {
        String arrow = message.arrow();
        EdgeStyle style = arrow.startsWith("--") ? EdgeStyle.DASHED : EdgeStyle.SOLID;
        ArrowCap endCap = arrow.endsWith("x") ? ArrowCap.CROSS : ArrowCap.ARROW;
        String label = autonumber ? (slot + 1) + ". " + message.text() : message.text();
        return new Edge(message.from(), message.to(), label, style, ArrowCap.NONE, endCap, slot);
    }

    private String hintFor(String content) {
        for (SyntaxHint mistake : MISTAKES) {
            if (mistake.pattern().matcher(content).matches()) {
                return mistake.hint();
            }
        }
        return DEFAULT_HINT;
    }

    private record Participant(String id, String label, boolean actor) {}

    private record Message(String from, String to, String arrow, String text) {}

    private record SyntaxHint(Pattern pattern, String hint) {}
}
