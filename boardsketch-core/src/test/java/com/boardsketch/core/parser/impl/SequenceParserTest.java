package com.boardsketch.core.parser.impl;

import com.boardsketch.core.config.DiagramOptions;
import com.boardsketch.core.error.DiagramErrorCode;
import com.boardsketch.core.error.DiagramException;
import com.boardsketch.core.model.ArrowCap;
import com.boardsketch.core.model.Diagram;
import com.boardsketch.core.model.DiagramKind;
import com.boardsketch.core.model.Edge;
import com.boardsketch.core.model.EdgeStyle;
import com.boardsketch.core.model.Node;
import com.boardsketch.core.model.NodeShape;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link SequenceParser}.
 */
class SequenceParserTest {

    private SequenceParser parser;
    private DiagramOptions options;

    @BeforeEach
    void setUp() {
        parser = new SequenceParser();
        options = DiagramOptions.defaults();
    }

    @Test
    void getId_returnsCorrectId() {
        assertThat(parser.getId()).isEqualTo("sequence");
        assertThat(parser.getKind()).isEqualTo(DiagramKind.SEQUENCE);
    }

    @Test
    void parse_declaredParticipants_keepDeclarationOrderAndAliases() {
        Diagram diagram = parser.parse("""
            sequenceDiagram
                participant B as Bob
                actor A as Alice
                A->>B: Hello
            """, options);

        assertThat(diagram.nodes()).extracting(Node::id, Node::label, Node::shape)
            .containsExactly(
                tuple("B", "Bob", NodeShape.RECTANGLE),
                tuple("A", "Alice", NodeShape.CIRCLE));
        assertThat(diagram.kind()).isEqualTo(DiagramKind.SEQUENCE);
    }

    @Test
    void parse_undeclaredParticipants_areCreatedInFirstMentionOrder() {
        Diagram diagram = parser.parse("""
            sequenceDiagram
                Client->>Server: request
                Server->>Database: query
                Database-->>Server: rows
            """, options);

        assertThat(diagram.nodes()).extracting(Node::id).containsExactly("Client", "Server", "Database");
        assertThat(diagram.node("Server").orElseThrow().label()).isEqualTo("Server");
    }

    @Test
    void parse_laterDeclaration_refinesLabelWithoutMovingParticipant() {
        Diagram diagram = parser.parse("""
            sequenceDiagram
                A->>B: hi
                participant B as Bob
            """, options);

        assertThat(diagram.nodes()).extracting(Node::id).containsExactly("A", "B");
        assertThat(diagram.node("B").orElseThrow().label()).isEqualTo("Bob");
    }

    @Test
    void parse_messages_receiveSlotsInOrder() {
        Diagram diagram = parser.parse("""
            sequenceDiagram
                A->>B: one
                B->>C: two
                C->>A: three
            """, options);

        assertThat(diagram.edges()).extracting(Edge::slot, Edge::label)
            .containsExactly(tuple(0, "one"), tuple(1, "two"), tuple(2, "three"));
    }

    @ParameterizedTest
    @CsvSource({
        "->>,  SOLID,  ARROW",
        "-->>, DASHED, ARROW",
        "-),   SOLID,  ARROW",
        "--),  DASHED, ARROW",
        "-x,   SOLID,  CROSS",
        "--x,  DASHED, CROSS"
    })
    void parse_arrow_mapsStyleAndEndCap(String arrow, EdgeStyle style, ArrowCap endCap) {
        Diagram diagram = parser.parse("sequenceDiagram\nA" + arrow + "B: msg", options);

        Edge message = diagram.edges().get(0);
        assertThat(message.style()).isEqualTo(style);
        assertThat(message.endCap()).isEqualTo(endCap);
        assertThat(message.startCap()).isEqualTo(ArrowCap.NONE);
    }

    @Test
    void parse_activationMarkers_areAccepted() {
        Diagram diagram = parser.parse("sequenceDiagram\nA->>+B: call\nB-->>-A: done", options);

        assertThat(diagram.edges()).extracting(Edge::from, Edge::to)
            .containsExactly(tuple("A", "B"), tuple("B", "A"));
    }

    @Test
    void parse_hyphenatedParticipant_sendsAndReceivesMessages() {
        Diagram diagram = parser.parse("""
            sequenceDiagram
                participant Web-App
                Web-App->>DB: query
                DB-->>Web-App: rows
                Web-App-xDB: lost
            """, options);

        assertThat(diagram.nodes()).extracting(Node::id).containsExactly("Web-App", "DB");
        assertThat(diagram.edges()).extracting(Edge::from, Edge::to)
            .containsExactly(tuple("Web-App", "DB"), tuple("DB", "Web-App"), tuple("Web-App", "DB"));
        assertThat(diagram.edges().get(2).endCap()).isEqualTo(ArrowCap.CROSS);
    }

    @Test
    void parse_nonAsciiParticipants_areAccepted() {
        Diagram diagram = parser.parse("""
            sequenceDiagram
                participant 客户
                客户->>服务: 请求
                Zoë->>客户: hi
            """, options);

        assertThat(diagram.nodes()).extracting(Node::id).containsExactly("客户", "服务", "Zoë");
        assertThat(diagram.edges().get(0).label()).isEqualTo("请求");
    }

    @Test
    void parse_singleArrowWithHyphenatedSender_suggestsDoubleArrow() {
        assertThatThrownBy(() -> parser.parse("sequenceDiagram\nWeb-App->DB: hi", options))
            .isInstanceOfSatisfying(DiagramException.class, e -> {
                assertThat(e.getCode()).isEqualTo(DiagramErrorCode.INVALID_SYNTAX);
                assertThat(e.getError().suggestion()).contains("'->>'");
            });
    }

    @Test
    void parse_selfMessage_isKept() {
        Diagram diagram = parser.parse("sequenceDiagram\nA->>A: think", options);

        assertThat(diagram.nodeCount()).isEqualTo(1);
        assertThat(diagram.edges().get(0).isSelfLoop()).isTrue();
    }

    @Test
    void parse_emptyMessageText_hasNoLabel() {
        Diagram diagram = parser.parse("sequenceDiagram\nA->>B:", options);

        assertThat(diagram.edges().get(0).label()).isNull();
    }

    @Test
    void parse_autonumber_prefixesLabels() {
        Diagram diagram = parser.parse("""
            sequenceDiagram
                autonumber
                A->>B: first
                B-->>A: second
            """, options);

        assertThat(diagram.edges()).extracting(Edge::label).containsExactly("1. first", "2. second");
    }

    @Test
    void parse_notesBlocksAndActivations_areIgnored() {
        Diagram diagram = parser.parse("""
            sequenceDiagram
                title Checkout
                participant A
                participant B
                Note over A,B: handshake
                loop every minute
                    A->>B: ping
                end
                alt ok
                    B-->>A: pong
                else failure
                    B--xA: lost
                end
                activate A
                deactivate A
                %% comment
            """, options);

        assertThat(diagram.nodeCount()).isEqualTo(2);
        assertThat(diagram.edges()).hasSize(3);
    }

    @Test
    void parse_singleArrow_suggestsDoubleArrowAndEchoesInput() {
        assertThatThrownBy(() -> parser.parse("sequenceDiagram\nparticipant A\nA->B: hi", options))
            .isInstanceOfSatisfying(DiagramException.class, e -> {
                assertThat(e.getCode()).isEqualTo(DiagramErrorCode.INVALID_SYNTAX);
                assertThat(e.getError().line()).isEqualTo(3);
                assertThat(e.getError().suggestion())
                    .contains("'->>'")
                    .contains("A->B: hi");
            });
    }

    @Test
    void parse_missingMessageText_suggestsColon() {
        assertThatThrownBy(() -> parser.parse("sequenceDiagram\nA->>B", options))
            .isInstanceOfSatisfying(DiagramException.class, e ->
                assertThat(e.getError().suggestion()).contains("': message text'"));
    }

    @Test
    void parse_unnamedParticipant_suggestsName() {
        assertThatThrownBy(() -> parser.parse("sequenceDiagram\nparticipant", options))
            .isInstanceOfSatisfying(DiagramException.class, e ->
                assertThat(e.getError().suggestion()).contains("participant Alice"));
    }

    @Test
    void parse_flowchartStatement_suggestsNotMixing() {
        assertThatThrownBy(() -> parser.parse("sequenceDiagram\nA->>B: hi\nflowchart TB", options))
            .isInstanceOfSatisfying(DiagramException.class, e ->
                assertThat(e.getError().suggestion()).contains("exactly one header"));
    }

    @Test
    void parse_unknownStatement_usesDefaultHint() {
        assertThatThrownBy(() -> parser.parse("sequenceDiagram\n???", options))
            .isInstanceOfSatisfying(DiagramException.class, e ->
                assertThat(e.getError().suggestion()).startsWith("Use 'participant A'").contains("???"));
    }

    @Test
    void parse_headerOnly_throwsNoNodes() {
        assertThatThrownBy(() -> parser.parse("sequenceDiagram\n%% nothing yet", options))
            .isInstanceOfSatisfying(DiagramException.class, e ->
                assertThat(e.getCode()).isEqualTo(DiagramErrorCode.NO_NODES));
    }

    @Test
    void parse_flowchartText_throwsMissingHeader() {
        assertThatThrownBy(() -> parser.parse("flowchart TB\nA --> B", options))
            .isInstanceOfSatisfying(DiagramException.class, e -> {
                assertThat(e.getCode()).isEqualTo(DiagramErrorCode.MISSING_HEADER);
                assertThat(e.getError().line()).isEqualTo(1);
            });
    }

    @Test
    void parse_blankText_throwsEmptyDiagram() {
        assertThatThrownBy(() -> parser.parse("   ", options))
            .isInstanceOfSatisfying(DiagramException.class, e ->
                assertThat(e.getCode()).isEqualTo(DiagramErrorCode.EMPTY_DIAGRAM));
    }

    @Test
    void parse_overParticipantCeiling_throwsTooManyNodes() {
        String body = IntStream.range(0, 6).mapToObj(i -> "participant P" + i).collect(Collectors.joining("\n"));
        DiagramOptions limited = DiagramOptions.builder().maxNodes(5).build();

        assertThatThrownBy(() -> parser.parse("sequenceDiagram\n" + body, limited))
            .isInstanceOfSatisfying(DiagramException.class, e ->
                assertThat(e.getCode()).isEqualTo(DiagramErrorCode.TOO_MANY_NODES));
    }
}
