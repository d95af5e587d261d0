package com.boardsketch.core.parser;

import com.boardsketch.core.config.DiagramOptions;
import com.boardsketch.core.error.DiagramErrorCode;
import com.boardsketch.core.error.DiagramException;
import com.boardsketch.core.model.Diagram;
import com.boardsketch.core.model.DiagramKind;
import com.boardsketch.core.parser.impl.FlowchartParser;
import com.boardsketch.core.parser.impl.SequenceParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link DiagramParsers}.
 */
class DiagramParsersTest {

    private DiagramParsers parsers;

    @BeforeEach
    void setUp() {
        parsers = new DiagramParsers(List.of(new FlowchartParser(), new SequenceParser()));
    }

    @Test
    void detect_recognizesSupportedHeaders() {
        assertThat(DiagramParsers.detect("flowchart LR\nA --> B")).isEqualTo(DiagramKind.FLOWCHART);
        assertThat(DiagramParsers.detect("graph TD\nA --> B")).isEqualTo(DiagramKind.FLOWCHART);
        assertThat(DiagramParsers.detect("%% comment\n\nsequenceDiagram\nA->>B: hi")).isEqualTo(DiagramKind.SEQUENCE);
        assertThat(DiagramParsers.detect("mindmap\n  root")).isEqualTo(DiagramKind.MINDMAP);
    }

    @Test
    void detect_otherMermaidHeader_throwsUnknownDiagramType() {
        assertThatThrownBy(() -> DiagramParsers.detect("classDiagram\nA <|-- B"))
            .isInstanceOfSatisfying(DiagramException.class, e -> {
                assertThat(e.getCode()).isEqualTo(DiagramErrorCode.UNKNOWN_DIAGRAM_TYPE);
                assertThat(e.getError().message()).contains("classDiagram");
            });
    }

    @Test
    void detect_missingHeader_suggestsSequenceHeader() {
        assertThatThrownBy(() -> DiagramParsers.detect("participant A\nA->>B: hi"))
            .isInstanceOfSatisfying(DiagramException.class, e -> {
                assertThat(e.getCode()).isEqualTo(DiagramErrorCode.MISSING_HEADER);
                assertThat(e.getError().suggestion()).contains("sequenceDiagram");
            });
    }

    @Test
    void detect_singleArrow_suggestsFlowchartArrow() {
        assertThatThrownBy(() -> DiagramParsers.detect("A -> B"))
            .isInstanceOfSatisfying(DiagramException.class, e ->
                assertThat(e.getError().suggestion()).contains("Flowcharts use '-->'"));
    }

    @Test
    void parse_dispatchesByHeader() {
        Diagram flowchart = parsers.parse("flowchart TB\nA --> B", DiagramOptions.defaults());
        Diagram sequence = parsers.parse("sequenceDiagram\nA->>B: hi", DiagramOptions.defaults());

        assertThat(flowchart.kind()).isEqualTo(DiagramKind.FLOWCHART);
        assertThat(sequence.kind()).isEqualTo(DiagramKind.SEQUENCE);
    }

    @Test
    void parse_kindOverride_bypassesDetection() {
        DiagramOptions options = DiagramOptions.builder().kind(DiagramKind.SEQUENCE).build();

        assertThatThrownBy(() -> parsers.parse("flowchart TB\nA --> B", options))
            .isInstanceOfSatisfying(DiagramException.class, e ->
                assertThat(e.getCode()).isEqualTo(DiagramErrorCode.MISSING_HEADER));
    }

    @Test
    void parse_mindmap_throwsUnknownDiagramType() {
        assertThatThrownBy(() -> parsers.parse("mindmap\n  root", DiagramOptions.defaults()))
            .isInstanceOfSatisfying(DiagramException.class, e ->
                assertThat(e.getCode()).isEqualTo(DiagramErrorCode.UNKNOWN_DIAGRAM_TYPE));
    }

    @Test
    void parse_emptyText_throwsEmptyDiagram() {
        assertThatThrownBy(() -> parsers.parse("", DiagramOptions.defaults()))
            .isInstanceOfSatisfying(DiagramException.class, e ->
                assertThat(e.getCode()).isEqualTo(DiagramErrorCode.EMPTY_DIAGRAM));
    }

    @Test
    void constructor_duplicateKind_throwsException() {
        assertThatThrownBy(() -> new DiagramParsers(List.of(new FlowchartParser(), new FlowchartParser())))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("FLOWCHART");
    }

    @Test
    void supportedKinds_listsRegisteredParsers() {
        assertThat(parsers.supportedKinds()).containsExactlyInAnyOrder(DiagramKind.FLOWCHART, DiagramKind.SEQUENCE);
    }
}
