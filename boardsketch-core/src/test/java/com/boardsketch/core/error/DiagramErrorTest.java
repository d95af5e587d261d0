package com.boardsketch.core.error;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link DiagramError}, {@link DiagramErrors} and {@link DiagramException}.
 */
class DiagramErrorTest {

    @Test
    void describe_includesLineAndSuggestion() {
        DiagramError error = DiagramError.of(DiagramErrorCode.INVALID_SYNTAX, "syntax error: bad line")
            .withLine(3)
            .withSuggestion("Fix it");

        assertThat(error.describe()).isEqualTo("syntax error: bad line (line 3). Fix it");
    }

    @Test
    void describe_withoutLine_omitsLine() {
        DiagramError error = DiagramError.of(DiagramErrorCode.NO_NODES, "no nodes found in diagram");

        assertThat(error.hasLine()).isFalse();
        assertThat(error.describe()).isEqualTo("no nodes found in diagram");
    }

    @Test
    void input_longerThanLimit_isTruncated() {
        String input = "A".repeat(80);

        DiagramError error = DiagramError.of(DiagramErrorCode.INVALID_SHAPE, "bad").withInput(input);

        assertThat(error.input())
            .hasSize(DiagramError.MAX_INPUT_LENGTH)
            .endsWith("...");
    }

    @Test
    void negativeLine_isTreatedAsUnknown() {
        assertThat(DiagramError.of(DiagramErrorCode.EMPTY_DIAGRAM, "empty").withLine(-4).line()).isZero();
    }

    @Test
    void constructor_withNullCode_throwsException() {
        assertThatThrownBy(() -> new DiagramError(null, "message", null, 0, null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void exception_carriesErrorAndDescribedMessage() {
        DiagramException exception = DiagramErrors.tooManyNodes(12, 10);

        assertThat(exception.getCode()).isEqualTo(DiagramErrorCode.TOO_MANY_NODES);
        assertThat(exception.getError().message()).contains("12").contains("10");
        assertThat(exception.getMessage()).isEqualTo(exception.getError().describe());
    }

    @Test
    void invalidShape_usesStaticShapeSuggestion() {
        DiagramError error = DiagramErrors.invalidShape(2, "A[Start").getError();

        assertThat(error.code()).isEqualTo(DiagramErrorCode.INVALID_SHAPE);
        assertThat(error.suggestion()).isEqualTo(DiagramErrors.SHAPE_SUGGESTION);
        assertThat(error.line()).isEqualTo(2);
        assertThat(error.input()).isEqualTo("A[Start");
    }

    @Test
    void sequenceSyntax_echoesFragmentInSuggestion() {
        DiagramError error = DiagramErrors.sequenceSyntax(4, "A->B: hi", "Use '->>'").getError();

        assertThat(error.code()).isEqualTo(DiagramErrorCode.INVALID_SYNTAX);
        assertThat(error.suggestion()).isEqualTo("Use '->>' (near 'A->B: hi')");
    }

    @Test
    void missingHeader_appendsHint() {
        DiagramError error = DiagramErrors.missingHeader("Flowcharts use '-->': A --> B").getError();

        assertThat(error.code()).isEqualTo(DiagramErrorCode.MISSING_HEADER);
        assertThat(error.suggestion()).endsWith(". Flowcharts use '-->': A --> B");
    }

    @Test
    void lineTooLong_reportsLine() {
        DiagramError error = DiagramErrors.lineTooLong(7, 2500, 2000).getError();

        assertThat(error.code()).isEqualTo(DiagramErrorCode.LINE_TOO_LONG);
        assertThat(error.line()).isEqualTo(7);
    }
}
