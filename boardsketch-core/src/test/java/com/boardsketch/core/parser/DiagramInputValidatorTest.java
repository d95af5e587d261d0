package com.boardsketch.core.parser;

import com.boardsketch.core.error.DiagramErrorCode;
import com.boardsketch.core.error.DiagramException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link DiagramInputValidator}.
 */
class DiagramInputValidatorTest {

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "\n\n\t"})
    void validate_blankInput_throwsEmptyDiagram(String text) {
        assertThatThrownBy(() -> DiagramInputValidator.validate(text))
            .isInstanceOf(DiagramException.class)
            .extracting(e -> ((DiagramException) e).getCode())
            .isEqualTo(DiagramErrorCode.EMPTY_DIAGRAM);
    }

    @Test
    void validate_oversizedInput_throwsInputTooLarge() {
        String text = "flowchart TB\n" + ("A --> B\n".repeat(7000));

        assertThatThrownBy(() -> DiagramInputValidator.validate(text))
            .extracting(e -> ((DiagramException) e).getCode())
            .isEqualTo(DiagramErrorCode.INPUT_TOO_LARGE);
    }

    @Test
    void validate_tooManyLines_throwsTooManyLines() {
        String text = "flowchart TB\n" + "A\n".repeat(DiagramInputValidator.MAX_LINES);

        assertThatThrownBy(() -> DiagramInputValidator.validate(text))
            .extracting(e -> ((DiagramException) e).getCode())
            .isEqualTo(DiagramErrorCode.TOO_MANY_LINES);
    }

    @Test
    void validate_longLine_reportsLineNumber() {
        String text = "flowchart TB\nA --> B\nC[" + "x".repeat(DiagramInputValidator.MAX_LINE_LENGTH) + "]";

        assertThatThrownBy(() -> DiagramInputValidator.validate(text))
            .isInstanceOfSatisfying(DiagramException.class, e -> {
                assertThat(e.getCode()).isEqualTo(DiagramErrorCode.LINE_TOO_LONG);
                assertThat(e.getError().line()).isEqualTo(3);
            });
    }

    @Test
    void validate_normalDiagram_passes() {
        assertThatCode(() -> DiagramInputValidator.validate("flowchart TB\nA --> B"))
            .doesNotThrowAnyException();
    }
}
