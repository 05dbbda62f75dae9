package org.humspine.parser.frontend.lexer;

import org.humspine.parser.model.LineType;
import org.humspine.parser.model.Token;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link LineClassifier}.
 */
@Tag("unit")
class LineClassifierTest {

    private static List<Token> tokens(String... texts) {
        List<Token> result = new ArrayList<>();
        for (String text : texts) {
            result.add(new Token(null, text));
        }
        return result;
    }

    /**
     * Verifies that any manipulator makes an interpretation line a manipulator line,
     * and that a line is an exclusive line only when its first token is an exclusive interpretation.
     */
    @Test
    void interpretationLines() {
        assertThat(LineClassifier.classify(tokens("*", "*^"))).isEqualTo(LineType.MANIPULATOR);
        assertThat(LineClassifier.classify(tokens("**kern", "*-"))).isEqualTo(LineType.MANIPULATOR);
        assertThat(LineClassifier.classify(tokens("**kern", "**dynam"))).isEqualTo(LineType.EXCLUSIVE);
        assertThat(LineClassifier.classify(tokens("**kern", "*"))).isEqualTo(LineType.EXCLUSIVE);
        assertThat(LineClassifier.classify(tokens("*", "**kern"))).isEqualTo(LineType.INTERPRETATION);
        assertThat(LineClassifier.classify(tokens("*clefG2", "*"))).isEqualTo(LineType.INTERPRETATION);
    }

    @Test
    void otherLines() {
        assertThat(LineClassifier.classify(tokens())).isEqualTo(LineType.EMPTY);
        assertThat(LineClassifier.classify(tokens(""))).isEqualTo(LineType.EMPTY);
        assertThat(LineClassifier.classify(tokens("!! note"))).isEqualTo(LineType.GLOBAL_COMMENT);
        assertThat(LineClassifier.classify(tokens("!!!OTL: Title"))).isEqualTo(LineType.REFERENCE);
        assertThat(LineClassifier.classify(tokens("!", "!"))).isEqualTo(LineType.LOCAL_COMMENT);
        assertThat(LineClassifier.classify(tokens(".", "4c"))).isEqualTo(LineType.DATA);
    }

    /**
     * Verifies that only a line without any text is empty: a leading tab leaves an empty first
     * field on a line that still takes part in the spine structure.
     */
    @Test
    void leadingTabIsNotAnEmptyLine() {
        // Act
        LineType type = LineClassifier.classify(tokens("", "4c"));

        // Assert
        assertThat(type).isEqualTo(LineType.DATA);
        assertThat(type.hasSpines()).isTrue();
    }

    @Test
    void referenceRecordDetection() {
        assertThat(LineClassifier.isReferenceRecord("!!!COM: Bach")).isTrue();
        assertThat(LineClassifier.isReferenceRecord("!!!COM Bach")).isFalse();
        assertThat(LineClassifier.isReferenceRecord("!!!:")).isFalse();
        assertThat(LineClassifier.isReferenceRecord("!!!!SEGMENT: x")).isFalse();
    }
}
