package org.humspine.parser.frontend.links;

import org.humspine.parser.api.ParserErrorCode;
import org.humspine.parser.frontend.StructureException;
import org.humspine.parser.model.Line;
import org.humspine.parser.model.Token;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link LineStitcher}.
 */
@Tag("unit")
class LineStitcherTest {

    private final LineStitcher stitcher = new LineStitcher();

    private static Line line(int index, String text) {
        Line line = new Line(text);
        line.setLineIndex(index);
        return line;
    }

    @Test
    void plainLinesLinkOneToOne() throws StructureException {
        Line previous = line(0, "4c\t4e");
        Line next = line(1, "4d\t4f");

        stitcher.stitch(previous, next);

        assertThat(previous.getToken(0).getNextTokens()).containsExactly(next.getToken(0));
        assertThat(previous.getToken(1).getNextTokens()).containsExactly(next.getToken(1));
        assertThat(next.getToken(1).getPreviousTokens()).containsExactly(previous.getToken(1));
    }

    @Test
    void splitFansOutToTwoTokens() throws StructureException {
        Line previous = line(0, "*^\t*");
        Line next = line(1, "4c\t4e\tp");

        stitcher.stitch(previous, next);

        assertThat(previous.getToken(0).getNextTokens()).containsExactly(next.getToken(0), next.getToken(1));
        assertThat(previous.getToken(1).getNextTokens()).containsExactly(next.getToken(2));
    }

    /**
     * Verifies that every token of a merge run links to the same token.
     */
    @Test
    void mergeRunConverges() throws StructureException {
        Line previous = line(0, "*v\t*v\t*v\t*");
        Line next = line(1, "4c\tp");

        stitcher.stitch(previous, next);

        Token merged = next.getToken(0);
        assertThat(merged.getPreviousTokens())
                .containsExactly(previous.getToken(0), previous.getToken(1), previous.getToken(2));
        assertThat(previous.getToken(3).getNextToken(0)).isSameAs(next.getToken(1));
    }

    /**
     * Verifies that an exchange pair crosses over.
     */
    @Test
    void exchangeCrossesLinks() throws StructureException {
        Line previous = line(0, "*x\t*x");
        Line next = line(1, "a\tb");

        stitcher.stitch(previous, next);

        assertThat(previous.getToken(0).getNextToken(0)).isSameAs(next.getToken(1));
        assertThat(previous.getToken(1).getNextToken(0)).isSameAs(next.getToken(0));
    }

    @Test
    void terminatorHasNoContinuation() throws StructureException {
        Line previous = line(0, "*-\t*");
        Line next = line(1, "4c");

        stitcher.stitch(previous, next);

        assertThat(previous.getToken(0).getNextTokenCount()).isZero();
        assertThat(previous.getToken(1).getNextToken(0)).isSameAs(next.getToken(0));
    }

    /**
     * Verifies that the exclusive interpretation opened by an add manipulator has no backward link.
     */
    @Test
    void addOpensUnlinkedSpine() throws StructureException {
        Line previous = line(0, "*+");
        Line next = line(1, "*\t**text");

        stitcher.stitch(previous, next);

        assertThat(previous.getToken(0).getNextTokens()).containsExactly(next.getToken(0));
        assertThat(next.getToken(1).getPreviousTokenCount()).isZero();
    }

    @Test
    void addWithoutExclusiveFails() {
        Line previous = line(0, "*+");
        Line next = line(1, "*\t*");

        assertThatThrownBy(() -> stitcher.stitch(previous, next))
                .isInstanceOfSatisfying(StructureException.class, e ->
                        assertThat(e.getCode()).isEqualTo(ParserErrorCode.MISSING_EXCLUSIVE_AFTER_ADD));
    }

    @Test
    void lengthMismatchNamesBothLines() {
        Line previous = line(3, "4c\t4d");
        Line next = line(4, "4e");

        assertThatThrownBy(() -> stitcher.stitch(previous, next))
                .isInstanceOfSatisfying(StructureException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(ParserErrorCode.LINE_LENGTH_MISMATCH);
                    assertThat(e.getMessage()).startsWith("Error lines 4 and 5 not same length");
                    assertThat(e.getMessage()).contains("Line 4: 4c\t4d", "Line 5: 4e");
                });
    }

    /**
     * Verifies that a next line which is too short or too long for the manipulators is an alignment error.
     */
    @Test
    void alignmentErrors() {
        Line previous = line(0, "*^\t*");
        Line tooShort = line(1, "a\tb");

        assertThatThrownBy(() -> stitcher.stitch(previous, tooShort))
                .isInstanceOfSatisfying(StructureException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(ParserErrorCode.ALIGNMENT);
                    assertThat(e.getMessage()).startsWith("Cannot stitch lines 1 and 2");
                });

        Line merge = line(5, "*v\t*v\t*");
        Line tooLong = line(6, "a\tb\tc");

        assertThatThrownBy(() -> stitcher.stitch(merge, tooLong))
                .isInstanceOfSatisfying(StructureException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(ParserErrorCode.ALIGNMENT);
                    assertThat(e.getMessage()).contains("lines 6 and 7");
                });
    }
}
