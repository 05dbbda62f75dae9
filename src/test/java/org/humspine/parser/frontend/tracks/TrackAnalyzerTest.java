package org.humspine.parser.frontend.tracks;

import org.humspine.parser.api.ParserErrorCode;
import org.humspine.parser.frontend.StructureException;
import org.humspine.parser.model.Line;
import org.humspine.parser.model.Token;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link TrackAnalyzer}.
 */
@Tag("unit")
class TrackAnalyzerTest {

    private final TrackAnalyzer analyzer = new TrackAnalyzer();

    private static Line labelled(String text, String... spinePaths) {
        Line line = new Line(text);
        line.setLineIndex(0);
        for (int i = 0; i < spinePaths.length; i++) {
            line.getToken(i).setSpineInfo(spinePaths[i]);
        }
        return line;
    }

    /**
     * Verifies that tokens sharing a track are numbered from 1 while a lone token gets subtrack 0.
     */
    @Test
    void numbersSubtracks() throws StructureException {
        // Arrange
        Line line = labelled("4c\t4e\tp", "(1)a", "(1)b", "2");

        // Act
        analyzer.analyze(line);

        // Assert
        Token c = line.getToken(0);
        Token e = line.getToken(1);
        Token p = line.getToken(2);
        assertThat(c.getTrack()).isEqualTo(1);
        assertThat(c.getSubtrack()).isEqualTo(1);
        assertThat(e.getSubtrack()).isEqualTo(2);
        assertThat(e.getSubtrackCount()).isEqualTo(2);
        assertThat(p.getTrack()).isEqualTo(2);
        assertThat(p.getSubtrack()).isZero();
        assertThat(p.getSubtrackCount()).isEqualTo(1);
    }

    @Test
    void globalLinesBelongToTrackZero() throws StructureException {
        Line line = labelled("!! comment");

        analyzer.analyze(line);

        assertThat(line.getToken(0).getTrack()).isZero();
        assertThat(line.getToken(0).getFieldIndex()).isZero();
    }

    @Test
    void unlabelledTokenIsInternalError() {
        Line line = labelled("4c\t4d", "1");

        assertThatThrownBy(() -> analyzer.analyze(line))
                .isInstanceOfSatisfying(StructureException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(ParserErrorCode.INTERNAL);
                    assertThat(e.getFieldIndex()).isEqualTo(1);
                });
    }
}
