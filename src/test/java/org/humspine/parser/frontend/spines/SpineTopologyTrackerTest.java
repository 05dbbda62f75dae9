package org.humspine.parser.frontend.spines;

import org.humspine.parser.api.ParserErrorCode;
import org.humspine.parser.frontend.StructureException;
import org.humspine.parser.frontend.tracks.TrackTable;
import org.humspine.parser.model.Line;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link SpineTopologyTracker}.
 * Each test feeds indexed structural lines to the tracker and checks the labels it assigns,
 * the resulting track table, or the error it raises.
 */
@Tag("unit")
class SpineTopologyTrackerTest {

    private TrackTable tracks;
    private SpineTopologyTracker tracker;

    @BeforeEach
    void setUp() {
        tracks = new TrackTable();
        tracker = new SpineTopologyTracker(tracks);
    }

    private static List<Line> lines(String... texts) {
        List<Line> result = new ArrayList<>();
        for (int i = 0; i < texts.length; i++) {
            Line line = new Line(texts[i]);
            line.setLineIndex(i);
            result.add(line);
        }
        return result;
    }

    private void advanceAll(List<Line> lines) throws StructureException {
        for (Line line : lines) {
            tracker.advance(line);
        }
    }

    /**
     * Verifies that a split produces sibling labels that a merge collapses again,
     * and that the terminator closes the track.
     */
    @Test
    void splitAndMergeLabels() throws StructureException {
        // Arrange
        List<Line> lines = lines("**kern", "*^", "4c\t4e", "*v\t*v", "4g", "*-");

        // Act
        advanceAll(lines);
        tracker.finish();

        // Assert
        assertThat(lines.get(2).getToken(0).getSpineInfo()).isEqualTo("(1)a");
        assertThat(lines.get(2).getToken(1).getSpineInfo()).isEqualTo("(1)b");
        assertThat(lines.get(4).getToken(0).getSpineInfo()).isEqualTo("1");
        assertThat(lines.get(4).getToken(0).getDataType()).isEqualTo("**kern");
        assertThat(tracker.getWidth()).isZero();
        assertThat(tracker.getOpenTracks()).isEmpty();
        assertThat(tracks.getTrackEndCount(1)).isEqualTo(1);
        assertThat(tracks.isClosed(1)).isTrue();
    }

    /**
     * Verifies that a three-column merge collapses to a single column with a space-joined label,
     * and that a track stays open until its last branch terminates.
     */
    @Test
    void threeWayMergeAndBranchTerminators() throws StructureException {
        // Arrange
        List<Line> lines = lines("**kern", "*^", "*^\t*", "*v\t*v\t*v", "*^", "*-\t*");

        // Act
        advanceAll(lines);

        // Assert
        assertThat(lines.get(4).getToken(0).getSpineInfo()).isEqualTo("((1)a)a ((1)a)b (1)b");
        assertThat(tracker.getColumns()).extracting(SpineColumn::spinePath)
                .containsExactly("(((1)a)a ((1)a)b (1)b)b");
        assertThat(tracks.getTrackEndCount(1)).isEqualTo(1);
        assertThat(tracks.isClosed(1)).isFalse();
        assertThat(tracker.getOpenTracks()).containsExactly(1);
    }

    /**
     * Verifies that track numbers are never reused: a spine added after a terminator gets a new number.
     */
    @Test
    void addAfterTerminateAllocatesNewTrack() throws StructureException {
        List<Line> lines = lines("**a\t**b", "*\t*-", "*+", "*\t**c");

        advanceAll(lines);
        tracker.finish();

        assertThat(tracks.isClosed(2)).isTrue();
        assertThat(tracks.getMaxTrack()).isEqualTo(3);
        assertThat(tracks.getTrackStart(3)).isSameAs(lines.get(3).getToken(1));
        assertThat(tracker.getOpenTracks()).containsExactly(1, 3);
    }

    /**
     * Verifies that an exchange swaps the columns, labels and datatypes included.
     */
    @Test
    void exchangeSwapsColumns() throws StructureException {
        List<Line> lines = lines("**a\t**b", "*x\t*x", "1\t2");

        advanceAll(lines);

        assertThat(lines.get(2).getToken(0).getSpineInfo()).isEqualTo("2");
        assertThat(lines.get(2).getToken(0).getDataType()).isEqualTo("**b");
        assertThat(lines.get(2).getToken(1).getSpineInfo()).isEqualTo("1");
        assertThat(lines.get(2).getToken(1).getDataType()).isEqualTo("**a");
    }

    /**
     * Verifies that an added spine gets the next free track number once its exclusive
     * interpretation arrives.
     */
    @Test
    void addedSpineOpensNewTrack() throws StructureException {
        List<Line> lines = lines("**kern\t**kern", "*\t*+", "*\t*\t**text", "4c\t4e\tla");

        advanceAll(lines);
        tracker.finish();

        assertThat(tracks.getMaxTrack()).isEqualTo(3);
        assertThat(tracks.getTrackStart(3)).isSameAs(lines.get(2).getToken(2));
        assertThat(lines.get(3).getToken(2).getSpineInfo()).isEqualTo("3");
        assertThat(lines.get(3).getToken(2).getDataType()).isEqualTo("**text");
        assertThat(tracker.getOpenTracks()).containsExactly(1, 2, 3);
    }

    @Test
    void dataBeforeExclusive() {
        List<Line> lines = lines("4c");

        assertThatThrownBy(() -> advanceAll(lines))
                .isInstanceOfSatisfying(StructureException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(ParserErrorCode.DATA_BEFORE_EXCLUSIVE);
                    assertThat(e.getLineNumber()).isEqualTo(1);
                });
    }

    @Test
    void fieldCountMismatch() {
        List<Line> lines = lines("**kern\t**kern", "4c");

        assertThatThrownBy(() -> advanceAll(lines))
                .isInstanceOfSatisfying(StructureException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(ParserErrorCode.FIELD_COUNT_MISMATCH);
                    assertThat(e.getLineNumber()).isEqualTo(2);
                    assertThat(e.getMessage())
                            .startsWith("Error lines 1 and 2 not same length")
                            .contains("Expected 2 fields");
                });
    }

    @Test
    void unpairedExchange() {
        List<Line> lines = lines("**kern\t**kern", "*x\t*");

        assertThatThrownBy(() -> advanceAll(lines))
                .isInstanceOfSatisfying(StructureException.class, e ->
                        assertThat(e.getCode()).isEqualTo(ParserErrorCode.UNPAIRED_EXCHANGE));
    }

    /**
     * Verifies that an add manipulator must be followed by an exclusive interpretation in the new column.
     */
    @Test
    void addWithoutExclusive() {
        List<Line> lines = lines("**kern", "*+", "*\t*");

        assertThatThrownBy(() -> advanceAll(lines))
                .isInstanceOfSatisfying(StructureException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(ParserErrorCode.MISSING_EXCLUSIVE_AFTER_ADD);
                    assertThat(e.getLineNumber()).isEqualTo(3);
                    assertThat(e.getFieldIndex()).isEqualTo(1);
                });
    }

    @Test
    void addAtEndOfInput() throws StructureException {
        advanceAll(lines("**kern", "*+"));

        assertThatThrownBy(() -> tracker.finish())
                .isInstanceOfSatisfying(StructureException.class, e ->
                        assertThat(e.getCode()).isEqualTo(ParserErrorCode.MISSING_EXCLUSIVE_AFTER_ADD));
    }

    /**
     * Verifies that an exclusive interpretation in an established spine is rejected.
     */
    @Test
    void unpreparedExclusive() {
        List<Line> lines = lines("**kern", "**text");

        assertThatThrownBy(() -> advanceAll(lines))
                .isInstanceOfSatisfying(StructureException.class, e ->
                        assertThat(e.getCode()).isEqualTo(ParserErrorCode.UNPREPARED_EXCLUSIVE));
    }
}
