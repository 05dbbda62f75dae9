package org.humspine.parser;

import org.humspine.parser.api.ParseError;
import org.humspine.parser.api.TrackSequenceOption;
import org.humspine.parser.diagnostics.Diagnostic;
import org.humspine.parser.frontend.tracks.TrackTable;
import org.humspine.parser.model.Line;
import org.humspine.parser.model.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A parsed Humdrum file: its lines, their tokens and the links between them.
 * <p>
 * Instances are produced by {@link HumdrumReader}. Always check {@link #isValid()} before traversing;
 * the structure of an invalid file is incomplete. A file is not thread-safe.
 */
public class HumdrumFile implements Iterable<Line> {

    private final String sourceName;
    private final List<Line> lines = new ArrayList<>();
    private TrackTable trackTable = new TrackTable();
    private ParseError parseError;
    private List<Diagnostic> warnings = Collections.emptyList();

    HumdrumFile(String sourceName) {
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }

    // Validity

    /**
     * @return {@code true} if the last analysis succeeded.
     */
    public boolean isValid() {
        return parseError == null;
    }

    /**
     * @return The message of the error that stopped the last analysis, or an empty string.
     */
    public String getParseError() {
        return parseError == null ? "" : parseError.message();
    }

    /**
     * @return The structured error of the last analysis, if any.
     */
    public Optional<ParseError> getParseErrorDetail() {
        return Optional.ofNullable(parseError);
    }

    /**
     * @return Non-fatal diagnostics of the last analysis.
     */
    public List<Diagnostic> getWarnings() {
        return warnings;
    }

    // Lines and tokens

    public int getLineCount() {
        return lines.size();
    }

    /**
     * @param index The line index; negative values count from the end ({@code -1} is the last line).
     * @return The line.
     * @throws IndexOutOfBoundsException if the index is outside the file.
     */
    public Line getLine(int index) {
        int i = index < 0 ? lines.size() + index : index;
        return lines.get(i);
    }

    public List<Line> getLines() {
        return Collections.unmodifiableList(lines);
    }

    /**
     * @param lineIndex The line index; negative values count from the end.
     * @param fieldIndex The field index; negative values count from the end of the line.
     * @return The token.
     * @throws IndexOutOfBoundsException if either index is out of range.
     */
    public Token getToken(int lineIndex, int fieldIndex) {
        return getLine(lineIndex).getToken(fieldIndex);
    }

    @Override
    public Iterator<Line> iterator() {
        return getLines().iterator();
    }

    /**
     * Adds a raw line at the end of the file. The spine structure is not updated until the file is
     * analysed again with {@link HumdrumReader#reanalyze(HumdrumFile)}.
     * @param text The raw line.
     */
    public void append(String text) {
        Line line = new Line(text);
        line.setLineIndex(lines.size());
        lines.add(line);
    }

    /**
     * Rebuilds the text of every line from its tokens, after token text was edited in place.
     */
    public void createLinesFromTokens() {
        for (Line line : lines) {
            line.rebuildFromTokens();
        }
    }

    // Tracks

    /**
     * @return The number of primary spines that were opened in the file.
     */
    public int getMaxTrack() {
        return trackTable.getMaxTrack();
    }

    /**
     * @param track A track number from 1 to {@link #getMaxTrack()}.
     * @return The exclusive interpretation that started the track, or {@code null}.
     */
    public Token getTrackStart(int track) {
        return trackTable.getTrackStart(track);
    }

    /**
     * @param track A track number; negative values count from the end.
     * @return The number of terminators of the track.
     */
    public int getTrackEndCount(int track) {
        return trackTable.getTrackEndCount(track);
    }

    /**
     * @param track A track number; negative values count from the end.
     * @param index The terminator index; negative values count from the end.
     * @return The terminator token, or {@code null}.
     */
    public Token getTrackEnd(int track, int index) {
        return trackTable.getTrackEnd(track, index);
    }

    public List<Token> getTrackEnds(int track) {
        return trackTable.getTrackEnds(track);
    }

    /**
     * @return The exclusive interpretation of every track, in track order.
     */
    public List<Token> getSpineStarts() {
        List<Token> result = new ArrayList<>();
        for (int track = 1; track <= getMaxTrack(); track++) {
            Token start = getTrackStart(track);
            if (start != null) result.add(start);
        }
        return result;
    }

    /**
     * @return The datatype of every track, e.g. {@code [**kern, **dynam]}.
     */
    public List<String> getDataTypes() {
        List<String> result = new ArrayList<>();
        for (Token start : getSpineStarts()) {
            result.add(start.getText());
        }
        return result;
    }

    /**
     * Extracts the tokens of a track by following the first forward link from its start. Only the
     * left-most branch is followed through splits.
     *
     * @param track The track number.
     * @param options The filters to apply.
     * @return The tokens in line order; empty for an unknown track.
     */
    public List<Token> getPrimaryTrackSequence(int track, Set<TrackSequenceOption> options) {
        List<Token> output = new ArrayList<>();
        Token current = getTrackStart(track);
        if (current == null) {
            return output;
        }
        boolean globals = !options.contains(TrackSequenceOption.EXCLUDE_GLOBALS);
        int cursor = 0;
        while (current != null) {
            int lineIndex = current.getLineIndex();
            if (globals) {
                addGlobals(output, cursor, lineIndex);
            }
            cursor = lineIndex + 1;
            if (accept(current, options)) {
                output.add(current);
            }
            current = current.getNextToken(0);
        }
        if (globals) {
            addGlobals(output, cursor, lines.size());
        }
        return output;
    }

    /**
     * @param track The track number.
     * @return The primary sequence of the track without filters.
     */
    public List<Token> getPrimaryTrackSequence(int track) {
        return getPrimaryTrackSequence(track, EnumSet.noneOf(TrackSequenceOption.class));
    }

    /**
     * Extracts all tokens of a track, subspines included, grouped by line. Lines on which the track
     * has no accepted token are left out; a global line contributes its single token unless
     * {@link TrackSequenceOption#EXCLUDE_GLOBALS} is given.
     *
     * @param track The track number.
     * @param options The filters to apply.
     * @return One list per line, in line order.
     */
    public List<List<Token>> getTrackSequence(int track, Set<TrackSequenceOption> options) {
        boolean globals = !options.contains(TrackSequenceOption.EXCLUDE_GLOBALS);
        List<List<Token>> output = new ArrayList<>();
        for (Line line : lines) {
            if (!line.hasSpines()) {
                if (globals) {
                    output.add(List.of(line.getToken(0)));
                }
                continue;
            }
            List<Token> row = new ArrayList<>();
            for (Token token : line.getTokens()) {
                if (token.getTrack() == track && accept(token, options)) {
                    row.add(token);
                }
            }
            if (!row.isEmpty()) {
                output.add(row);
            }
        }
        return output;
    }

    private static boolean accept(Token token, Set<TrackSequenceOption> options) {
        if (options.contains(TrackSequenceOption.EXCLUDE_NULLS) && token.isNull()) {
            return false;
        }
        return !(options.contains(TrackSequenceOption.EXCLUDE_MANIPULATORS)
                && token.isManipulator() && !token.isTerminator() && !token.isExclusive());
    }

    private void addGlobals(List<Token> output, int from, int to) {
        for (int i = from; i < to; i++) {
            Line line = lines.get(i);
            if (!line.hasSpines()) {
                output.add(line.getToken(0));
            }
        }
    }

    // Package-private mutators used by the reader

    void addLine(Line line) {
        lines.add(line);
    }

    void clearLines() {
        lines.clear();
    }

    void resetAnalysis() {
        trackTable = new TrackTable();
        parseError = null;
        warnings = Collections.emptyList();
    }

    TrackTable getTrackTable() {
        return trackTable;
    }

    void setParseError(ParseError parseError) {
        this.parseError = parseError;
    }

    void setWarnings(List<Diagnostic> warnings) {
        this.warnings = List.copyOf(warnings);
    }

    /**
     * @return The file contents, one line per input line, each terminated by a newline.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Line line : lines) {
            sb.append(line.getText()).append('\n');
        }
        return sb.toString();
    }
}
