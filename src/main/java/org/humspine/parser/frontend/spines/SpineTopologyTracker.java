package org.humspine.parser.frontend.spines;

import org.humspine.parser.api.ParserErrorCode;
import org.humspine.parser.diagnostics.ParserLogger;
import org.humspine.parser.frontend.StructureException;
import org.humspine.parser.frontend.tracks.TrackTable;
import org.humspine.parser.model.Line;
import org.humspine.parser.model.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Follows the spine layout from top to bottom.
 * <p>
 * The tracker keeps one {@link SpineColumn} per active spine. Every structural line is checked against the
 * current width and its tokens receive the column's spine path and datatype. Manipulator lines then
 * rewrite the columns for the following line. Track starts and ends are recorded in the {@link TrackTable}
 * as exclusive interpretations and terminators are met.
 * <p>
 * Lines without spine structure must not be passed to {@link #advance(Line)}.
 */
public class SpineTopologyTracker {

    private final TrackTable tracks;
    private List<SpineColumn> columns;
    private final List<Integer> pendingColumns = new ArrayList<>();
    private Line pendingAddLine;
    private Line lastLine;

    /**
     * @param tracks The table receiving track starts and ends.
     */
    public SpineTopologyTracker(TrackTable tracks) {
        this.tracks = tracks;
    }

    /**
     * @return {@code true} once the first exclusive interpretation line was seen.
     */
    public boolean isInitialized() {
        return columns != null;
    }

    /**
     * @return The columns expected on the next structural line.
     */
    public List<SpineColumn> getColumns() {
        return columns == null ? Collections.emptyList() : Collections.unmodifiableList(columns);
    }

    /**
     * @return The number of fields expected on the next structural line.
     */
    public int getWidth() {
        return columns == null ? 0 : columns.size();
    }

    /**
     * Processes the next structural line.
     *
     * @param line A line that has spine structure.
     * @throws StructureException if the line does not fit the current spine layout.
     */
    public void advance(Line line) throws StructureException {
        if (columns == null) {
            initialize(line);
            return;
        }
        if (line.getTokenCount() != columns.size()) {
            throw new StructureException(ParserErrorCode.FIELD_COUNT_MISMATCH,
                    "Error lines " + lastLine.getLineNumber() + " and " + line.getLineNumber()
                            + " not same length\n   Expected " + columns.size() + " fields, but found "
                            + line.getTokenCount()
                            + "\n   LINE " + lastLine.getLineNumber() + ": " + lastLine.getText()
                            + "\n   LINE " + line.getLineNumber() + ": " + line.getText(),
                    line.getLineNumber());
        }
        checkPendingExclusives(line);
        lastLine = line;

        for (int i = 0; i < columns.size(); i++) {
            Token token = line.getToken(i);
            SpineColumn column = columns.get(i);
            token.setFieldIndex(i);
            token.setSpineInfo(column.spinePath());
            token.setDataType(column.dataType());
        }
        if (!line.hasManipulators()) {
            return;
        }
        columns = adjust(line);
        ParserLogger.trace("Spine layout after line " + line.getLineNumber() + ": " + columns);
    }

    /**
     * Verifies the end of the input: a spine opened by an add manipulator must have received its
     * exclusive interpretation.
     *
     * @throws StructureException if an add manipulator was the last structural event of the file.
     */
    public void finish() throws StructureException {
        if (!pendingColumns.isEmpty()) {
            throw new StructureException(ParserErrorCode.MISSING_EXCLUSIVE_AFTER_ADD,
                    "Expecting exclusive interpretation after add manipulator on line "
                            + pendingAddLine.getLineNumber() + ", but the input ended",
                    pendingAddLine.getLineNumber());
        }
    }

    /**
     * @return The tracks that still have active columns.
     */
    public Set<Integer> getOpenTracks() {
        Set<Integer> open = new LinkedHashSet<>();
        for (SpineColumn column : getColumns()) {
            open.add(column.track());
        }
        return open;
    }

    private void initialize(Line line) throws StructureException {
        for (int i = 0; i < line.getTokenCount(); i++) {
            if (!line.getToken(i).isExclusive()) {
                throw new StructureException(ParserErrorCode.DATA_BEFORE_EXCLUSIVE,
                        "Error on line " + line.getLineNumber()
                                + ":\n   Data found before exclusive interpretation\n   LINE: " + line.getText(),
                        line.getLineNumber(), i);
            }
        }
        columns = new ArrayList<>(line.getTokenCount());
        lastLine = line;
        for (int i = 0; i < line.getTokenCount(); i++) {
            Token token = line.getToken(i);
            int track = tracks.openTrack(token);
            SpineColumn column = new SpineColumn(token.getText(), String.valueOf(track));
            token.setFieldIndex(i);
            token.setSpineInfo(column.spinePath());
            token.setDataType(column.dataType());
            columns.add(column);
        }
        ParserLogger.debug("Opened " + columns.size() + " spine(s) on line " + line.getLineNumber());
    }

    private void checkPendingExclusives(Line line) throws StructureException {
        for (int index : pendingColumns) {
            Token token = line.getToken(index);
            if (!token.isExclusive()) {
                throw new StructureException(ParserErrorCode.MISSING_EXCLUSIVE_AFTER_ADD,
                        "Expecting exclusive interpretation on line " + line.getLineNumber()
                                + " at token " + index + " but got " + token.getText(),
                        line.getLineNumber(), index);
            }
        }
        pendingColumns.clear();
        pendingAddLine = null;
    }

    private List<SpineColumn> adjust(Line line) throws StructureException {
        List<SpineColumn> result = new ArrayList<>(columns.size() + 2);
        Set<Integer> terminated = new LinkedHashSet<>();
        int count = line.getTokenCount();

        for (int i = 0; i < count; i++) {
            Token token = line.getToken(i);
            SpineColumn column = columns.get(i);
            switch (token.getType()) {
                case SPLIT:
                    result.add(new SpineColumn(column.dataType(), SpinePaths.splitLeft(column.spinePath())));
                    result.add(new SpineColumn(column.dataType(), SpinePaths.splitRight(column.spinePath())));
                    break;
                case MERGE: {
                    int end = i + 1;
                    while (end < count && line.getToken(end).isMerge()) end++;
                    List<String> labels = new ArrayList<>(end - i);
                    for (int j = i; j < end; j++) {
                        labels.add(columns.get(j).spinePath());
                    }
                    result.add(new SpineColumn(column.dataType(), SpinePaths.merge(labels)));
                    i = end - 1;
                    break;
                }
                case EXCHANGE:
                    if (i + 1 >= count || !line.getToken(i + 1).isExchange()) {
                        throw new StructureException(ParserErrorCode.UNPAIRED_EXCHANGE,
                                "Exchange manipulator without a partner on line " + line.getLineNumber()
                                        + " at token " + i + "\n   LINE: " + line.getText(),
                                line.getLineNumber(), i);
                    }
                    result.add(columns.get(i + 1));
                    result.add(column);
                    i++;
                    break;
                case ADD: {
                    result.add(column);
                    int newTrack = tracks.reserveTrack();
                    result.add(new SpineColumn("", String.valueOf(newTrack)));
                    pendingColumns.add(result.size() - 1);
                    pendingAddLine = line;
                    ParserLogger.debug("Reserved track " + newTrack + " on line " + line.getLineNumber());
                    break;
                }
                case TERMINATE: {
                    int track = column.track();
                    tracks.closeTrack(track, token);
                    terminated.add(track);
                    break;
                }
                case EXCLUSIVE: {
                    int track = column.track();
                    if (!tracks.isPending(track)) {
                        throw new StructureException(ParserErrorCode.UNPREPARED_EXCLUSIVE,
                                "Exclusive interpretation with no preparation on line " + line.getLineNumber()
                                        + " spine index " + i + "\n   LINE: " + line.getText(),
                                line.getLineNumber(), i);
                    }
                    tracks.assignStart(track, token);
                    token.setDataType(token.getText());
                    result.add(new SpineColumn(token.getText(), column.spinePath()));
                    break;
                }
                default:
                    result.add(column);
                    break;
            }
        }

        for (int track : terminated) {
            boolean stillOpen = result.stream().anyMatch(c -> c.track() == track);
            if (!stillOpen) {
                tracks.markClosed(track);
            }
        }
        return result;
    }
}
