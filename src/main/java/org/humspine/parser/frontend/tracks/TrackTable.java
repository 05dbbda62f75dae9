package org.humspine.parser.frontend.tracks;

import org.humspine.parser.model.Token;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

/**
 * Registry of the tracks (primary spines) of a file.
 * <p>
 * Track numbers start at 1 and are handed out in discovery order; they are never reused. Index 0 is
 * reserved for tokens outside the spine structure and always maps to a {@code null} start. A track
 * has one start token, its exclusive interpretation, and any number of end tokens, because a spine that
 * split terminates once per branch.
 */
public class TrackTable {

    private final List<Token> starts = new ArrayList<>();
    private final List<List<Token>> ends = new ArrayList<>();
    private final BitSet closed = new BitSet();

    /**
     * Creates an empty table holding only the reserved track 0.
     */
    public TrackTable() {
        starts.add(null);
        ends.add(new ArrayList<>());
    }

    /**
     * Opens a new track that starts at the given exclusive interpretation.
     * @param start The exclusive interpretation token.
     * @return The new track number.
     */
    public int openTrack(Token start) {
        starts.add(start);
        ends.add(new ArrayList<>());
        return starts.size() - 1;
    }

    /**
     * Allocates a track number for a spine opened by an add manipulator. The start token is
     * supplied later with {@link #assignStart(int, Token)}.
     * @return The reserved track number.
     */
    public int reserveTrack() {
        return openTrack(null);
    }

    /**
     * @param track A track number.
     * @return {@code true} if the track was reserved and has no start token yet.
     */
    public boolean isPending(int track) {
        return track > 0 && track < starts.size() && starts.get(track) == null;
    }

    /**
     * Stores the start token of a reserved track.
     * @param track The reserved track number.
     * @param start The exclusive interpretation token.
     * @throws IllegalStateException if the track is not pending.
     */
    public void assignStart(int track, Token start) {
        if (!isPending(track)) {
            throw new IllegalStateException("Track " + track + " is not awaiting a start token");
        }
        starts.set(track, start);
    }

    /**
     * Records a terminator token for a track.
     * @param track The track number.
     * @param end The terminate manipulator token.
     */
    public void closeTrack(int track, Token end) {
        if (track <= 0 || track >= ends.size()) {
            throw new IllegalArgumentException("Unknown track " + track);
        }
        ends.get(track).add(end);
    }

    /**
     * Marks a track as finished: every branch descending from it has terminated.
     * @param track The track number.
     */
    public void markClosed(int track) {
        closed.set(track);
    }

    /**
     * @param track A track number.
     * @return {@code true} once every branch of the track has reached a terminator.
     */
    public boolean isClosed(int track) {
        return closed.get(track);
    }

    /**
     * @return The highest track number in use, 0 for an empty file.
     */
    public int getMaxTrack() {
        return starts.size() - 1;
    }

    /**
     * @param track A track number.
     * @return The exclusive interpretation starting the track, or {@code null} if the track is out of range.
     */
    public Token getTrackStart(int track) {
        if (track > 0 && track < starts.size()) {
            return starts.get(track);
        }
        return null;
    }

    /**
     * @param track A track number; negative values count from the end.
     * @return The terminators of the track, empty if the track is out of range.
     */
    public List<Token> getTrackEnds(int track) {
        int t = track < 0 ? track + ends.size() : track;
        if (t < 0 || t >= ends.size()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(ends.get(t));
    }

    /**
     * @param track A track number; negative values count from the end.
     * @return The number of terminators of the track.
     */
    public int getTrackEndCount(int track) {
        return getTrackEnds(track).size();
    }

    /**
     * @param track A track number; negative values count from the end.
     * @param index The terminator index; negative values count from the end.
     * @return The terminator, or {@code null} if either index is out of range.
     */
    public Token getTrackEnd(int track, int index) {
        List<Token> list = getTrackEnds(track);
        int i = index < 0 ? index + list.size() : index;
        if (i < 0 || i >= list.size()) {
            return null;
        }
        return list.get(i);
    }
}
