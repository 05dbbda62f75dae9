package org.humspine.parser.api;

/**
 * Filters applied when a track's tokens are extracted from a parsed file.
 */
public enum TrackSequenceOption {
    /** Leave out null tokens ({@code .}, {@code *} and {@code !}). */
    EXCLUDE_NULLS,
    /** Leave out split, merge, exchange and add manipulators; exclusive interpretations and terminators stay. */
    EXCLUDE_MANIPULATORS,
    /** Leave out lines without spine structure (global comments, reference records, blank lines). */
    EXCLUDE_GLOBALS
}
