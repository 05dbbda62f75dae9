package org.humspine.parser.model;

/**
 * Classification of a whole Humdrum line.
 */
public enum LineType {
    /** A blank line. */
    EMPTY(false),
    /** A global comment ({@code !!...}). */
    GLOBAL_COMMENT(false),
    /** A reference record ({@code !!!key: value}). */
    REFERENCE(false),
    /** A line of local comments. */
    LOCAL_COMMENT(true),
    /** A line of exclusive interpretations, possibly mixed with other interpretations. */
    EXCLUSIVE(true),
    /** An interpretation line carrying at least one split, merge, exchange, add or terminate token. */
    MANIPULATOR(true),
    /** An interpretation line without spine manipulators. */
    INTERPRETATION(true),
    /** A data line. */
    DATA(true);

    private final boolean spines;

    LineType(boolean spines) {
        this.spines = spines;
    }

    /**
     * @return {@code true} if lines of this type take part in the spine structure.
     */
    public boolean hasSpines() {
        return spines;
    }
}
