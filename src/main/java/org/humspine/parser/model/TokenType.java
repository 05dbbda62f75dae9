package org.humspine.parser.model;

/**
 * Defines the different kinds of tokens that can appear in a Humdrum field.
 * The kind is derived purely from the token text, see {@link #classify(String)}.
 */
public enum TokenType {
    // Spine manipulators.
    /** An exclusive interpretation such as {@code **kern}, which opens a spine. */
    EXCLUSIVE,
    /** The split manipulator {@code *^}. */
    SPLIT,
    /** The merge manipulator {@code *v}. */
    MERGE,
    /** The exchange manipulator {@code *x}. */
    EXCHANGE,
    /** The add manipulator {@code *+}. */
    ADD,
    /** The terminate manipulator {@code *-}. */
    TERMINATE,

    // Other spine content.
    /** Any other tandem interpretation, including the null interpretation {@code *}. */
    INTERPRETATION,
    /** The null data placeholder {@code .}. */
    NULL_DATA,
    /** A local comment starting with a single {@code !}. */
    LOCAL_COMMENT,
    /** Ordinary data. */
    DATA,

    // Tokens of lines without spine structure.
    /** A global comment starting with {@code !!}, including reference records. */
    GLOBAL_COMMENT,
    /** The single token of an empty line. */
    EMPTY;

    /**
     * Classifies token text.
     *
     * @param text The raw token text.
     * @return The token kind.
     */
    public static TokenType classify(String text) {
        if (text == null || text.isEmpty()) {
            return EMPTY;
        }
        switch (text.charAt(0)) {
            case '*':
                if (text.startsWith("**")) {
                    return EXCLUSIVE;
                }
                switch (text) {
                    case "*^": return SPLIT;
                    case "*v": return MERGE;
                    case "*x": return EXCHANGE;
                    case "*+": return ADD;
                    case "*-": return TERMINATE;
                    default: return INTERPRETATION;
                }
            case '!':
                return text.startsWith("!!") ? GLOBAL_COMMENT : LOCAL_COMMENT;
            case '.':
                return text.length() == 1 ? NULL_DATA : DATA;
            default:
                return DATA;
        }
    }

    /**
     * @return {@code true} for tokens that change the spine topology, exclusive interpretations included.
     */
    public boolean isManipulator() {
        return this == EXCLUSIVE || this == SPLIT || this == MERGE
                || this == EXCHANGE || this == ADD || this == TERMINATE;
    }

    /**
     * @return {@code true} for any interpretation token, manipulators included.
     */
    public boolean isInterpretation() {
        return isManipulator() || this == INTERPRETATION;
    }

    /**
     * @return {@code true} for data tokens, null data included.
     */
    public boolean isData() {
        return this == DATA || this == NULL_DATA;
    }
}
