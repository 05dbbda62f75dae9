package org.humspine.parser.api;

/**
 * Defines unique, testable error codes for all errors that can occur while parsing a Humdrum file.
 * This decouples the test logic from the wording of the error messages.
 */
public enum ParserErrorCode {
    // region Input Errors
    /** The input file is missing or could not be read. */
    IO_ERROR,
    // endregion

    // region Spine Structure Errors
    /** A data, comment or interpretation line was found before the first exclusive interpretation line. */
    DATA_BEFORE_EXCLUSIVE,
    /** A structural line does not have as many fields as there are active spines. */
    FIELD_COUNT_MISMATCH,
    /** The token after an add manipulator ({@code *+}) is not an exclusive interpretation. */
    MISSING_EXCLUSIVE_AFTER_ADD,
    /** An exchange manipulator ({@code *x}) has no adjacent partner. */
    UNPAIRED_EXCHANGE,
    /** An exclusive interpretation appears in a spine that was not opened by an add manipulator. */
    UNPREPARED_EXCLUSIVE,
    // endregion

    // region Linking Errors
    /** Two adjacent lines without manipulators have different numbers of fields. */
    LINE_LENGTH_MISMATCH,
    /** The tokens of two adjacent lines could not be aligned. */
    ALIGNMENT,
    // endregion

    // region General Errors
    /** A structurally unreachable state was reached. */
    INTERNAL
    // endregion
}
