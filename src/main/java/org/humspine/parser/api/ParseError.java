package org.humspine.parser.api;

/**
 * A structured description of the error that stopped a parse.
 *
 * @param code The error category.
 * @param message The human-readable message, including the offending line text where useful.
 * @param sourceName The name of the parsed input.
 * @param lineNumber The 1-based line number, or 0 when the error is not tied to a line.
 * @param fieldIndex The 0-based field index, or -1 when the error concerns the whole line.
 */
public record ParseError(
        ParserErrorCode code,
        String message,
        String sourceName,
        int lineNumber,
        int fieldIndex
) {
    @Override
    public String toString() {
        if (lineNumber <= 0) {
            return String.format("[%s] %s: %s", code, sourceName, message);
        }
        if (fieldIndex < 0) {
            return String.format("[%s] %s:%d: %s", code, sourceName, lineNumber, message);
        }
        return String.format("[%s] %s:%d:%d: %s", code, sourceName, lineNumber, fieldIndex + 1, message);
    }
}
