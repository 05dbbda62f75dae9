package org.humspine.parser.diagnostics;

import org.humspine.parser.api.ParserErrorCode;

/**
 * Represents a single diagnostic message, an error or a warning,
 * that occurs while analysing a Humdrum file.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The error category; {@code null} for warnings.
 * @param message The diagnostic message.
 * @param sourceName The name of the input where the issue occurred.
 * @param lineNumber The 1-based line number of the issue, or 0 if not tied to a line.
 * @param fieldIndex The 0-based field index of the issue, or -1 if it concerns the whole line.
 */
public record Diagnostic(
        Type type,
        ParserErrorCode code,
        String message,
        String sourceName,
        int lineNumber,
        int fieldIndex
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that invalidates the parse. */
        ERROR,
        /** A warning that does not invalidate the parse. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, sourceName, lineNumber, message);
    }
}
