package org.humspine.parser.frontend;

import org.humspine.parser.api.ParserErrorCode;

/**
 * Thrown by an analysis phase when the spine structure of a file is invalid.
 * The pipeline catches it, records it as a diagnostic and stops.
 */
public class StructureException extends Exception {

    private final ParserErrorCode code;
    private final int lineNumber;
    private final int fieldIndex;

    /**
     * @param code The error category.
     * @param message The message.
     * @param lineNumber The 1-based line number the error refers to.
     * @param fieldIndex The 0-based field index, or -1 for the whole line.
     */
    public StructureException(ParserErrorCode code, String message, int lineNumber, int fieldIndex) {
        super(message);
        this.code = code;
        this.lineNumber = lineNumber;
        this.fieldIndex = fieldIndex;
    }

    /**
     * @param code The error category.
     * @param message The message.
     * @param lineNumber The 1-based line number the error refers to.
     */
    public StructureException(ParserErrorCode code, String message, int lineNumber) {
        this(code, message, lineNumber, -1);
    }

    public ParserErrorCode getCode() {
        return code;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public int getFieldIndex() {
        return fieldIndex;
    }
}
