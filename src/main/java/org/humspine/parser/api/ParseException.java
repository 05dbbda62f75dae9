package org.humspine.parser.api;

/**
 * An exception that is thrown by {@link IHumdrumReader#parseOrThrow} when a file cannot be parsed.
 * <p>
 * It is part of the public API and hides the internal exception types of the parser.
 */
public class ParseException extends Exception {

    private final transient ParseError error;

    /**
     * Constructs a new parse exception for the given error.
     * @param error The error that stopped the parse.
     */
    public ParseException(ParseError error) {
        super(error.toString(), null);
        this.error = error;
    }

    /**
     * @return The structured error.
     */
    public ParseError getError() {
        return error;
    }
}
