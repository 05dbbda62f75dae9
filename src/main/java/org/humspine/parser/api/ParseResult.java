package org.humspine.parser.api;

import org.humspine.parser.HumdrumFile;

import java.util.Optional;

/**
 * The outcome of a parse: either a valid {@link HumdrumFile} or the {@link ParseError} that stopped it.
 * A failed parse never exposes its partial structure through {@link #file()}.
 */
public final class ParseResult {

    private final HumdrumFile file;
    private final ParseError error;

    private ParseResult(HumdrumFile file, ParseError error) {
        this.file = file;
        this.error = error;
    }

    /**
     * @param file The successfully parsed file.
     * @return A successful result.
     */
    public static ParseResult success(HumdrumFile file) {
        return new ParseResult(file, null);
    }

    /**
     * @param error The error that stopped the parse.
     * @return A failed result.
     */
    public static ParseResult failure(ParseError error) {
        return new ParseResult(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return The parsed file, empty if the parse failed.
     */
    public Optional<HumdrumFile> file() {
        return Optional.ofNullable(file);
    }

    /**
     * @return The error, empty if the parse succeeded.
     */
    public Optional<ParseError> error() {
        return Optional.ofNullable(error);
    }

    /**
     * @return The parsed file.
     * @throws ParseException if the parse failed.
     */
    public HumdrumFile getOrThrow() throws ParseException {
        if (error != null) {
            throw new ParseException(error);
        }
        return file;
    }
}
