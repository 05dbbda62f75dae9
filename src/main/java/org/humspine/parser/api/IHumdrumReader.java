package org.humspine.parser.api;

import org.humspine.parser.HumdrumFile;

import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface for reading Humdrum data into a token graph.
 * <p>
 * None of the parse methods throw for malformed input or unreadable files; the outcome is reported
 * through the returned {@link ParseResult}.
 */
public interface IHumdrumReader {

    /**
     * Parses tab-separated lines.
     *
     * @param lines The raw lines, without line terminators.
     * @param sourceName A name for the input, used in diagnostics.
     * @return The parse result.
     */
    ParseResult parse(List<String> lines, String sourceName);

    /**
     * Parses CSV records using the configured separator.
     *
     * @param csvLines The raw CSV records.
     * @param sourceName A name for the input, used in diagnostics.
     * @return The parse result.
     */
    ParseResult parseCsv(List<String> csvLines, String sourceName);

    /**
     * Reads and parses a tab-separated file.
     *
     * @param path The file to read.
     * @return The parse result; an unreadable file yields an {@link ParserErrorCode#IO_ERROR} failure.
     */
    ParseResult parse(Path path);

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=errors only .. 4=trace).
     */
    void setVerbosity(int level);

    /**
     * Parses tab-separated lines and returns the file, throwing if it is invalid.
     *
     * @param lines The raw lines.
     * @param sourceName A name for the input.
     * @return The parsed file.
     * @throws ParseException if the input is not a valid Humdrum file.
     */
    default HumdrumFile parseOrThrow(List<String> lines, String sourceName) throws ParseException {
        return parse(lines, sourceName).getOrThrow();
    }
}
