package org.humspine.parser.api;

import com.typesafe.config.Config;

/**
 * Settings of a {@link IHumdrumReader}.
 *
 * @param csvSeparator The field separator used when reading CSV input.
 * @param noisy Whether a failed parse is logged at WARN level instead of DEBUG.
 * @param linkNonNullTokens Whether data tokens are linked to their nearest non-null neighbours.
 * @param warnUnterminated Whether spines that never reach a terminator produce a warning diagnostic.
 */
public record ParserOptions(
        String csvSeparator,
        boolean noisy,
        boolean linkNonNullTokens,
        boolean warnUnterminated
) {
    /** The configuration path holding the parser settings. */
    public static final String CONFIG_PATH = "humspine.parser";

    public ParserOptions {
        if (csvSeparator == null || csvSeparator.isEmpty()) {
            throw new IllegalArgumentException("csvSeparator must not be empty");
        }
    }

    /**
     * @return The built-in defaults, matching {@code reference.conf}.
     */
    public static ParserOptions defaults() {
        return new ParserOptions(",", false, true, true);
    }

    /**
     * Reads the options from {@code humspine.parser} in the given configuration.
     * Missing keys fall back to {@link #defaults()}.
     *
     * @param config The application configuration.
     * @return The parser options.
     */
    public static ParserOptions fromConfig(Config config) {
        ParserOptions defaults = defaults();
        if (!config.hasPath(CONFIG_PATH)) {
            return defaults;
        }
        Config parser = config.getConfig(CONFIG_PATH);
        return new ParserOptions(
                parser.hasPath("csv-separator") ? parser.getString("csv-separator") : defaults.csvSeparator(),
                parser.hasPath("noisy") ? parser.getBoolean("noisy") : defaults.noisy(),
                parser.hasPath("link-non-null-tokens") ? parser.getBoolean("link-non-null-tokens") : defaults.linkNonNullTokens(),
                parser.hasPath("warn-unterminated") ? parser.getBoolean("warn-unterminated") : defaults.warnUnterminated()
        );
    }

    /**
     * @param separator The CSV field separator.
     * @return A copy of these options with another CSV separator.
     */
    public ParserOptions withCsvSeparator(String separator) {
        return new ParserOptions(separator, noisy, linkNonNullTokens, warnUnterminated);
    }

    /**
     * @param value Whether failed parses are logged at WARN level.
     * @return A copy of these options with the given noise setting.
     */
    public ParserOptions withNoisy(boolean value) {
        return new ParserOptions(csvSeparator, value, linkNonNullTokens, warnUnterminated);
    }
}
