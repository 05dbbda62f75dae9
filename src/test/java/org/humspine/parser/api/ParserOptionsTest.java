package org.humspine.parser.api;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for reading {@link ParserOptions} from HOCON configuration.
 */
@Tag("unit")
class ParserOptionsTest {

    @Test
    void referenceConfigMatchesDefaults() {
        Config config = ConfigFactory.parseResources("reference.conf").resolve();

        assertThat(ParserOptions.fromConfig(config)).isEqualTo(ParserOptions.defaults());
    }

    /**
     * Verifies that present keys override the defaults and missing keys keep them.
     */
    @Test
    void partialConfig() {
        Config config = ConfigFactory.parseString(
                "humspine.parser { csv-separator = \";\", noisy = true }");

        ParserOptions options = ParserOptions.fromConfig(config);

        assertThat(options.csvSeparator()).isEqualTo(";");
        assertThat(options.noisy()).isTrue();
        assertThat(options.linkNonNullTokens()).isTrue();
        assertThat(options.warnUnterminated()).isTrue();
    }

    @Test
    void missingSectionGivesDefaults() {
        assertThat(ParserOptions.fromConfig(ConfigFactory.empty())).isEqualTo(ParserOptions.defaults());
    }

    @Test
    void emptySeparatorIsRejected() {
        assertThatThrownBy(() -> ParserOptions.defaults().withCsvSeparator(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
