package org.humspine.parser.diagnostics;

import org.humspine.parser.api.ParseError;
import org.humspine.parser.api.ParserErrorCode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link DiagnosticsEngine}.
 */
@Tag("unit")
class DiagnosticsEngineTest {

    /**
     * Verifies that warnings do not count as errors and that the first error is reported as a {@link ParseError}.
     */
    @Test
    void separatesErrorsAndWarnings() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        diagnostics.reportWarning("Spines of track(s) [1] are not terminated", "a.krn", 4);
        boolean afterWarning = diagnostics.hasErrors();
        diagnostics.reportError(ParserErrorCode.ALIGNMENT, "first", "a.krn", 5, -1);
        diagnostics.reportError(ParserErrorCode.INTERNAL, "second", "a.krn", 6, 2);

        // Assert
        assertThat(afterWarning).isFalse();
        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.getWarnings()).hasSize(1);
        assertThat(diagnostics.getDiagnostics()).hasSize(3);
        assertThat(diagnostics.firstError()).contains(new ParseError(ParserErrorCode.ALIGNMENT, "first", "a.krn", 5, -1));
        assertThat(diagnostics.summary()).contains("[WARNING] a.krn:4", "[ERROR] a.krn:6: second");

        diagnostics.clear();
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        assertThat(diagnostics.firstError()).isEmpty();
    }

    @Test
    void parseErrorFormatting() {
        assertThat(new ParseError(ParserErrorCode.IO_ERROR, "gone", "x.krn", 0, -1))
                .hasToString("[IO_ERROR] x.krn: gone");
        assertThat(new ParseError(ParserErrorCode.ALIGNMENT, "bad", "x.krn", 3, -1))
                .hasToString("[ALIGNMENT] x.krn:3: bad");
        assertThat(new ParseError(ParserErrorCode.UNPAIRED_EXCHANGE, "odd", "x.krn", 3, 0))
                .hasToString("[UNPAIRED_EXCHANGE] x.krn:3:1: odd");
    }
}
