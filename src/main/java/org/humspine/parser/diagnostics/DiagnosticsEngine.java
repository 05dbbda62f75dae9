package org.humspine.parser.diagnostics;

import org.humspine.parser.api.ParseError;
import org.humspine.parser.api.ParserErrorCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostic messages (errors, warnings)
 * that occur while a Humdrum file is analysed.
 * <p>
 * This decouples error reporting from the analysis phases themselves.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code       The error category.
     * @param message    The error message.
     * @param sourceName The input in which the error occurred.
     * @param lineNumber The line number of the error.
     * @param fieldIndex The field index of the error, or -1.
     */
    public void reportError(ParserErrorCode code, String message, String sourceName, int lineNumber, int fieldIndex) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, sourceName, lineNumber, fieldIndex));
    }

    /**
     * Reports a warning.
     *
     * @param message    The warning message.
     * @param sourceName The input in which the warning occurred.
     * @param lineNumber The line number of the warning.
     */
    public void reportWarning(String message, String sourceName, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, null, message, sourceName, lineNumber, -1));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns the first reported error as a {@link ParseError}.
     *
     * @return The first error, or empty if none was reported.
     */
    public Optional<ParseError> firstError() {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.ERROR)
                .findFirst()
                .map(d -> new ParseError(d.code(), d.message(), d.sourceName(), d.lineNumber(), d.fieldIndex()));
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns the collected warnings.
     *
     * @return The warnings, in reporting order.
     */
    public List<Diagnostic> getWarnings() {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.WARNING)
                .collect(Collectors.toList());
    }

    /**
     * Removes all collected diagnostics.
     */
    public void clear() {
        diagnostics.clear();
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
