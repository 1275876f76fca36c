package org.monkey.interpreter.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostic messages produced while parsing, in the order they were reported.
 * <p>
 * This decouples error reporting from the parser: the parser never aborts, it reports here
 * and keeps going, and the caller decides whether the resulting AST can be trusted.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message    The error message.
     * @param fileName   The source in which the error occurred.
     * @param lineNumber The line number of the error.
     */
    public void reportError(String message, String fileName, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, fileName, lineNumber));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
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
     * Returns the bare messages of all reported diagnostics, in reporting order.
     *
     * @return The error messages without position information.
     */
    public List<String> errorMessages() {
        return diagnostics.stream()
                .map(Diagnostic::message)
                .collect(Collectors.toUnmodifiableList());
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
