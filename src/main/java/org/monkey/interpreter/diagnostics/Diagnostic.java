package org.monkey.interpreter.diagnostics;

/**
 * Represents a single diagnostic message reported while turning source text into an AST.
 *
 * @param type The type of the diagnostic.
 * @param message The diagnostic message, exactly as reported by the parser.
 * @param fileName The logical name of the source the issue occurred in.
 * @param lineNumber The line number of the token that triggered the issue.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A syntax error; the AST may be incomplete. */
        ERROR
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, fileName, lineNumber, message);
    }
}
