package org.monkey.interpreter.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., IDENT, INT, PLUS).
 * @param literal The exact text of the token from the source code.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical name of the source the token originates from.
 */
public record Token(
        TokenType type,
        String literal,
        int line,
        int column,
        String fileName
) {
}
