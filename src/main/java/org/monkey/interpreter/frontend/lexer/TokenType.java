package org.monkey.interpreter.frontend.lexer;

import java.util.Map;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 * <p>
 * Each type carries the display name used when it appears in a diagnostic,
 * e.g. {@code expected next token to be IDENT, got INT instead}.
 */
public enum TokenType {
    /** A character no lexing rule accepts. */
    ILLEGAL("ILLEGAL"),
    /** Represents the end of the source text. */
    EOF("EOF"),

    // Identifiers and literals.
    /** An identifier, such as a variable name. */
    IDENT("IDENT"),
    /** A decimal integer literal. */
    INT("INT"),

    // Operators.
    ASSIGN("="),
    PLUS("+"),
    MINUS("-"),
    BANG("!"),
    ASTERISK("*"),
    SLASH("/"),
    LT("<"),
    GT(">"),
    EQ("=="),
    NOT_EQ("!="),

    // Delimiters.
    COMMA(","),
    SEMICOLON(";"),
    LPAREN("("),
    RPAREN(")"),
    LBRACE("{"),
    RBRACE("}"),

    // Keywords.
    FUNCTION("FUNCTION"),
    LET("LET"),
    TRUE("TRUE"),
    FALSE("FALSE"),
    IF("IF"),
    ELSE("ELSE"),
    RETURN("RETURN");

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "fn", FUNCTION,
            "let", LET,
            "true", TRUE,
            "false", FALSE,
            "if", IF,
            "else", ELSE,
            "return", RETURN
    );

    private final String displayName;

    TokenType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Gets the name of this type as it appears in diagnostics.
     * @return The display name.
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Classifies a scanned word as a keyword or a plain identifier.
     * @param word The identifier text.
     * @return The keyword type, or {@link #IDENT} if the word is not reserved.
     */
    public static TokenType lookupIdentifier(String word) {
        return KEYWORDS.getOrDefault(word, IDENT);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
