package org.monkey.interpreter.frontend.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Tokens are produced on demand, one per call to {@link #nextToken()}. The lexer never
 * fails: characters it does not understand become {@link TokenType#ILLEGAL} tokens, and once
 * the input is exhausted every further call yields an {@link TokenType#EOF} token.
 */
public class Lexer {

    private final String source;
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this(source, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param logicalFileName The name of the source being lexed, for error reporting.
     */
    public Lexer(String source, String logicalFileName) {
        this.source = Objects.requireNonNull(source, "source");
        this.logicalFileName = logicalFileName;
    }

    /**
     * Scans the next token.
     * @return The next token; {@link TokenType#EOF} at and after the end of input.
     */
    public Token nextToken() {
        skipWhitespace();
        start = current;
        startColumn = column;
        if (isAtEnd()) {
            return makeToken(TokenType.EOF, "");
        }

        char c = advance();
        switch (c) {
            case '=':
                return match('=') ? makeToken(TokenType.EQ) : makeToken(TokenType.ASSIGN);
            case '!':
                return match('=') ? makeToken(TokenType.NOT_EQ) : makeToken(TokenType.BANG);
            case '+': return makeToken(TokenType.PLUS);
            case '-': return makeToken(TokenType.MINUS);
            case '*': return makeToken(TokenType.ASTERISK);
            case '/': return makeToken(TokenType.SLASH);
            case '<': return makeToken(TokenType.LT);
            case '>': return makeToken(TokenType.GT);
            case ',': return makeToken(TokenType.COMMA);
            case ';': return makeToken(TokenType.SEMICOLON);
            case '(': return makeToken(TokenType.LPAREN);
            case ')': return makeToken(TokenType.RPAREN);
            case '{': return makeToken(TokenType.LBRACE);
            case '}': return makeToken(TokenType.RBRACE);
            default:
                if (isDigit(c)) {
                    return number();
                } else if (isAlpha(c)) {
                    return identifier();
                }
                return makeToken(TokenType.ILLEGAL);
        }
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return The recognized tokens, terminated by a single {@link TokenType#EOF} token.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    private Token identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        return makeToken(TokenType.lookupIdentifier(text), text);
    }

    private Token number() {
        while (isDigit(peek())) advance();
        return makeToken(TokenType.INT);
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            switch (c) {
                case ' ', '\r', '\t':
                    advance();
                    break;
                case '\n':
                    advance();
                    line++;
                    column = 1;
                    break;
                default:
                    return;
            }
        }
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private Token makeToken(TokenType type) {
        return makeToken(type, source.substring(start, current));
    }

    private Token makeToken(TokenType type, String literal) {
        return new Token(type, literal, line, startColumn, logicalFileName);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
