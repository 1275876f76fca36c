package org.monkey.interpreter.frontend.parser;

import org.monkey.interpreter.diagnostics.Diagnostic;
import org.monkey.interpreter.diagnostics.DiagnosticsEngine;
import org.monkey.interpreter.frontend.lexer.Lexer;
import org.monkey.interpreter.frontend.lexer.Token;
import org.monkey.interpreter.frontend.lexer.TokenType;
import org.monkey.interpreter.frontend.parser.ast.BooleanLiteral;
import org.monkey.interpreter.frontend.parser.ast.Expression;
import org.monkey.interpreter.frontend.parser.ast.ExpressionStatement;
import org.monkey.interpreter.frontend.parser.ast.Identifier;
import org.monkey.interpreter.frontend.parser.ast.InfixExpression;
import org.monkey.interpreter.frontend.parser.ast.IntegerLiteral;
import org.monkey.interpreter.frontend.parser.ast.LetStatement;
import org.monkey.interpreter.frontend.parser.ast.PrefixExpression;
import org.monkey.interpreter.frontend.parser.ast.Program;
import org.monkey.interpreter.frontend.parser.ast.ReturnStatement;
import org.monkey.interpreter.frontend.parser.ast.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The parser for the language. It pulls tokens from a {@link Lexer} and produces an
 * Abstract Syntax Tree, using recursive descent for statements and precedence climbing
 * (Pratt parsing) for expressions.
 * <p>
 * The parser never aborts. Syntax errors are reported to the {@link DiagnosticsEngine} and
 * parsing continues with the next token, so one mistake can produce several messages.
 * A parser instance is single-use and not thread-safe.
 */
public class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private final Lexer lexer;
    private final DiagnosticsEngine diagnostics;
    private final ParseRuleRegistry rules;

    private Token currentToken;
    private Token peekToken;

    /**
     * Constructs a new Parser with its own diagnostics engine.
     * @param lexer The lexer to pull tokens from.
     */
    public Parser(Lexer lexer) {
        this(lexer, new DiagnosticsEngine());
    }

    /**
     * Constructs a new Parser.
     * @param lexer The lexer to pull tokens from.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(Lexer lexer, DiagnosticsEngine diagnostics) {
        this.lexer = Objects.requireNonNull(lexer, "lexer");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.rules = initializeRules();

        // Fill current and peek.
        nextToken();
        nextToken();
    }

    private ParseRuleRegistry initializeRules() {
        ParseRuleRegistry registry = new ParseRuleRegistry();
        registry.registerPrefix(TokenType.IDENT, this::parseIdentifier);
        registry.registerPrefix(TokenType.INT, this::parseIntegerLiteral);
        registry.registerPrefix(TokenType.TRUE, this::parseBooleanLiteral);
        registry.registerPrefix(TokenType.FALSE, this::parseBooleanLiteral);
        registry.registerPrefix(TokenType.BANG, this::parsePrefixExpression);
        registry.registerPrefix(TokenType.MINUS, this::parsePrefixExpression);
        registry.registerPrefix(TokenType.LPAREN, this::parseGroupedExpression);

        for (TokenType operator : List.of(TokenType.PLUS, TokenType.MINUS, TokenType.ASTERISK, TokenType.SLASH,
                TokenType.LT, TokenType.GT, TokenType.EQ, TokenType.NOT_EQ)) {
            registry.registerInfix(operator, this::parseInfixExpression);
        }
        return registry;
    }

    /**
     * Parses the entire token stream.
     * Statements that failed to parse are left out; check {@link #getErrors()} before
     * trusting the result.
     * @return The program, never null.
     */
    public Program parseProgram() {
        List<Statement> statements = new ArrayList<>();
        while (!currentTokenIs(TokenType.EOF)) {
            Statement statement = parseStatement();
            if (statement != null) {
                statements.add(statement);
            }
            nextToken();
        }
        LOG.debug("Parsed {} statement(s) from '{}' with {} error(s).",
                statements.size(), currentToken.fileName(), getErrors().size());
        return new Program(statements);
    }

    /**
     * Gets the messages of all syntax errors reported so far, in order.
     * @return The error messages.
     */
    public List<String> getErrors() {
        return diagnostics.errorMessages();
    }

    /**
     * Gets the structured diagnostics, including source positions.
     * @return The diagnostics reported so far.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics.getDiagnostics();
    }

    private Statement parseStatement() {
        switch (currentToken.type()) {
            case LET:
                return parseLetStatement();
            case RETURN:
                return parseReturnStatement();
            default:
                return parseExpressionStatement();
        }
    }

    private LetStatement parseLetStatement() {
        Token token = currentToken;

        if (!expectPeek(TokenType.IDENT)) {
            return null;
        }
        Identifier name = new Identifier(currentToken, currentToken.literal());

        if (!expectPeek(TokenType.ASSIGN)) {
            return null;
        }

        nextToken();
        Expression value = parseExpression(Precedence.LOWEST);

        if (peekTokenIs(TokenType.SEMICOLON)) {
            nextToken();
        }
        return new LetStatement(token, name, value);
    }

    private ReturnStatement parseReturnStatement() {
        Token token = currentToken;

        nextToken();
        Expression returnValue = parseExpression(Precedence.LOWEST);

        if (peekTokenIs(TokenType.SEMICOLON)) {
            nextToken();
        }
        return new ReturnStatement(token, returnValue);
    }

    private ExpressionStatement parseExpressionStatement() {
        Token token = currentToken;
        Expression expression = parseExpression(Precedence.LOWEST);

        if (peekTokenIs(TokenType.SEMICOLON)) {
            nextToken();
        }
        return new ExpressionStatement(token, expression);
    }

    /**
     * Parses an expression whose operators all bind tighter than the given precedence.
     * @param precedence The binding strength of the operator to the left of the expression.
     * @return The parsed expression, or {@code null} if no prefix rule matched.
     */
    private Expression parseExpression(Precedence precedence) {
        Optional<IPrefixParseFunction> prefix = rules.getPrefix(currentToken.type());
        if (prefix.isEmpty()) {
            reportError(String.format("no prefix parse function for %s found", currentToken.literal()), currentToken);
            return null;
        }
        Expression left = prefix.get().parse();

        while (!peekTokenIs(TokenType.SEMICOLON) && precedence.compareTo(peekPrecedence()) < 0) {
            Optional<IInfixParseFunction> infix = rules.getInfix(peekToken.type());
            if (infix.isEmpty()) {
                return left;
            }
            nextToken();
            left = infix.get().parse(left);
        }
        return left;
    }

    private Expression parseIdentifier() {
        return new Identifier(currentToken, currentToken.literal());
    }

    private Expression parseIntegerLiteral() {
        try {
            return new IntegerLiteral(currentToken, Long.parseLong(currentToken.literal()));
        } catch (NumberFormatException e) {
            reportError(String.format("could not parse %s as integer", currentToken.literal()), currentToken);
            return null;
        }
    }

    private Expression parseBooleanLiteral() {
        return new BooleanLiteral(currentToken, currentTokenIs(TokenType.TRUE));
    }

    private Expression parsePrefixExpression() {
        Token token = currentToken;
        nextToken();
        Expression right = parseExpression(Precedence.PREFIX);
        return new PrefixExpression(token, token.literal(), right);
    }

    private Expression parseInfixExpression(Expression left) {
        Token token = currentToken;
        Precedence precedence = currentPrecedence();
        nextToken();
        Expression right = parseExpression(precedence);
        return new InfixExpression(token, left, token.literal(), right);
    }

    private Expression parseGroupedExpression() {
        nextToken();
        Expression expression = parseExpression(Precedence.LOWEST);
        if (!expectPeek(TokenType.RPAREN)) {
            return null;
        }
        return expression;
    }

    private void nextToken() {
        currentToken = peekToken;
        peekToken = lexer.nextToken();
    }

    private boolean currentTokenIs(TokenType type) {
        return currentToken.type() == type;
    }

    private boolean peekTokenIs(TokenType type) {
        return peekToken.type() == type;
    }

    /**
     * Advances if the peek token has the expected type; otherwise reports an error and stays put.
     */
    private boolean expectPeek(TokenType type) {
        if (peekTokenIs(type)) {
            nextToken();
            return true;
        }
        reportError(String.format("expected next token to be %s, got %s instead",
                type.displayName(), peekToken.type().displayName()), peekToken);
        return false;
    }

    private Precedence peekPrecedence() {
        return Precedence.ofInfix(peekToken.type());
    }

    private Precedence currentPrecedence() {
        return Precedence.ofInfix(currentToken.type());
    }

    private void reportError(String message, Token token) {
        LOG.trace("Syntax error at {}:{}: {}", token.fileName(), token.line(), message);
        diagnostics.reportError(message, token.fileName(), token.line());
    }
}
