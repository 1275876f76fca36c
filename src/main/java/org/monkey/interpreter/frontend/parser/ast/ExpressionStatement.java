package org.monkey.interpreter.frontend.parser.ast;

import org.monkey.interpreter.frontend.lexer.Token;

/**
 * A statement consisting of a single expression, e.g. {@code x + 10;}.
 *
 * @param token The first token of the expression.
 * @param expression The expression; null if no prefix rule matched its first token.
 */
public record ExpressionStatement(
        Token token,
        Expression expression
) implements Statement {

    @Override
    public String tokenLiteral() {
        return token.literal();
    }

    @Override
    public String render() {
        return AstNode.renderNullable(expression);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitExpressionStatement(this);
    }
}
