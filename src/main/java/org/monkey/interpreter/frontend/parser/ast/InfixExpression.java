package org.monkey.interpreter.frontend.parser.ast;

import org.monkey.interpreter.frontend.lexer.Token;

/**
 * A binary operator applied to two operands, e.g. {@code a + b}.
 *
 * @param token The operator token.
 * @param left The left operand.
 * @param operator The operator text.
 * @param right The right operand; null if it could not be parsed.
 */
public record InfixExpression(
        Token token,
        Expression left,
        String operator,
        Expression right
) implements Expression {

    @Override
    public String tokenLiteral() {
        return token.literal();
    }

    @Override
    public String render() {
        return "(" + AstNode.renderNullable(left) + " " + operator + " " + AstNode.renderNullable(right) + ")";
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitInfixExpression(this);
    }
}
