package org.monkey.interpreter.frontend.parser.ast;

import org.monkey.interpreter.frontend.lexer.Token;

/**
 * A unary operator applied to its operand, e.g. {@code -x} or {@code !ok}.
 *
 * @param token The operator token.
 * @param operator The operator text.
 * @param right The operand; null if it could not be parsed.
 */
public record PrefixExpression(
        Token token,
        String operator,
        Expression right
) implements Expression {

    @Override
    public String tokenLiteral() {
        return token.literal();
    }

    @Override
    public String render() {
        return "(" + operator + AstNode.renderNullable(right) + ")";
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitPrefixExpression(this);
    }
}
