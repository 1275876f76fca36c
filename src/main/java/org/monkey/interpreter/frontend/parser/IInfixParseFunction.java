package org.monkey.interpreter.frontend.parser;

import org.monkey.interpreter.frontend.parser.ast.Expression;

/**
 * Parses the continuation of an expression whose operator is the parser's current token.
 */
@FunctionalInterface
public interface IInfixParseFunction {

    /**
     * Parses the operator and its right operand.
     * @param left The already parsed left operand.
     * @return The combined expression.
     */
    Expression parse(Expression left);
}
