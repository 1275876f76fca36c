package org.monkey.interpreter.frontend.parser;

import org.monkey.interpreter.frontend.parser.ast.Expression;

/**
 * Parses an expression that starts with the parser's current token.
 */
@FunctionalInterface
public interface IPrefixParseFunction {

    /**
     * Parses the expression. On return the current token is the last token of the expression.
     * @return The parsed expression, or {@code null} if an error was reported.
     */
    Expression parse();
}
