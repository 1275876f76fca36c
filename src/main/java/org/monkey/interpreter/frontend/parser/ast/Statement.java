package org.monkey.interpreter.frontend.parser.ast;

/**
 * A statement, one entry of a {@link Program}.
 */
public sealed interface Statement extends AstNode permits LetStatement, ReturnStatement, ExpressionStatement {
}
