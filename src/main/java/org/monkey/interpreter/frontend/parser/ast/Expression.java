package org.monkey.interpreter.frontend.parser.ast;

/**
 * An expression, i.e. any node that can be reduced to a runtime value.
 */
public sealed interface Expression extends AstNode
        permits Identifier, IntegerLiteral, BooleanLiteral, PrefixExpression, InfixExpression {
}
