package org.monkey.interpreter.runtime;

import org.monkey.interpreter.frontend.parser.ast.AstNode;
import org.monkey.interpreter.frontend.parser.ast.AstVisitor;
import org.monkey.interpreter.frontend.parser.ast.BooleanLiteral;
import org.monkey.interpreter.frontend.parser.ast.ExpressionStatement;
import org.monkey.interpreter.frontend.parser.ast.Identifier;
import org.monkey.interpreter.frontend.parser.ast.InfixExpression;
import org.monkey.interpreter.frontend.parser.ast.IntegerLiteral;
import org.monkey.interpreter.frontend.parser.ast.LetStatement;
import org.monkey.interpreter.frontend.parser.ast.PrefixExpression;
import org.monkey.interpreter.frontend.parser.ast.Program;
import org.monkey.interpreter.frontend.parser.ast.ReturnStatement;
import org.monkey.interpreter.frontend.parser.ast.Statement;
import org.monkey.interpreter.runtime.model.BooleanObject;
import org.monkey.interpreter.runtime.model.EvalObject;
import org.monkey.interpreter.runtime.model.IntegerObject;
import org.monkey.interpreter.runtime.model.NullObject;
import org.monkey.interpreter.runtime.model.ObjectType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * A tree-walking evaluator that reduces an AST to a runtime value.
 * <p>
 * Evaluation never throws for well-formed or partial trees. An operator applied to types it
 * does not support yields {@link NullObject#NULL}; a node that produces no value at all
 * (a failed subexpression, {@code -} on a non-integer, a statement kind without runtime
 * semantics) yields {@link Optional#empty()}.
 * <p>
 * The evaluator holds no state and may be shared between threads.
 */
public class Evaluator implements AstVisitor<Optional<EvalObject>> {

    private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

    /**
     * Evaluates a node.
     * @param node The node to evaluate; may be null for subtrees lost to a syntax error.
     * @return The resulting value, or empty if the node produces none.
     */
    public Optional<EvalObject> evaluate(AstNode node) {
        if (node == null) {
            return Optional.empty();
        }
        return node.accept(this);
    }

    @Override
    public Optional<EvalObject> visitProgram(Program node) {
        Optional<EvalObject> result = Optional.empty();
        for (Statement statement : node.statements()) {
            result = evaluate(statement);
        }
        return result;
    }

    @Override
    public Optional<EvalObject> visitExpressionStatement(ExpressionStatement node) {
        return evaluate(node.expression());
    }

    @Override
    public Optional<EvalObject> visitLetStatement(LetStatement node) {
        // No environment: bindings are parsed but not evaluated.
        return Optional.empty();
    }

    @Override
    public Optional<EvalObject> visitReturnStatement(ReturnStatement node) {
        return Optional.empty();
    }

    @Override
    public Optional<EvalObject> visitIdentifier(Identifier node) {
        return Optional.empty();
    }

    @Override
    public Optional<EvalObject> visitIntegerLiteral(IntegerLiteral node) {
        return Optional.of(new IntegerObject(node.value()));
    }

    @Override
    public Optional<EvalObject> visitBooleanLiteral(BooleanLiteral node) {
        return Optional.of(BooleanObject.of(node.value()));
    }

    @Override
    public Optional<EvalObject> visitPrefixExpression(PrefixExpression node) {
        return evaluate(node.right())
                .flatMap(right -> evaluatePrefixExpression(node.operator(), right));
    }

    @Override
    public Optional<EvalObject> visitInfixExpression(InfixExpression node) {
        Optional<EvalObject> left = evaluate(node.left());
        Optional<EvalObject> right = evaluate(node.right());
        if (left.isEmpty() || right.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(evaluateInfixExpression(node.operator(), left.get(), right.get()));
    }

    private Optional<EvalObject> evaluatePrefixExpression(String operator, EvalObject operand) {
        switch (operator) {
            case "!":
                return Optional.of(evaluateBangOperatorExpression(operand));
            case "-":
                return evaluateMinusOperatorExpression(operand);
            default:
                return Optional.of(NullObject.NULL);
        }
    }

    private EvalObject evaluateBangOperatorExpression(EvalObject operand) {
        if (operand instanceof BooleanObject booleanObject) {
            return BooleanObject.of(!booleanObject.value());
        }
        if (operand.type() == ObjectType.NULL) {
            return BooleanObject.TRUE;
        }
        // Everything else is truthy.
        return BooleanObject.FALSE;
    }

    private Optional<EvalObject> evaluateMinusOperatorExpression(EvalObject operand) {
        if (operand instanceof IntegerObject integer) {
            return Optional.of(new IntegerObject(-integer.value()));
        }
        LOG.debug("Unary '-' is not defined for {}.", operand.type());
        return Optional.empty();
    }

    private EvalObject evaluateInfixExpression(String operator, EvalObject left, EvalObject right) {
        if (left instanceof IntegerObject l && right instanceof IntegerObject r) {
            return evaluateIntegerInfixExpression(operator, l.value(), r.value());
        }
        if (left instanceof BooleanObject l && right instanceof BooleanObject r) {
            return evaluateBooleanInfixExpression(operator, l.value(), r.value());
        }
        LOG.debug("Operator '{}' is not defined for {} and {}.", operator, left.type(), right.type());
        return NullObject.NULL;
    }

    private EvalObject evaluateIntegerInfixExpression(String operator, long left, long right) {
        return switch (operator) {
            case "+" -> new IntegerObject(left + right);
            case "-" -> new IntegerObject(left - right);
            case "*" -> new IntegerObject(left * right);
            case "/" -> right == 0 ? NullObject.NULL : new IntegerObject(left / right);
            case "<" -> BooleanObject.of(left < right);
            case ">" -> BooleanObject.of(left > right);
            case "==" -> BooleanObject.of(left == right);
            case "!=" -> BooleanObject.of(left != right);
            default -> NullObject.NULL;
        };
    }

    private EvalObject evaluateBooleanInfixExpression(String operator, boolean left, boolean right) {
        return switch (operator) {
            case "==" -> BooleanObject.of(left == right);
            case "!=" -> BooleanObject.of(left != right);
            default -> NullObject.NULL;
        };
    }
}
