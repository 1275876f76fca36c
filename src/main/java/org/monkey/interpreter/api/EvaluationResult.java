package org.monkey.interpreter.api;

import org.monkey.interpreter.frontend.parser.ast.Program;
import org.monkey.interpreter.runtime.model.EvalObject;

import java.util.Optional;

/**
 * The outcome of evaluating a source text.
 *
 * @param program The parsed program.
 * @param value The value of the last statement, or empty if it produced none.
 */
public record EvaluationResult(
        Program program,
        Optional<EvalObject> value
) {

    /**
     * Renders the value for display.
     * @return The inspected value, or the empty string if there is none.
     */
    public String display() {
        return value.map(EvalObject::inspect).orElse("");
    }
}
