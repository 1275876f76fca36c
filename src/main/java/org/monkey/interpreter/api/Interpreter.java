package org.monkey.interpreter.api;

import org.monkey.interpreter.diagnostics.DiagnosticsEngine;
import org.monkey.interpreter.frontend.lexer.Lexer;
import org.monkey.interpreter.frontend.parser.Parser;
import org.monkey.interpreter.frontend.parser.ast.Program;
import org.monkey.interpreter.runtime.Evaluator;
import org.monkey.interpreter.runtime.model.EvalObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * The main interpreter implementation. It runs source text through
 * lexing, parsing and evaluation. Every call uses its own lexer and parser,
 * so an instance can be shared.
 */
public class Interpreter implements IInterpreter {

    private static final Logger LOG = LoggerFactory.getLogger(Interpreter.class);

    private final Evaluator evaluator = new Evaluator();

    @Override
    public Program parse(String source, String programName) throws InterpretationException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Parser parser = new Parser(new Lexer(source, programName), diagnostics);
        Program program = parser.parseProgram();

        if (diagnostics.hasErrors()) {
            LOG.debug("Parsing '{}' failed with {} error(s).", programName, parser.getErrors().size());
            throw new InterpretationException(diagnostics.summary());
        }
        return program;
    }

    @Override
    public EvaluationResult evaluate(String source, String programName) throws InterpretationException {
        Program program = parse(source, programName);
        Optional<EvalObject> value = evaluator.evaluate(program);
        LOG.debug("Evaluated '{}' to {}.", programName, value.map(EvalObject::inspect).orElse("<no value>"));
        return new EvaluationResult(program, value);
    }
}
