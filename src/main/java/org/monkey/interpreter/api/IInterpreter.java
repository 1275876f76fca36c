package org.monkey.interpreter.api;

import org.monkey.interpreter.frontend.parser.ast.Program;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public interface for driving the lexer, parser and evaluator as one pipeline.
 */
public interface IInterpreter {

    /**
     * Parses the given source text.
     *
     * @param source The complete source text.
     * @param programName A name for the source, used in diagnostics.
     * @return The parsed {@link Program}.
     * @throws InterpretationException if the parser reported syntax errors.
     */
    Program parse(String source, String programName) throws InterpretationException;

    /**
     * Parses and evaluates the given source text.
     *
     * @param source The complete source text.
     * @param programName A name for the source, used in diagnostics.
     * @return The program together with the value of its last statement.
     * @throws InterpretationException if the parser reported syntax errors.
     */
    EvaluationResult evaluate(String source, String programName) throws InterpretationException;

    /**
     * Parses and evaluates a source file.
     * @param programPath The path to the source file.
     * @return The program together with the value of its last statement.
     * @throws InterpretationException if the parser reported syntax errors.
     * @throws IOException if the file cannot be read.
     */
    default EvaluationResult evaluateFile(Path programPath) throws InterpretationException, IOException {
        return evaluate(Files.readString(programPath, StandardCharsets.UTF_8), programPath.toString());
    }
}
