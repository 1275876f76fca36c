package org.monkey.cli;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;
import org.monkey.interpreter.frontend.lexer.Lexer;
import org.monkey.interpreter.frontend.parser.Parser;
import org.monkey.interpreter.frontend.parser.ast.Program;
import org.monkey.interpreter.runtime.Evaluator;
import org.monkey.interpreter.runtime.model.EvalObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;

/**
 * Read-eval-print loop. Each line is lexed, parsed and evaluated on its own;
 * the value of its last statement is printed, or the parser errors if there were any.
 */
public class Repl {

    private static final Logger LOG = LoggerFactory.getLogger(Repl.class);

    private final LineReader lineReader;
    private final PrintWriter out;
    private final String prompt;
    private final Evaluator evaluator = new Evaluator();

    /**
     * Creates a new REPL.
     * @param lineReader The reader supplying input lines.
     * @param out Where results are printed.
     * @param prompt The prompt shown before each line.
     */
    public Repl(LineReader lineReader, PrintWriter out, String prompt) {
        this.lineReader = lineReader;
        this.out = out;
        this.prompt = prompt;
    }

    /**
     * Runs the loop until {@code exit}, {@code quit}, Ctrl+C or Ctrl+D.
     */
    public void run() {
        while (true) {
            final String line;
            try {
                line = lineReader.readLine(prompt);
            } catch (UserInterruptException | EndOfFileException e) {
                LOG.debug("Input closed, leaving REPL.");
                return;
            }
            if (line == null) {
                return;
            }

            final String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if ("exit".equals(trimmed) || "quit".equals(trimmed)) {
                return;
            }

            final String output = evaluateLine(trimmed);
            if (!output.isEmpty()) {
                out.println(output);
                out.flush();
            }
        }
    }

    /**
     * Evaluates one line of input.
     * @param line The source text.
     * @return The text to print: the inspected value, the parser errors, or the empty string.
     */
    public String evaluateLine(String line) {
        final Parser parser = new Parser(new Lexer(line, "<repl>"));
        final Program program = parser.parseProgram();
        if (!parser.getErrors().isEmpty()) {
            final StringBuilder sb = new StringBuilder("parser errors:");
            parser.getErrors().forEach(error -> sb.append("\n\t").append(error));
            return sb.toString();
        }
        return evaluator.evaluate(program).map(EvalObject::inspect).orElse("");
    }
}
