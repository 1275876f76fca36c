package org.monkey.cli.commands;

import org.monkey.cli.CommandLineInterface;
import org.monkey.interpreter.api.EvaluationResult;
import org.monkey.interpreter.api.IInterpreter;
import org.monkey.interpreter.api.InterpretationException;
import org.monkey.interpreter.api.Interpreter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Evaluates a program and prints the value of its last statement.
 */
@Command(
    name = "run",
    mixinStandardHelpOptions = true,
    description = "Evaluates a program and prints the value of its last statement."
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Mixin
    private SourceOptions source;

    private final IInterpreter interpreter = new Interpreter();

    @Override
    public Integer call() {
        source.validate(spec);
        parent.getConfig();
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        try {
            final EvaluationResult result = interpreter.evaluate(source.read(), source.name());
            final String display = result.display();
            if (!display.isEmpty()) {
                out.println(display);
            }
            return 0;
        } catch (InterpretationException e) {
            err.println(e.getMessage());
            return 1;
        } catch (IOException e) {
            log.debug("Reading '{}' failed.", source.name(), e);
            err.println("Cannot read " + source.name() + ": " + e.getMessage());
            return 1;
        }
    }
}
