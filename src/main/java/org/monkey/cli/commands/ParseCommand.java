package org.monkey.cli.commands;

import org.monkey.cli.CommandLineInterface;
import org.monkey.interpreter.diagnostics.Diagnostic;
import org.monkey.interpreter.frontend.lexer.Lexer;
import org.monkey.interpreter.frontend.parser.Parser;
import org.monkey.interpreter.frontend.parser.ast.Program;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Prints the canonical, fully parenthesized rendering of a program's AST.
 */
@Command(
    name = "parse",
    mixinStandardHelpOptions = true,
    description = "Parses a program and prints its AST with every expression parenthesized."
)
public class ParseCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Mixin
    private SourceOptions source;

    @Override
    public Integer call() {
        source.validate(spec);
        parent.getConfig();
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final String text;
        try {
            text = source.read();
        } catch (IOException e) {
            err.println("Cannot read " + source.name() + ": " + e.getMessage());
            return 1;
        }

        final Parser parser = new Parser(new Lexer(text, source.name()));
        final Program program = parser.parseProgram();

        if (!parser.getErrors().isEmpty()) {
            for (Diagnostic diagnostic : parser.getDiagnostics()) {
                err.println(diagnostic);
            }
            return 1;
        }
        program.statements().forEach(statement -> out.println(statement.render()));
        return 0;
    }
}
