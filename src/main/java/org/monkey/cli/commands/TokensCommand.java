package org.monkey.cli.commands;

import org.monkey.cli.CommandLineInterface;
import org.monkey.interpreter.frontend.lexer.Lexer;
import org.monkey.interpreter.frontend.lexer.Token;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Prints the token stream of a program, one token per line.
 */
@Command(
    name = "tokens",
    mixinStandardHelpOptions = true,
    description = "Prints the tokens of a program with their positions."
)
public class TokensCommand implements Callable<Integer> {

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

        final String text;
        try {
            text = source.read();
        } catch (IOException e) {
            spec.commandLine().getErr().println("Cannot read " + source.name() + ": " + e.getMessage());
            return 1;
        }

        for (Token token : new Lexer(text, source.name()).scanTokens()) {
            out.println(String.format("%d:%d %-9s %s", token.line(), token.column(), token.type().name(), token.literal()));
        }
        return 0;
    }
}
