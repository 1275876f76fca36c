package org.monkey.cli.commands;

import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Source input shared by the commands that work on a single program:
 * either a file or an inline source text, but not both.
 */
public class SourceOptions {

    @Parameters(index = "0", arity = "0..1", paramLabel = "FILE", description = "Source file to read.")
    Path file;

    @Option(names = {"-e", "--eval"}, paramLabel = "SOURCE", description = "Source text given inline.")
    String source;

    /**
     * Checks that exactly one input was given.
     * @param spec The spec of the command using these options.
     * @throws CommandLine.ParameterException if no input or both inputs were given.
     */
    public void validate(CommandSpec spec) {
        if ((file == null) == (source == null)) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Specify either FILE or --eval, but not both.");
        }
    }

    /**
     * Gets the name used for the input in diagnostics.
     * @return The file path, or {@code <inline>}.
     */
    public String name() {
        return file != null ? file.toString() : "<inline>";
    }

    /**
     * Reads the source text.
     * @return The complete source text.
     * @throws IOException if the file cannot be read.
     */
    public String read() throws IOException {
        if (file != null) {
            return Files.readString(file, StandardCharsets.UTF_8);
        }
        return source;
    }
}
