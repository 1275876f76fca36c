package org.monkey.cli.commands;

import com.typesafe.config.Config;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.monkey.cli.CommandLineInterface;
import org.monkey.cli.Repl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * Starts an interactive session on the system terminal.
 */
@Command(
    name = "repl",
    mixinStandardHelpOptions = true,
    description = "Starts an interactive read-eval-print loop."
)
public class ReplCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReplCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    public Integer call() throws IOException {
        final Config config = parent.getConfig();

        try (Terminal terminal = openTerminal()) {
            final LineReader lineReader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .history(new DefaultHistory())
                    .variable(LineReader.HISTORY_SIZE, config.getInt("monkey.repl.history-size"))
                    .build();

            if (config.getBoolean("monkey.repl.show-welcome-message")) {
                terminal.writer().println("Welcome to Monkey. Type 'exit' or press Ctrl+D to leave.");
            }
            new Repl(lineReader, terminal.writer(), config.getString("monkey.repl.prompt")).run();
        }
        return 0;
    }

    private Terminal openTerminal() throws IOException {
        try {
            // Temporarily suppress JLine warnings
            java.util.logging.Logger jlineLogger = java.util.logging.Logger.getLogger("org.jline");
            java.util.logging.Level originalLevel = jlineLogger.getLevel();
            jlineLogger.setLevel(java.util.logging.Level.SEVERE);
            try {
                return TerminalBuilder.builder().system(true).build();
            } finally {
                jlineLogger.setLevel(originalLevel);
            }
        } catch (IOException e) {
            // Fallback to dumb terminal if system terminal is not available (e.g., in an IDE)
            log.debug("System terminal not available, using a dumb terminal.", e);
            return TerminalBuilder.builder().dumb(true).build();
        }
    }
}
