package org.monkey.cli;

import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.monkey.cli.config.LoggingConfigurator;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives the picocli command tree in-process and checks output and exit codes.
 */
@Tag("unit")
class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private CommandLine commandLine;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
        LoggingConfigurator.reset();
    }

    private Path writeSource(String content) throws IOException {
        Path file = tempDir.resolve("program.mk");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void noSubcommand_printsUsage() {
        int exitCode = commandLine.execute();

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Usage: monkey", "repl", "run", "parse", "tokens");
    }

    @Test
    void run_inlineSource_printsValue() {
        int exitCode = commandLine.execute("run", "-e", "(5 + 10 * 2 + 15 / 3) * 2 + -10");

        assertThat(exitCode).isZero();
        assertThat(out.toString().trim()).isEqualTo("50");
    }

    @Test
    void run_file_printsValueOfLastStatement() throws IOException {
        Path file = writeSource("1 < 2;\n3 == 4\n");

        int exitCode = commandLine.execute("run", file.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString().trim()).isEqualTo("false");
    }

    @Test
    void run_syntaxError_reportsDiagnosticsAndFails() {
        int exitCode = commandLine.execute("run", "-e", "let 123;");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("expected next token to be IDENT, got INT instead");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void run_missingFile_fails() {
        int exitCode = commandLine.execute("run", tempDir.resolve("missing.mk").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Cannot read");
    }

    @Test
    void run_withoutInput_isUsageError() {
        int exitCode = commandLine.execute("run");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("Specify either FILE or --eval");
    }

    @Test
    void parse_printsParenthesizedStatements() {
        int exitCode = commandLine.execute("parse", "-e", "let x = -a * b; a + b * c + d / e - f");

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly(
                "let x = ((-a) * b);",
                "(((a + (b * c)) + (d / e)) - f)");
    }

    @Test
    void parse_syntaxError_printsPositionedDiagnostics() {
        int exitCode = commandLine.execute("parse", "-e", "5 + ;");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("[ERROR] <inline>:1: no prefix parse function for ; found");
    }

    @Test
    void tokens_printsOneTokenPerLine() {
        int exitCode = commandLine.execute("tokens", "-e", "x != 10");

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).hasSize(4);
        assertThat(out.toString().lines().map(String::trim)).containsExactly(
                "1:1 IDENT     x",
                "1:3 NOT_EQ    !=",
                "1:6 INT       10",
                "1:8 EOF");
    }

    @Test
    void missingConfigFile_isUsageError() {
        int exitCode = commandLine.execute("--config", tempDir.resolve("absent.conf").toString(), "run", "-e", "1");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("Failed to load configuration");
    }

    @Test
    void detailedLogFormatFromConfigFile_switchesAppender() throws IOException {
        Path config = tempDir.resolve("detailed.conf");
        Files.writeString(config, "logging.format = \"DETAILED\"", StandardCharsets.UTF_8);

        int exitCode = commandLine.execute("--config", config.toString(), "run", "-e", "2 * 21");

        assertThat(exitCode).isZero();
        assertThat(out.toString().trim()).isEqualTo("42");
        assertThat(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDERR");
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        assertThat(context.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDERR");
    }
}
