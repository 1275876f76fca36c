package org.monkey.interpreter.api;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.monkey.interpreter.runtime.model.BooleanObject;
import org.monkey.interpreter.runtime.model.IntegerObject;
import org.monkey.junit.extensions.logging.LogWatchExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the {@link Interpreter} facade end to end: source text in, value or exception out.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class InterpreterTest {

    private final IInterpreter interpreter = new Interpreter();

    @Test
    void evaluate_returnsValueOfLastStatement() throws InterpretationException {
        EvaluationResult result = interpreter.evaluate("1 + 2; 3 * (4 + 5)", "test");

        assertThat(result.value()).contains(new IntegerObject(27));
        assertThat(result.display()).isEqualTo("27");
        assertThat(result.program().statements()).hasSize(2);
    }

    @Test
    void evaluate_withoutValue_displaysNothing() throws InterpretationException {
        EvaluationResult result = interpreter.evaluate("let x = 1;", "test");

        assertThat(result.value()).isEmpty();
        assertThat(result.display()).isEmpty();
    }

    @Test
    void evaluate_withSyntaxErrors_throwsWithAllDiagnostics() {
        assertThatThrownBy(() -> interpreter.evaluate("let 123;\nlet a;", "broken.mk"))
                .isInstanceOf(InterpretationException.class)
                .hasMessageContaining("[ERROR] broken.mk:1: expected next token to be IDENT, got INT instead")
                .hasMessageContaining("[ERROR] broken.mk:2: expected next token to be =, got ; instead")
                .hasMessageContaining("no prefix parse function for ; found");
    }

    @Test
    void parse_returnsCanonicalTree() throws InterpretationException {
        assertThat(interpreter.parse("a + b * c", "test").render()).isEqualTo("(a + (b * c))");
    }

    @Test
    void evaluateFile_readsSourceFromDisk(@TempDir Path tempDir) throws IOException, InterpretationException {
        Path file = tempDir.resolve("program.mk");
        Files.writeString(file, "let unused = 0;\n10 > 5 == true\n", StandardCharsets.UTF_8);

        assertThat(interpreter.evaluateFile(file).value()).containsSame(BooleanObject.TRUE);
    }

    @Test
    void evaluateFile_missingFile_throwsIOException(@TempDir Path tempDir) {
        assertThatThrownBy(() -> interpreter.evaluateFile(tempDir.resolve("missing.mk")))
                .isInstanceOf(NoSuchFileException.class);
    }
}
