package org.tova.compiler;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tova.compiler.api.CompilationException;
import org.tova.compiler.api.CompilationResult;
import org.tova.compiler.api.CompilerOptions;
import org.tova.compiler.diagnostics.Diagnostic;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains end-to-end tests for the {@link Compiler} facade, from source text to generated outputs.
 */
public class CompilerTest {

    private static final String MISMATCH = String.join("\n",
            "fn f(a: Int) -> Int { return a }",
            "f(\"5\")");

    @Test
    @Tag("unit")
    void testCompileProducesSharedOutput() throws CompilationException {
        // Arrange
        Compiler compiler = new Compiler();

        // Act
        CompilationResult result = compiler.compile("fn double(n: Int) -> Int { n * 2 }\nx = double(4)", "app.tova");

        // Assert
        assertThat(result.fileName()).isEqualTo("app.tova");
        assertThat(result.shared()).contains("function double(n) {").contains("const x = double(4);");
        assertThat(result.isCli()).isFalse();
        assertThat(result.sourceMap()).isEmpty();
        assertThat(result.deploy()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testAnalysisErrorBecomesCompilationException() {
        // Arrange
        Compiler compiler = new Compiler();

        // Act
        CompilationException e = catchThrowableOfType(() -> compiler.compile(MISMATCH, "app.tova"), CompilationException.class);

        // Assert
        assertThat(e).isNotNull();
        assertThat(e.getMessage()).contains("Type mismatch: 'a' expects Int, but got String");
        assertThat(e.getDiagnostics()).extracting(Diagnostic::code).contains("E100");
    }

    @Test
    @Tag("unit")
    void testTolerantModeStillGeneratesCode() throws CompilationException {
        // Arrange
        Compiler compiler = new Compiler(CompilerOptions.defaults().withTolerant(true));

        // Act
        CompilationResult result = compiler.compile(MISMATCH, "app.tova");

        // Assert
        assertThat(result.shared()).contains("function f(a) {");
    }

    @Test
    @Tag("unit")
    void testLexErrorBecomesCompilationException() {
        // Act
        CompilationException e = catchThrowableOfType(
                () -> new Compiler().compile("s = \"open", "app.tova"), CompilationException.class);

        // Assert
        assertThat(e).isNotNull();
        assertThat(e.getMessage()).contains("Unterminated string");
        assertThat(e.getDiagnostics()).hasSize(1);
        assertThat(e.getDiagnostics().get(0).type()).isEqualTo(Diagnostic.Type.ERROR);
    }

    @Test
    @Tag("unit")
    void testCheckReportsErrorsAndWarningsWithoutThrowing() {
        // Arrange
        Compiler compiler = new Compiler();

        // Act
        List<Diagnostic> diagnostics = compiler.check(MISMATCH + "\nfn loadData() { 1 }", "app.tova");

        // Assert
        assertThat(diagnostics).extracting(Diagnostic::code).contains("E100", "W100");
        assertThat(diagnostics.get(0).type()).isEqualTo(Diagnostic.Type.ERROR);
    }

    @Test
    @Tag("unit")
    void testCheckReportsParseErrors() {
        // Act
        List<Diagnostic> diagnostics = new Compiler().check("s = \"open", "app.tova");

        // Assert
        assertThat(diagnostics).singleElement().satisfies(d -> assertThat(d.message()).contains("Unterminated string"));
    }

    @Test
    @Tag("unit")
    void testCompileFromPathUsesFileNameForSourceMap(@TempDir Path dir) throws IOException, CompilationException {
        // Arrange
        Path source = dir.resolve("app.tova");
        Files.writeString(source, "x = 1\ny = 2\n");
        Compiler compiler = new Compiler(CompilerOptions.defaults().withSourceMaps(true));

        // Act
        CompilationResult result = compiler.compile(source);

        // Assert
        assertThat(result.sourceMap()).hasValueSatisfying(map -> assertThat(map)
                .contains("\"version\":3")
                .contains("app.tova"));
    }
}
