package org.tova.compiler.frontend.semantics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tova.compiler.api.CompilerOptions;
import org.tova.compiler.diagnostics.AnalysisError;
import org.tova.compiler.diagnostics.Diagnostic;
import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.lexer.Lexer;
import org.tova.compiler.frontend.parser.Parser;
import org.tova.compiler.frontend.parser.ast.ProgramNode;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains unit tests for the {@link SemanticAnalyzer}, covering binding rules, gradual type checks
 * and the match and control-flow lints.
 */
public class SemanticAnalyzerTest {

    private static ProgramNode parse(String... lines) {
        return new Parser(new Lexer(String.join("\n", lines), "test.tova").scanTokens()).parse();
    }

    private static AnalysisResult analyze(CompilerOptions options, String... lines) {
        return new SemanticAnalyzer(new DiagnosticsEngine(), options).analyze(parse(lines));
    }

    private static AnalysisResult tolerant(String... lines) {
        return analyze(CompilerOptions.defaults().withTolerant(true), lines);
    }

    private static List<String> codes(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::code).toList();
    }

    @Test
    @Tag("unit")
    void testArgumentTypeMismatchFailsWithConversionHint() {
        // Arrange
        ProgramNode program = parse(
                "fn f(a: Int) -> Int { return a }",
                "f(\"5\")");
        SemanticAnalyzer analyzer = new SemanticAnalyzer(new DiagnosticsEngine(), CompilerOptions.defaults());

        // Act
        AnalysisError error = catchThrowableOfType(() -> analyzer.analyze(program), AnalysisError.class);

        // Assert
        assertThat(error).isNotNull();
        assertThat(error.getMessage()).contains("Type mismatch");
        assertThat(error.getErrors()).hasSize(1);
        Diagnostic mismatch = error.getErrors().get(0);
        assertThat(mismatch.code()).isEqualTo("E100");
        assertThat(mismatch.message()).isEqualTo("Type mismatch: 'a' expects Int, but got String");
        assertThat(mismatch.hint()).contains("toInt");
        assertThat(mismatch.lineNumber()).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void testIntArgumentIsAcceptedWhereFloatIsExpected() {
        // Arrange / Act
        AnalysisResult result = analyze(CompilerOptions.defaults(),
                "fn scale(x: Float) -> Float { return x * 2.0 }",
                "scale(3)");

        // Assert
        assertThat(result.hasErrors()).isFalse();
    }

    @Test
    @Tag("unit")
    void testReassigningImmutableBindingIsAnError() {
        // Arrange / Act
        AnalysisResult result = tolerant("x = 1", "x = 2");

        // Assert
        assertThat(codes(result.errors())).containsExactly("E202");
        assertThat(result.errors().get(0).message()).contains("Cannot reassign immutable variable 'x'");
    }

    @Test
    @Tag("unit")
    void testVarBindingMayBeReassigned() {
        // Arrange / Act
        AnalysisResult result = tolerant("var count = 0", "count = count + 1");

        // Assert
        assertThat(result.errors()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testFloatIntoIntVariableWarnsAboutDataLoss() {
        // Arrange / Act
        AnalysisResult result = tolerant("var total = 1", "total = 2.5");

        // Assert
        assertThat(result.errors()).isEmpty();
        assertThat(codes(result.warnings())).contains("W204");
    }

    @Test
    @Tag("unit")
    void testTypedInitializerMismatchIsAnError() {
        // Arrange / Act
        AnalysisResult result = tolerant("var name: String = 42");

        // Assert
        assertThat(codes(result.errors())).containsExactly("E100");
        assertThat(result.errors().get(0).message()).contains("'name' is declared as String");
    }

    @Test
    @Tag("unit")
    void testReturnTypeMismatchIsAnError() {
        // Arrange / Act
        AnalysisResult result = tolerant("fn label() -> Int { return \"none\" }");

        // Assert
        assertThat(codes(result.errors())).containsExactly("E101");
        assertThat(result.errors().get(0).hint()).contains("toInt");
    }

    @Test
    @Tag("unit")
    void testAwaitInsidePlainLambdaOfAsyncFunctionIsAnError() {
        // Arrange / Act
        AnalysisResult result = tolerant(
                "async fn load(url) {",
                "  handler = () => await fetch(url)",
                "  return handler",
                "}");

        // Assert
        assertThat(codes(result.errors())).containsExactly("E300");
        assertThat(result.errors().get(0).message()).isEqualTo("'await' can only be used inside an async function");
    }

    @Test
    @Tag("unit")
    void testAwaitInsideAsyncFunctionIsAccepted() {
        // Arrange / Act
        AnalysisResult result = tolerant(
                "async fn load(url) {",
                "  data = await fetch(url)",
                "  return data",
                "}");

        // Assert
        assertThat(result.errors()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testTopLevelAwaitAndReturnAreErrors() {
        // Arrange / Act
        AnalysisResult result = tolerant("x = await fetch(\"/a\")", "return x");

        // Assert
        assertThat(codes(result.errors())).containsExactly("E300", "E301");
    }

    @Test
    @Tag("unit")
    void testNonExhaustiveMatchWarnsAboutEachMissingVariant() {
        // Arrange / Act
        AnalysisResult result = tolerant(
                "type Color {",
                "  Red",
                "  Blue",
                "  Green",
                "}",
                "fn describe(c) {",
                "  match c {",
                "    Red => \"warm\"",
                "    Blue => \"cold\"",
                "  }",
                "}");

        // Assert
        List<Diagnostic> missing = result.warnings().stream().filter(w -> "W200".equals(w.code())).toList();
        assertThat(missing).hasSize(1);
        assertThat(missing.get(0).message()).isEqualTo("Non-exhaustive match: missing 'Green' variant from type 'Color'");
        assertThat(result.errors()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testArmAfterCatchAllIsUnreachable() {
        // Arrange / Act
        AnalysisResult result = tolerant(
                "fn sign(n) {",
                "  match n {",
                "    _ => 0",
                "    1 => 1",
                "  }",
                "}");

        // Assert
        assertThat(codes(result.warnings())).contains("W207");
    }

    @Test
    @Tag("unit")
    void testUndefinedNameWarnsWithSuggestionAndFailsInStrictMode() {
        // Arrange
        String[] source = {"counter = 1", "print(countr)"};

        // Act
        AnalysisResult lenient = tolerant(source);
        AnalysisResult strict = analyze(new CompilerOptions(true, true, false, true), source);

        // Assert
        Diagnostic warning = lenient.warnings().stream().filter(w -> "E200".equals(w.code())).findFirst().orElseThrow();
        assertThat(warning.message()).isEqualTo("'countr' is not defined");
        assertThat(warning.hint()).isEqualTo("did you mean 'counter'?");
        assertThat(codes(strict.errors())).containsExactly("E200");
    }

    @Test
    @Tag("unit")
    void testNamingLintSuggestsSnakeCase() {
        // Arrange / Act
        AnalysisResult result = tolerant("fn loadData() { return 1 }");

        // Assert
        Diagnostic naming = result.warnings().stream().filter(w -> "W100".equals(w.code())).findFirst().orElseThrow();
        assertThat(naming.hint()).contains("load_data");
    }

    @Test
    @Tag("unit")
    void testUnusedLocalVariableWarns() {
        // Arrange / Act
        AnalysisResult result = tolerant(
                "fn compute() {",
                "  temp = 1",
                "  _ignored = 2",
                "  return 3",
                "}");

        // Assert
        List<Diagnostic> unused = result.warnings().stream().filter(w -> "W001".equals(w.code())).toList();
        assertThat(unused).extracting(Diagnostic::message).containsExactly("Unused variable 'temp'");
    }

    @Test
    @Tag("unit")
    void testMissingReturnOnSomePathsWarns() {
        // Arrange / Act
        AnalysisResult result = tolerant(
                "fn pick(flag) -> Int {",
                "  if flag {",
                "    return 1",
                "  }",
                "}");

        // Assert
        assertThat(codes(result.warnings())).contains("W205");
    }

    @Test
    @Tag("unit")
    void testStatementAfterReturnIsUnreachable() {
        // Arrange / Act
        AnalysisResult result = tolerant(
                "fn early() {",
                "  return 1",
                "  print(\"never\")",
                "}");

        // Assert
        assertThat(codes(result.warnings())).contains("W201");
    }

    @Test
    @Tag("unit")
    void testStringRepeatNeedsAnIntCount() {
        // Act
        AnalysisResult byInt = tolerant("x = \"ha\" * 3");
        AnalysisResult byFloat = tolerant("x = \"ha\" * 1.5");

        // Assert
        assertThat(codes(byInt.warnings())).doesNotContain("E104");
        assertThat(codes(byFloat.warnings())).containsExactly("E104");
    }

    @Test
    @Tag("unit")
    void testExhaustivenessNeverNamesVariantsOfAnUnrelatedType() {
        // Act
        AnalysisResult result = tolerant(
                "shared {",
                "  type Shape {",
                "    Circle(r: Float)",
                "    Square(s: Float)",
                "  }",
                "}",
                "server {",
                "  type Signal {",
                "    Circle(r: Float)",
                "    Stop",
                "  }",
                "  fn by_square(v) {",
                "    match v {",
                "      Square(s) => s",
                "    }",
                "  }",
                "  fn by_circle(v) {",
                "    match v {",
                "      Circle(r) => r",
                "    }",
                "  }",
                "}");

        // Assert
        List<Diagnostic> missing = result.warnings().stream().filter(w -> "W200".equals(w.code())).toList();
        assertThat(missing).extracting(Diagnostic::message)
                .containsExactly("Non-exhaustive match: missing 'Circle' variant from type 'Shape'");
    }
}
