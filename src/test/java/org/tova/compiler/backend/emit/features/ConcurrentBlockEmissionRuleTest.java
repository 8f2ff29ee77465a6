package org.tova.compiler.backend.emit.features;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tova.compiler.api.CompilerOptions;
import org.tova.compiler.backend.CodeGenerator;
import org.tova.compiler.frontend.lexer.Lexer;
import org.tova.compiler.frontend.parser.Parser;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the lowering of {@code concurrent} blocks.
 */
public class ConcurrentBlockEmissionRuleTest {

    private static String sharedCode(String mode) {
        String source = String.join("\n",
                "async fn load() {",
                "  log_start()",
                "  concurrent" + mode + " {",
                "    a = spawn fetch_a()",
                "    b = spawn fetch_b()",
                "  }",
                "  return [a, b]",
                "}");
        return (String) new CodeGenerator(new Parser(new Lexer(source, "app.tova").scanTokens()).parse(),
                "app.tova", CompilerOptions.defaults()).generate().get(CodeGenerator.SHARED);
    }

    private static int occurrences(String text, String needle) {
        int count = 0;
        for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + needle.length())) count++;
        return count;
    }

    @Test
    @Tag("unit")
    void testSpawnsAreGatheredByOnePromiseAll() {
        // Act
        String code = sharedCode("");

        // Assert
        assertThat(occurrences(code, "Promise.all(")).isEqualTo(1);
        assertThat(code)
                .contains("const a = __c")
                .contains("const b = __c")
                .contains("return Ok(await (fetch_a()));")
                .contains("catch (__e) { return Err(__e); }")
                .contains("function Ok(value)")
                .contains("function Err(error)");
        assertThat(code.indexOf("log_start()")).isLessThan(code.indexOf("Promise.all("));
    }

    @Test
    @Tag("unit")
    void testCancelOnErrorMarksLaterOutcomesCancelled() {
        // Act
        String code = sharedCode(" cancel_on_error");

        // Assert
        assertThat(code)
                .contains("let __failed")
                .contains("Err(\"cancelled\")");
        assertThat(occurrences(code, "Promise.all(")).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void testFirstModeRacesAndLeavesOthersNone() {
        // Act
        String code = sharedCode(" first");

        // Assert
        assertThat(code).contains("await Promise.race(").doesNotContain("Promise.all(");
        assertThat(code).containsPattern("const a = __c\\d+\\[0\\] === 0 \\? __c\\d+\\[1\\] : None;");
        assertThat(code).contains("const None = Object.freeze(");
    }

    @Test
    @Tag("unit")
    void testTimeoutFillsMissingSlotsWithTimeoutErrors() {
        // Act
        String code = sharedCode(" timeout(250)");

        // Assert
        assertThat(code)
                .contains("setTimeout(")
                .contains("Err(\"timeout\")")
                .contains(", 250); })]);")
                .contains("clearTimeout(__timer");
    }

    @Test
    @Tag("unit")
    void testStatementsAfterSpawnsRunAfterBindings() {
        // Arrange
        String source = String.join("\n",
                "async fn m() {",
                "  concurrent {",
                "    prepare()",
                "    a = spawn fetch_a()",
                "    show(a)",
                "  }",
                "}");

        // Act
        String code = (String) new CodeGenerator(new Parser(new Lexer(source, "app.tova").scanTokens()).parse(),
                "app.tova", CompilerOptions.defaults()).generate().get(CodeGenerator.SHARED);

        // Assert
        assertThat(code.indexOf("prepare();")).isGreaterThanOrEqualTo(0).isLessThan(code.indexOf("Promise.all("));
        assertThat(code.indexOf("Promise.all(")).isLessThan(code.indexOf("const a = __c"));
        assertThat(code.indexOf("const a = __c")).isLessThan(code.indexOf("show(a);"));
    }
}
