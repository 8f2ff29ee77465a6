package org.tova.compiler.frontend.semantics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.diagnostics.DiagnosticsEngine;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the snake_case and PascalCase naming lint.
 */
public class NamingConventionCheckerTest {

    private static final SourceInfo LOC = new SourceInfo("test.tova", 1, 1);

    @Test
    @Tag("unit")
    void testCamelCaseVariableIsReportedWithSnakeCaseHint() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        new NamingConventionChecker(true).check(NamingConventionChecker.Subject.VARIABLE, "userCount", LOC, diagnostics);

        // Assert
        assertThat(diagnostics.getWarnings()).hasSize(1);
        assertThat(diagnostics.getWarnings().get(0).code()).isEqualTo("W100");
        assertThat(diagnostics.getWarnings().get(0).hint()).contains("user_count");
    }

    @Test
    @Tag("unit")
    void testLowercaseTypeNameIsReportedWithPascalCaseHint() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        new NamingConventionChecker(true).check(NamingConventionChecker.Subject.TYPE, "shopping_cart", LOC, diagnostics);

        // Assert
        assertThat(diagnostics.getWarnings()).hasSize(1);
        assertThat(diagnostics.getWarnings().get(0).hint()).contains("ShoppingCart");
    }

    @Test
    @Tag("unit")
    void testExemptNamesAndDisabledLintReportNothing() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        NamingConventionChecker enabled = new NamingConventionChecker(true);

        // Act
        enabled.check(NamingConventionChecker.Subject.VARIABLE, "MAX_SIZE", LOC, diagnostics);
        enabled.check(NamingConventionChecker.Subject.VARIABLE, "_tmpValue", LOC, diagnostics);
        enabled.check(NamingConventionChecker.Subject.FUNCTION, "x", LOC, diagnostics);
        enabled.check(NamingConventionChecker.Subject.COMPONENT, "TodoList", LOC, diagnostics);
        new NamingConventionChecker(false).check(NamingConventionChecker.Subject.VARIABLE, "badName", LOC, diagnostics);

        // Assert
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testCaseConversions() {
        assertThat(NamingConventionChecker.toSnakeCase("parseHTTPRequest")).isEqualTo("parse_httprequest");
        assertThat(NamingConventionChecker.toSnakeCase("fooBar")).isEqualTo("foo_bar");
        assertThat(NamingConventionChecker.toPascalCase("my_type")).isEqualTo("MyType");
    }
}
