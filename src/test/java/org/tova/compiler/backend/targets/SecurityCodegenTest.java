package org.tova.compiler.backend.targets;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tova.compiler.api.CompilerOptions;
import org.tova.compiler.backend.CodeGenerator;
import org.tova.compiler.frontend.lexer.Lexer;
import org.tova.compiler.frontend.parser.Parser;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the server-side security helpers.
 */
public class SecurityCodegenTest {

    private static String server(String... lines) {
        return (String) new CodeGenerator(new Parser(new Lexer(String.join("\n", lines), "app.tova").scanTokens()).parse(),
                "app.tova", CompilerOptions.defaults()).generate().get(CodeGenerator.SERVER);
    }

    @Test
    @Tag("unit")
    void testGlobToRegex() {
        assertThat(SecurityCodegen.globToRegex("/admin/*")).isEqualTo("\\/admin\\/[^/]*");
        assertThat(SecurityCodegen.globToRegex("/api/**")).isEqualTo("\\/api\\/.*");
        assertThat(SecurityCodegen.globToRegex("/v1.0/x")).isEqualTo("\\/v1\\.0\\/x");
    }

    @Test
    @Tag("unit")
    void testJwtAuthRolesAndProtection() {
        // Act
        String server = server(
                "security {",
                "  auth jwt { secret: \"s3cret\" }",
                "  role Admin { can: [manage_users, view] }",
                "  protect \"/admin/*\" { require: Admin }",
                "}",
                "server {",
                "  fn stats() { 1 }",
                "}");

        // Assert
        assertThat(server)
                .contains("import { verify } from 'hono/jwt';")
                .contains("const __securityRoles = {")
                .contains("\"Admin\": [\"manage_users\", \"view\"],")
                .contains("const __authSecret = \"s3cret\";")
                .contains("return await verify(token, __authSecret);")
                .contains("const __protectRules = [")
                .contains("pattern: /^\\/admin\\/[^/]*$/")
                .contains("function __checkProtection(path, user) {")
                .contains("c.header(\"Strict-Transport-Security\", \"max-age=31536000; includeSubDomains\");");
        assertThat(server.indexOf("const __securityRoles")).isLessThan(server.indexOf("async function __authenticate"));
    }

    @Test
    @Tag("unit")
    void testNoSecurityBlockEmitsNoHelpers() {
        // Act
        String server = server("server {", "  fn stats() { 1 }", "}");

        // Assert
        assertThat(server)
                .doesNotContain("__securityRoles")
                .doesNotContain("hono/jwt")
                .contains("app.use(\"/*\", cors());");
    }
}
