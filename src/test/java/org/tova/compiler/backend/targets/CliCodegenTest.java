package org.tova.compiler.backend.targets;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tova.compiler.api.CompilerOptions;
import org.tova.compiler.backend.CodeGenerator;
import org.tova.compiler.frontend.lexer.Lexer;
import org.tova.compiler.frontend.parser.Parser;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the CLI executable target.
 */
public class CliCodegenTest {

    private static Map<String, Object> generate(String... lines) {
        return new CodeGenerator(new Parser(new Lexer(String.join("\n", lines), "tool.tova").scanTokens()).parse(),
                "tool.tova", CompilerOptions.defaults()).generate();
    }

    @Test
    @Tag("unit")
    void testSingleCommandDispatchesDirectly() {
        // Act
        Map<String, Object> result = generate(
                "cli {",
                "  name: \"greeter\"",
                "  version: \"1.2.0\"",
                "  fn greet(target: String, --loud: Bool, --times: Int = 1) {",
                "    print(target)",
                "  }",
                "}");

        // Assert
        String cli = (String) result.get(CodeGenerator.CLI);
        assertThat(cli)
                .startsWith("#!/usr/bin/env node")
                .contains("function print(...args)")
                .contains("function __cli_coerce(value, type, name) {")
                .contains("function __cmd_greet(target, loud, times) {")
                .contains("console.log(\"1.2.0\")")
                .contains("await __cli_dispatch_greet(argv);")
                .contains("__cli_main(process.argv.slice(2)).catch((err) => {");
        assertThat(result).containsOnlyKeys(CodeGenerator.SHARED, CodeGenerator.CLI);
    }

    @Test
    @Tag("unit")
    void testSeveralCommandsUseASubcommandSwitch() {
        // Act
        String cli = (String) generate(
                "cli {",
                "  fn add(a: Int, b: Int) { print(a + b) }",
                "  fn sub(a: Int, b: Int) { print(a - b) }",
                "}").get(CodeGenerator.CLI);

        // Assert
        assertThat(cli)
                .contains("switch (argv[0]) {")
                .contains("case \"add\": await __cli_dispatch_add(argv.slice(1)); break;")
                .contains("case \"sub\": await __cli_dispatch_sub(argv.slice(1)); break;")
                .contains("Error: Unknown command");
    }
}
