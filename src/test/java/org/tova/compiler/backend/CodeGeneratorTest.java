package org.tova.compiler.backend;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tova.compiler.api.CompilerOptions;
import org.tova.compiler.frontend.lexer.Lexer;
import org.tova.compiler.frontend.parser.Parser;
import org.tova.compiler.frontend.parser.ast.ProgramNode;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link CodeGenerator}: target splitting, tree-shaking of the runtime
 * prelude and the lowering of core expressions.
 */
public class CodeGeneratorTest {

    private static Map<String, Object> generate(CompilerOptions options, String... lines) {
        ProgramNode program = new Parser(new Lexer(String.join("\n", lines), "app.tova").scanTokens()).parse();
        return new CodeGenerator(program, "app.tova", options).generate();
    }

    private static Map<String, Object> generate(String... lines) {
        return generate(CompilerOptions.defaults(), lines);
    }

    @Test
    @Tag("unit")
    void testStringRepetitionWithoutUnusedRuntime() {
        // Act
        Map<String, Object> result = generate("x = \"ha\" * 3");

        // Assert
        assertThat(result.get(CodeGenerator.SHARED)).isEqualTo("const x = \"ha\".repeat(3);");
        assertThat(result.get(CodeGenerator.SERVER)).isEqualTo("");
        assertThat(result.get(CodeGenerator.CLIENT)).isEqualTo("");
        assertThat(result).doesNotContainKey(CodeGenerator.CLI);
    }

    @Test
    @Tag("unit")
    void testPropagationHelperAndWrapperOnlyWhenUsed() {
        // Act
        String withPropagate = (String) generate(
                "fn load(s) {",
                "  v = parse_number(s)?",
                "  return Ok(v)",
                "}").get(CodeGenerator.SHARED);
        String without = (String) generate(
                "fn load(s) {",
                "  return Ok(s)",
                "}").get(CodeGenerator.SHARED);

        // Assert
        assertThat(withPropagate)
                .contains("function __propagate(val)")
                .contains("__propagate(parse_number(s))")
                .contains("} catch (__e) {")
                .contains("if (__e && __e.__tova_propagate) return __e.value;")
                .contains("function Ok(value)");
        assertThat(without)
                .doesNotContain("__propagate")
                .doesNotContain("catch (__e)")
                .contains("function Ok(value)");
    }

    @Test
    @Tag("unit")
    void testUserDeclarationShadowsBuiltin() {
        // Act
        String shared = (String) generate(
                "fn print(x) { x }",
                "print(1)").get(CodeGenerator.SHARED);

        // Assert
        assertThat(shared).doesNotContain("console.log");
        assertThat(shared).contains("function print(x)");
    }

    @Test
    @Tag("unit")
    void testServerBlockBecomesHonoAppWithRpcAndRoutes() {
        // Act
        Map<String, Object> result = generate(
                "greeting = \"hi\"",
                "server {",
                "  fn get_users() { [] }",
                "  route GET \"/users\" => get_users",
                "}");

        // Assert
        String server = (String) result.get(CodeGenerator.SERVER);
        assertThat(server)
                .startsWith("import { Hono } from 'hono';")
                .contains("// ── Shared ──\nconst greeting = \"hi\";")
                .contains("app.post(\"/rpc/get_users\", async (c) => {")
                .contains("const { args = [] } = await c.req.json().catch(() => ({}));")
                .contains("app.get(\"/users\", async (c) => {")
                .contains("const result = await get_users(c);")
                .contains("export default { port, fetch: app.fetch };");
        assertThat(result.get(CodeGenerator.CLIENT)).isEqualTo("");
    }

    @Test
    @Tag("unit")
    void testNamedServerBlocksGetTheirOwnFiles() {
        // Act
        Map<String, Object> result = generate(
                "server \"api\" {",
                "  fn ping() { \"pong\" }",
                "}",
                "server \"api\" {",
                "  fn health() { true }",
                "}");

        // Assert
        @SuppressWarnings("unchecked")
        Map<String, String> servers = (Map<String, String>) result.get(CodeGenerator.SERVERS);
        assertThat(servers).containsOnlyKeys("api");
        assertThat(servers.get("api")).contains("/rpc/ping").contains("/rpc/health");
        assertThat(result.get(CodeGenerator.SERVER)).isEqualTo("");
    }

    @Test
    @Tag("unit")
    void testClientStateAndAwaitedServerCalls() {
        // Act
        String client = (String) generate(
                "client {",
                "  state count = 0",
                "  fn refresh() {",
                "    count = server.get_count()",
                "  }",
                "}").get(CodeGenerator.CLIENT);

        // Assert
        assertThat(client)
                .contains("import { rpc } from './runtime/rpc.js';")
                .contains("const [count, setCount] = createSignal(0);")
                .contains("async function refresh()")
                .contains("setCount((await server.get_count()));");
    }

    @Test
    @Tag("unit")
    void testSourceMapCoversSharedStatements() {
        // Act
        Map<String, Object> result = generate(CompilerOptions.defaults().withSourceMaps(true), "x = 1", "y = 2");

        // Assert
        assertThat(result.get(CodeGenerator.SOURCE_MAP)).isEqualTo(
                "{\"version\":3,\"file\":\"app.shared.js\",\"sources\":[\"app.tova\"],\"names\":[],\"mappings\":\"AAAA;AACA\"}");
    }

    @Test
    @Tag("unit")
    void testNoSourceMapByDefault() {
        assertThat(generate("x = 1")).doesNotContainKey(CodeGenerator.SOURCE_MAP);
    }

    @Test
    @Tag("unit")
    void testJsxValuesReadingSignalsInAnyBranchAreWrapped() {
        // Act
        String client = (String) generate(
                "client {",
                "  state count = 0",
                "  component Badge(flag, other) {",
                "    <span title={if flag { \"a\" } elif other { count } else { \"c\" }} alt={if flag { \"x\" } else { \"y\" }} use:tip={if flag { \"t\" } else { count }} on:click={if flag { go } else { count }} />",
                "  }",
                "}").get(CodeGenerator.CLIENT);

        // Assert
        assertThat(client)
                .contains("title: () => (flag ? \"a\" : (other ? count() : \"c\"))")
                .contains("alt: (flag ? \"x\" : \"y\")")
                .contains("\"use:tip\": () => (flag ? \"t\" : count())")
                .contains("onClick: () => (flag ? go : count())")
                .doesNotContain("alt: () =>");
    }

    @Test
    @Tag("unit")
    void testMatchLowersRangesAndGuardedBindings() {
        // Act
        String shared = (String) generate(
                "fn grade(n) {",
                "  match n {",
                "    0..10 => \"low\"",
                "    10..=20 => \"mid\"",
                "    x if x > 100 => \"huge\"",
                "    _ => \"other\"",
                "  }",
                "}").get(CodeGenerator.SHARED);

        // Assert
        assertThat(shared)
                .contains("__match >= 0 && __match < 10")
                .contains("__match >= 10 && __match <= 20")
                .contains("((x) => (x > 100))(__match)")
                .contains("const x = __match;");
    }
}
