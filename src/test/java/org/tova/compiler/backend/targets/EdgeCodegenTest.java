package org.tova.compiler.backend.targets;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tova.compiler.api.CompilerOptions;
import org.tova.compiler.backend.CodeGenerator;
import org.tova.compiler.frontend.lexer.Lexer;
import org.tova.compiler.frontend.parser.Parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the edge target and its platform adapters.
 */
public class EdgeCodegenTest {

    private static Map<String, Object> generate(String... lines) {
        return new CodeGenerator(new Parser(new Lexer(String.join("\n", lines), "app.tova").scanTokens()).parse(),
                "app.tova", CompilerOptions.defaults()).generate();
    }

    @Test
    @Tag("unit")
    void testPathPatternCapturesParamsAndWildcard() {
        // Arrange
        List<String> params = new ArrayList<>();
        List<String> wildcard = new ArrayList<>();

        // Act
        String users = EdgeCodegen.pathPattern("/users/:id/posts/:post_id", params);
        String files = EdgeCodegen.pathPattern("/files/*", wildcard);

        // Assert
        assertThat(users).isEqualTo("\\/users\\/([^/]+)\\/posts\\/([^/]+)");
        assertThat(params).containsExactly("id", "post_id");
        assertThat(files).isEqualTo("\\/files\\/(.*)");
        assertThat(wildcard).containsExactly("wildcard");
    }

    @Test
    @Tag("unit")
    void testDenoTargetUsesDenoKvEnvAndCron() {
        // Act
        String edge = (String) generate(
                "edge {",
                "  target: \"deno\"",
                "  kv CACHE",
                "  env REGION = \"eu\"",
                "  secret API_KEY",
                "  route GET \"/items/:id\" => get_item",
                "  fn get_item(req, params) { params.id }",
                "  schedule \"cleanup\" cron(\"0 * * * *\") {",
                "    prune()",
                "  }",
                "}").get(CodeGenerator.EDGE);

        // Assert
        assertThat(edge)
                .contains("const CACHE = await Deno.openKv();")
                .contains("const REGION = Deno.env.get(\"REGION\") ?? \"eu\";")
                .contains("const API_KEY = Deno.env.get(\"API_KEY\");")
                .contains("__routes.push({ method: \"GET\", pattern: /^\\/items\\/([^/]+)$/, paramNames: [\"id\"], handler: get_item });")
                .contains("Deno.cron(\"cleanup\", \"0 * * * *\", async () => {")
                .endsWith("Deno.serve((request) => __dispatch(request));");
    }

    @Test
    @Tag("unit")
    void testCloudflareIsTheDefaultAndAssignsBindingsFromEnv() {
        // Act
        String edge = (String) generate(
                "edge {",
                "  kv SESSIONS",
                "  fn home(req) { \"ok\" }",
                "  route GET \"/\" => home",
                "}").get(CodeGenerator.EDGE);

        // Assert
        assertThat(edge)
                .contains("let SESSIONS;")
                .contains("export default {")
                .contains("async fetch(request, env, ctx) {")
                .contains("SESSIONS = env.SESSIONS;")
                .contains("return __dispatch(request, env, ctx);");
    }

    @Test
    @Tag("unit")
    void testUnknownTargetFallsBackToCloudflare() {
        // Act
        String edge = (String) generate(
                "edge {",
                "  target: \"nimbus\"",
                "  fn home(req) { \"ok\" }",
                "  route GET \"/\" => home",
                "}").get(CodeGenerator.EDGE);

        // Assert
        assertThat(edge).contains("async fetch(request, env, ctx) {");
    }

    @Test
    @Tag("unit")
    void testLambdaTargetConvertsApiGatewayEvents() {
        // Act
        String edge = (String) generate(
                "edge {",
                "  target: \"lambda\"",
                "  env STAGE = \"dev\"",
                "}").get(CodeGenerator.EDGE);

        // Assert
        assertThat(edge)
                .contains("const STAGE = process.env.STAGE ?? \"dev\";")
                .contains("export const handler = async (event, context) => {")
                .contains("statusCode: response.status");
    }

    @Test
    @Tag("unit")
    void testNamedEdgeGroupsAreEmittedSeparately() {
        // Act
        Map<String, Object> result = generate(
                "edge \"api\" {",
                "  target: \"bun\"",
                "}",
                "edge \"worker\" {",
                "  target: \"vercel\"",
                "}");

        // Assert
        @SuppressWarnings("unchecked")
        Map<String, String> edges = (Map<String, String>) result.get(CodeGenerator.EDGES);
        assertThat(edges).containsOnlyKeys("api", "worker");
        assertThat(edges.get("api")).contains("Bun.serve({");
        assertThat(edges.get("worker")).startsWith("export const config = { runtime: \"edge\" };");
        assertThat(result.get(CodeGenerator.EDGE)).isEqualTo("");
    }
}
