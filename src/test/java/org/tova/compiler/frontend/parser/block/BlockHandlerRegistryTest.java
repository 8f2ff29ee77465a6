package org.tova.compiler.frontend.parser.block;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tova.compiler.diagnostics.ParseError;
import org.tova.compiler.frontend.lexer.Lexer;
import org.tova.compiler.frontend.parser.Parser;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.ConfigFieldNode;
import org.tova.compiler.frontend.parser.ast.FunctionDeclarationNode;
import org.tova.compiler.frontend.parser.features.cli.CliBlockNode;
import org.tova.compiler.frontend.parser.features.cli.CliParamNode;
import org.tova.compiler.frontend.parser.features.client.ClientBlockNode;
import org.tova.compiler.frontend.parser.features.client.ComponentNode;
import org.tova.compiler.frontend.parser.features.client.ComputedNode;
import org.tova.compiler.frontend.parser.features.client.StateNode;
import org.tova.compiler.frontend.parser.features.deploy.DeployBlockNode;
import org.tova.compiler.frontend.parser.features.deploy.DeployDatabasesNode;
import org.tova.compiler.frontend.parser.features.deploy.DeployEnvNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeBindingNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeBlockNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeEnvNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeScheduleNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeSecretNode;
import org.tova.compiler.frontend.parser.features.security.SecurityAuthNode;
import org.tova.compiler.frontend.parser.features.security.SecurityBlockNode;
import org.tova.compiler.frontend.parser.features.security.SecurityProtectNode;
import org.tova.compiler.frontend.parser.features.security.SecurityRoleNode;
import org.tova.compiler.frontend.parser.features.server.MiddlewareNode;
import org.tova.compiler.frontend.parser.features.server.RouteNode;
import org.tova.compiler.frontend.parser.features.server.ServerBlockNode;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link BlockHandlerRegistry} and the top-level block handlers it dispatches to.
 */
public class BlockHandlerRegistryTest {

    private static List<AstNode> parse(String source) {
        return new Parser(new Lexer(source, "blocks.tova").scanTokens()).parse().body();
    }

    @Test
    @Tag("unit")
    void testRegistryKnowsAllBuiltInBlocks() {
        // Act
        BlockHandlerRegistry registry = BlockHandlerRegistry.initialize();

        // Assert
        assertThat(registry.names()).containsExactly("client", "server", "shared", "edge", "deploy", "security", "cli");
        assertThat(registry.get("SERVER")).isPresent();
        assertThat(registry.get("unknown")).isEmpty();
    }

    @Test
    @Tag("unit")
    void testContextualKeywordStaysAnIdentifierOutsideBlockPosition() {
        // Act
        List<AstNode> body = parse("edge = 3\ndeploy = edge + 1");

        // Assert
        assertThat(body).hasSize(2).noneMatch(n -> n instanceof EdgeBlockNode || n instanceof DeployBlockNode);
    }

    @Test
    @Tag("unit")
    void testServerBlockWithRoutesAndMiddleware() {
        // Arrange
        String source = String.join("\n",
                "server \"api\" {",
                "  fn list_users() { [] }",
                "  middleware fn logger(req, next) { next(req) }",
                "  route GET \"/users\" => list_users",
                "}");

        // Act
        ServerBlockNode server = (ServerBlockNode) parse(source).get(0);

        // Assert
        assertThat(server.name()).isEqualTo("api");
        assertThat(server.body()).hasSize(3);
        assertThat(server.body().get(0)).isInstanceOf(FunctionDeclarationNode.class);
        assertThat(server.body().get(1)).isInstanceOf(MiddlewareNode.class);
        RouteNode route = (RouteNode) server.body().get(2);
        assertThat(route.method()).isEqualTo("GET");
        assertThat(route.path()).isEqualTo("/users");
    }

    @Test
    @Tag("unit")
    void testInvalidHttpMethodIsRejected() {
        assertThatThrownBy(() -> parse("server {\n  route FETCH \"/x\" => h\n}"))
                .isInstanceOf(ParseError.class)
                .hasMessageContaining("Invalid HTTP method 'FETCH'");
    }

    @Test
    @Tag("unit")
    void testClientBlockReactiveDeclarations() {
        // Arrange
        String source = String.join("\n",
                "client {",
                "  state count = 0",
                "  computed double = count * 2",
                "  component Counter(label) {",
                "    <button>{label}</button>",
                "  }",
                "}");

        // Act
        ClientBlockNode client = (ClientBlockNode) parse(source).get(0);

        // Assert
        assertThat(client.name()).isNull();
        assertThat(client.body().get(0)).isInstanceOfSatisfying(StateNode.class, s -> assertThat(s.name()).isEqualTo("count"));
        assertThat(client.body().get(1)).isInstanceOfSatisfying(ComputedNode.class, c -> assertThat(c.name()).isEqualTo("double"));
        assertThat(client.body().get(2)).isInstanceOfSatisfying(ComponentNode.class, c -> {
            assertThat(c.name()).isEqualTo("Counter");
            assertThat(c.params()).hasSize(1);
            assertThat(c.body()).hasSize(1);
        });
    }

    @Test
    @Tag("unit")
    void testEdgeBlockDeclarations() {
        // Arrange
        String source = String.join("\n",
                "edge {",
                "  target: \"deno\"",
                "  kv CACHE",
                "  env REGION = \"eu\"",
                "  secret API_KEY",
                "  schedule \"cleanup\" cron(\"0 * * * *\") {",
                "    prune()",
                "  }",
                "}");

        // Act
        EdgeBlockNode edge = (EdgeBlockNode) parse(source).get(0);

        // Assert
        assertThat(edge.body()).hasSize(5);
        assertThat(edge.body().get(0)).isInstanceOfSatisfying(ConfigFieldNode.class, f -> assertThat(f.key()).isEqualTo("target"));
        assertThat(edge.body().get(1)).isInstanceOfSatisfying(EdgeBindingNode.class, b -> {
            assertThat(b.kind()).isEqualTo("kv");
            assertThat(b.name()).isEqualTo("CACHE");
        });
        assertThat(edge.body().get(2)).isInstanceOfSatisfying(EdgeEnvNode.class, e -> assertThat(e.defaultValue()).isNotNull());
        assertThat(edge.body().get(3)).isInstanceOf(EdgeSecretNode.class);
        assertThat(edge.body().get(4)).isInstanceOfSatisfying(EdgeScheduleNode.class,
                s -> assertThat(s.cron()).isEqualTo("0 * * * *"));
    }

    @Test
    @Tag("unit")
    void testDeployBlockRequiresName() {
        assertThatThrownBy(() -> parse("deploy {\n  server: \"root@host\"\n}"))
                .isInstanceOf(ParseError.class)
                .hasMessageContaining("Deploy block requires a name");
    }

    @Test
    @Tag("unit")
    void testDeployBlockWithEnvAndDatabases() {
        // Arrange
        String source = String.join("\n",
                "deploy \"prod\" {",
                "  server: \"root@example.com\"",
                "  instances: 2",
                "  env {",
                "    NODE_ENV: \"production\"",
                "  }",
                "  db {",
                "    postgres { name: \"app\" }",
                "    redis",
                "  }",
                "}");

        // Act
        DeployBlockNode deploy = (DeployBlockNode) parse(source).get(0);

        // Assert
        assertThat(deploy.name()).isEqualTo("prod");
        assertThat(deploy.body()).hasSize(4);
        assertThat(deploy.body().get(0)).isInstanceOfSatisfying(ConfigFieldNode.class, f -> assertThat(f.key()).isEqualTo("server"));
        assertThat(deploy.body().get(2)).isInstanceOfSatisfying(DeployEnvNode.class, e -> assertThat(e.entries()).hasSize(1));
        assertThat(deploy.body().get(3)).isInstanceOfSatisfying(DeployDatabasesNode.class,
                db -> assertThat(db.engines()).extracting(e -> e.engine()).containsExactly("postgres", "redis"));
    }

    @Test
    @Tag("unit")
    void testSecurityBlockDeclarations() {
        // Arrange
        String source = String.join("\n",
                "security {",
                "  auth jwt { secret: \"s3cret\" }",
                "  role Admin { can: [manage_users, view] }",
                "  protect \"/admin/*\" { require: Admin }",
                "}");

        // Act
        SecurityBlockNode security = (SecurityBlockNode) parse(source).get(0);

        // Assert
        assertThat(security.body().get(0)).isInstanceOfSatisfying(SecurityAuthNode.class,
                a -> assertThat(a.authType()).isEqualTo("jwt"));
        assertThat(security.body().get(1)).isInstanceOfSatisfying(SecurityRoleNode.class,
                r -> assertThat(r.permissions()).containsExactly("manage_users", "view"));
        assertThat(security.body().get(2)).isInstanceOfSatisfying(SecurityProtectNode.class,
                p -> assertThat(p.pattern()).isEqualTo("/admin/*"));
    }

    @Test
    @Tag("unit")
    void testUnknownSecurityDeclarationIsRejected() {
        assertThatThrownBy(() -> parse("security {\n  firewall { on: true }\n}"))
                .isInstanceOf(ParseError.class)
                .hasMessageContaining("Unknown security declaration 'firewall'");
    }

    @Test
    @Tag("unit")
    void testCliBlockCommandsAndFlags() {
        // Arrange
        String source = String.join("\n",
                "cli {",
                "  name: \"greeter\"",
                "  fn greet(target: String, --loud: Bool, --times: Int = 1, --tag: [String]) {",
                "    print(target)",
                "  }",
                "}");

        // Act
        CliBlockNode cli = (CliBlockNode) parse(source).get(0);

        // Assert
        assertThat(cli.config()).extracting(ConfigFieldNode::key).containsExactly("name");
        List<CliParamNode> params = cli.commands().get(0).params();
        assertThat(params).extracting(CliParamNode::name).containsExactly("target", "loud", "times", "tag");
        assertThat(params.get(0).flag()).isFalse();
        assertThat(params.get(0).optional()).isFalse();
        assertThat(params.get(1).flag()).isTrue();
        assertThat(params.get(1).optional()).isTrue();
        assertThat(params.get(2).defaultValue()).isNotNull();
        assertThat(params.get(3).repeated()).isTrue();
    }
}
