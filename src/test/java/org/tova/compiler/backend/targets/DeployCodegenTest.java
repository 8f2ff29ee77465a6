package org.tova.compiler.backend.targets;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tova.compiler.api.CompilerOptions;
import org.tova.compiler.backend.CodeGenerator;
import org.tova.compiler.frontend.lexer.Lexer;
import org.tova.compiler.frontend.parser.Parser;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

/**
 * Contains unit tests for the deploy manifests.
 */
public class DeployCodegenTest {

    @SuppressWarnings("unchecked")
    private static Map<String, Map<String, Object>> manifests(String... lines) {
        Map<String, Object> result = new CodeGenerator(
                new Parser(new Lexer(String.join("\n", lines), "app.tova").scanTokens()).parse(),
                "app.tova", CompilerOptions.defaults()).generate();
        return (Map<String, Map<String, Object>>) result.get(CodeGenerator.DEPLOY);
    }

    @Test
    @Tag("unit")
    void testManifestStartsFromDefaults() {
        // Act
        Map<String, Object> prod = manifests("deploy \"prod\" {", "  server: \"root@example.com\"", "}").get("prod");

        // Assert
        assertThat(prod).containsEntry("name", "prod")
                .containsEntry("server", "root@example.com")
                .containsEntry("instances", 1)
                .containsEntry("memory", "512mb")
                .containsEntry("branch", "main")
                .containsEntry("health", "/healthz")
                .containsEntry("health_interval", 30)
                .containsEntry("health_timeout", 5)
                .containsEntry("restart_on_failure", true)
                .containsEntry("keep_releases", 5)
                .containsEntry("env", Map.of())
                .containsEntry("databases", List.of());
    }

    @Test
    @Tag("unit")
    void testEnvDatabasesAndOverrides() {
        // Act
        Map<String, Object> prod = manifests(
                "deploy \"prod\" {",
                "  instances: 2",
                "  env {",
                "    NODE_ENV: \"production\"",
                "  }",
                "  db {",
                "    postgres { name: \"app\" }",
                "    redis",
                "  }",
                "}").get("prod");

        // Assert
        assertThat(prod).containsEntry("instances", 2L);
        assertThat(prod).containsEntry("env", Map.of("NODE_ENV", "production"));
        assertThat(prod.get("databases")).isEqualTo(List.of(
                Map.of("engine", "postgres", "config", Map.of("name", "app")),
                Map.of("engine", "redis", "config", Map.of())));
    }

    @Test
    @Tag("unit")
    void testBlocksWithTheSameNameMergeAndLaterSettingsWin() {
        // Act
        Map<String, Map<String, Object>> all = manifests(
                "deploy \"prod\" {",
                "  memory: \"1gb\"",
                "  domain: \"example.com\"",
                "}",
                "deploy \"staging\" {",
                "  branch: \"develop\"",
                "}",
                "deploy \"prod\" {",
                "  memory: \"2gb\"",
                "}");

        // Assert
        assertThat(all).containsOnlyKeys("prod", "staging");
        assertThat(all.keySet()).containsExactly("prod", "staging");
        assertThat(all.get("prod")).contains(entry("memory", "2gb"), entry("domain", "example.com"));
        assertThat(all.get("staging")).containsEntry("branch", "develop");
    }
}
