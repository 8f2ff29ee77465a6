package org.tova.config;

import com.typesafe.config.Config;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tova.compiler.api.CompilerOptions;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the layered configuration loading.
 */
public class ConfigLoaderTest {

    @Test
    @Tag("unit")
    void testReferenceDefaults() {
        // Act
        Config config = ConfigLoader.load();

        // Assert
        assertThat(config.getString("tova.output.directory")).isEqualTo("build");
        assertThat(config.getInt("tova.compiler.verbosity")).isEqualTo(2);
        assertThat(CompilerOptions.fromConfig(config)).isEqualTo(CompilerOptions.defaults());
    }

    @Test
    @Tag("unit")
    void testExplicitFileOverridesDefaults(@TempDir Path dir) throws IOException {
        // Arrange
        Path file = dir.resolve("custom.conf");
        Files.writeString(file, "tova.compiler { strict = true, source-maps = true }\ntova.output.directory = \"dist\"\n");

        // Act
        Config config = ConfigLoader.load(file.toFile());

        // Assert
        assertThat(config.getString("tova.output.directory")).isEqualTo("dist");
        CompilerOptions options = CompilerOptions.fromConfig(config);
        assertThat(options.strict()).isTrue();
        assertThat(options.sourceMaps()).isTrue();
        assertThat(options.tolerant()).isFalse();
        assertThat(options.namingLint()).isTrue();
    }

    @Test
    @Tag("unit")
    void testMissingExplicitFileIsRejected(@TempDir Path dir) {
        // Arrange
        File missing = dir.resolve("nope.conf").toFile();

        // Act / Assert
        assertThatThrownBy(() -> ConfigLoader.load(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Configuration file not found");
    }
}
