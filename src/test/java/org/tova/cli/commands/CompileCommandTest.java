package org.tova.cli.commands;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tova.cli.CommandLineInterface;
import org.tova.compiler.api.CompilationResult;
import org.tova.compiler.backend.CodeGenerator;
import org.tova.config.LoggingConfigurator;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains tests for the {@code compile} and {@code check} subcommands.
 */
public class CompileCommandTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    @Test
    @Tag("unit")
    void testOutputFilesPerTarget() {
        // Arrange
        CompilationResult result = new CompilationResult("app.tova", Map.of(
                CodeGenerator.SHARED, "const a = 1;",
                CodeGenerator.SERVER, "server code",
                CodeGenerator.CLIENT, "   ",
                CodeGenerator.DEPLOY, Map.of("prod", Map.of("name", "prod"))), List.of());

        // Act
        Map<String, String> files = CompileCommand.outputFiles("app", result);

        // Assert
        assertThat(files.keySet()).containsExactly("app.shared.js", "app.server.js", "app.deploy.json");
        assertThat(files.get("app.deploy.json")).contains("\"prod\"").contains("\"name\": \"prod\"");
    }

    @Test
    @Tag("unit")
    void testCliProgramWritesSingleExecutable() {
        // Arrange
        CompilationResult result = new CompilationResult("tool.tova", Map.of(
                CodeGenerator.SHARED, "",
                CodeGenerator.CLI, "#!/usr/bin/env node"), List.of());

        // Act
        Map<String, String> files = CompileCommand.outputFiles("tool", result);

        // Assert
        assertThat(files).containsOnlyKeys("tool.js");
    }

    @Test
    @Tag("unit")
    void testCompileWritesOutputs(@TempDir Path dir) throws IOException {
        // Arrange
        Path source = dir.resolve("app.tova");
        Files.writeString(source, "x = 1\n");
        Path outDir = dir.resolve("out");

        // Act
        int exitCode = run("compile", "-o", outDir.toString(), source.toString());

        // Assert
        assertThat(exitCode).isEqualTo(0);
        assertThat(Files.readString(outDir.resolve("app.shared.js"))).contains("const x = 1;");
        assertThat(out.toString()).contains("wrote ");
    }

    @Test
    @Tag("unit")
    void testCompileFailsOnAnalysisError(@TempDir Path dir) throws IOException {
        // Arrange
        Path source = dir.resolve("bad.tova");
        Files.writeString(source, "fn f(a: Int) -> Int { return a }\nf(\"5\")\n");

        // Act
        int exitCode = run("compile", "-o", dir.resolve("out").toString(), source.toString());

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Type mismatch");
        assertThat(dir.resolve("out").resolve("bad.shared.js")).doesNotExist();
    }

    @Test
    @Tag("unit")
    void testCompileReportsMissingFile(@TempDir Path dir) {
        // Act
        int exitCode = run("compile", "-o", dir.toString(), dir.resolve("missing.tova").toString());

        // Assert
        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void testCheckCountsDiagnostics(@TempDir Path dir) throws IOException {
        // Arrange
        Path source = dir.resolve("app.tova");
        Files.writeString(source, "fn loadData() { 1 }\n");

        // Act
        int exitCode = run("check", source.toString());

        // Assert
        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("(W100)").contains("0 error(s)");
    }

    @Test
    @Tag("unit")
    void testCheckPrintsJson(@TempDir Path dir) throws IOException {
        // Arrange
        Path source = dir.resolve("app.tova");
        Files.writeString(source, "fn loadData() { 1 }\n");

        // Act
        int exitCode = run("check", "--json", source.toString());

        // Assert
        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).startsWith("[")
                .contains("\"code\": \"W100\"")
                .contains("\"type\": \"WARNING\"")
                .doesNotContain("error(s)");
    }
}
