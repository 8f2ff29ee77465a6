package org.tova.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tova.cli.CommandLineInterface;
import org.tova.compiler.Compiler;
import org.tova.compiler.api.CompilationException;
import org.tova.compiler.api.CompilationResult;
import org.tova.compiler.api.CompilerOptions;
import org.tova.compiler.diagnostics.Diagnostic;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "compile",
        mixinStandardHelpOptions = true,
        description = "Compiles .tova files to JavaScript, one file per target.")
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @Parameters(arity = "1..*", description = "The .tova files to compile.")
    private List<File> files;

    @Option(names = {"-o", "--output"}, description = "Output directory (default: tova.output.directory).")
    private File outputDirectory;

    @Option(names = "--tolerant", description = "Generate code even when the analysis reports errors.")
    private boolean tolerant;

    @Option(names = "--strict", description = "Report gradual type warnings as errors.")
    private boolean strict;

    @Option(names = "--source-maps", description = "Write a source map for the shared output.")
    private boolean sourceMaps;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        Config config = parent.getConfig();
        CompilerOptions configured = CompilerOptions.fromConfig(config);
        CompilerOptions options = new CompilerOptions(
                tolerant || configured.tolerant(),
                strict || configured.strict(),
                sourceMaps || configured.sourceMaps(),
                configured.namingLint());
        Path outDir = outputDirectory != null
                ? outputDirectory.toPath()
                : Path.of(config.getString("tova.output.directory"));

        Compiler compiler = new Compiler(options);
        compiler.setVerbosity(config.getInt("tova.compiler.verbosity"));
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        int exitCode = 0;
        for (File file : files) {
            if (!file.isFile()) {
                log.error("File not found: {}", file.getAbsolutePath());
                exitCode = 2;
                continue;
            }
            try {
                CompilationResult result = compiler.compile(file.toPath());
                result.warnings().forEach(w -> err.println(w));
                for (Map.Entry<String, String> output : outputFiles(baseName(file), result).entrySet()) {
                    Path target = outDir.resolve(output.getKey());
                    Files.createDirectories(outDir);
                    Files.writeString(target, output.getValue());
                    out.println("wrote " + target);
                }
            } catch (CompilationException e) {
                e.getDiagnostics().stream().filter(d -> d.type() == Diagnostic.Type.ERROR).forEach(err::println);
                log.error("Compilation of {} failed", file.getName());
                exitCode = Math.max(exitCode, 1);
            } catch (IOException e) {
                log.error("Failed to write output for {}: {}", file.getName(), e.getMessage());
                exitCode = 2;
            }
        }
        return exitCode;
    }

    /**
     * Maps each non-empty output of a compilation to its file name.
     * @param base The source file name without the {@code .tova} extension.
     * @param result The compilation result.
     * @return File names mapped to their contents, in write order.
     */
    static Map<String, String> outputFiles(String base, CompilationResult result) {
        Map<String, String> files = new LinkedHashMap<>();
        if (result.isCli()) {
            files.put(base + ".js", result.cli().orElseThrow());
            result.sourceMap().ifPresent(map -> files.put(base + ".shared.js.map", map));
            return files;
        }
        putIfPresent(files, base + ".shared.js", result.shared());
        putIfPresent(files, base + ".server.js", result.server());
        putIfPresent(files, base + ".client.js", result.client());
        putIfPresent(files, base + ".edge.js", result.edge());
        result.servers().forEach((name, code) -> putIfPresent(files, base + ".server." + name + ".js", code));
        result.clients().forEach((name, code) -> putIfPresent(files, base + ".client." + name + ".js", code));
        result.edges().forEach((name, code) -> putIfPresent(files, base + ".edge." + name + ".js", code));
        result.sourceMap().ifPresent(map -> files.put(base + ".shared.js.map", map));
        if (!result.deploy().isEmpty()) {
            Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
            files.put(base + ".deploy.json", gson.toJson(result.deploy()));
        }
        return files;
    }

    private static void putIfPresent(Map<String, String> files, String name, String code) {
        if (code != null && !code.isBlank()) {
            files.put(name, code);
        }
    }

    private static String baseName(File file) {
        String name = file.getName();
        return name.endsWith(".tova") ? name.substring(0, name.length() - ".tova".length()) : name;
    }
}
