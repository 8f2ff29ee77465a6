package org.tova.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tova.cli.CommandLineInterface;
import org.tova.compiler.Compiler;
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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "check",
        mixinStandardHelpOptions = true,
        description = "Reports every error and warning in .tova files without generating code.")
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Parameters(arity = "1..*", description = "The .tova files to check.")
    private List<File> files;

    @Option(names = "--json", description = "Print the diagnostics as a JSON array.")
    private boolean json;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        Compiler compiler = new Compiler(CompilerOptions.fromConfig(parent.getConfig()));
        PrintWriter out = spec.commandLine().getOut();
        List<Diagnostic> all = new ArrayList<>();
        int errors = 0;
        int warnings = 0;
        for (File file : files) {
            String source;
            try {
                source = Files.readString(file.toPath());
            } catch (IOException e) {
                log.error("Cannot read {}: {}", file.getAbsolutePath(), e.getMessage());
                return 2;
            }
            for (Diagnostic diagnostic : compiler.check(source, file.getPath().replace('\\', '/'))) {
                all.add(diagnostic);
                if (!json) out.println(diagnostic);
                if (diagnostic.type() == Diagnostic.Type.ERROR) errors++;
                else if (diagnostic.type() == Diagnostic.Type.WARNING) warnings++;
            }
        }
        if (json) {
            Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
            out.println(gson.toJson(all));
        } else {
            out.println(errors + " error(s), " + warnings + " warning(s)");
        }
        return errors > 0 ? 1 : 0;
    }
}
