package org.tova.compiler.api;

import org.tova.compiler.diagnostics.Diagnostic;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface of the Tova compiler.
 */
public interface ICompiler {

    /**
     * Compiles the given source code.
     *
     * @param source The complete source text.
     * @param fileName The file name used in diagnostics and source maps.
     * @return The generated outputs together with the warnings of the analysis.
     * @throws CompilationException if lexing, parsing or analysis fails.
     */
    CompilationResult compile(String source, String fileName) throws CompilationException;

    /**
     * Runs lexing, parsing and analysis in tolerant mode and reports every diagnostic found,
     * without generating code.
     *
     * @param source The complete source text.
     * @param fileName The file name used in diagnostics.
     * @return The errors and warnings, errors first.
     */
    List<Diagnostic> check(String source, String fileName);

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=errors only up to 4=trace).
     */
    void setVerbosity(int level);

    /**
     * Compiles the source code from a file.
     * @param sourcePath The path to the {@code .tova} source file.
     * @return The generated outputs.
     * @throws CompilationException if errors occur during compilation.
     * @throws IOException if the file cannot be read.
     */
    default CompilationResult compile(Path sourcePath) throws CompilationException, IOException {
        return compile(Files.readString(sourcePath), sourcePath.toString().replace('\\', '/'));
    }
}
