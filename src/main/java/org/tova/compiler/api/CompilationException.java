package org.tova.compiler.api;

import org.tova.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Checked exception thrown by the {@link ICompiler} facade when a source file cannot be compiled.
 * It carries the diagnostics that caused the failure.
 */
public class CompilationException extends Exception {

    private final transient List<Diagnostic> diagnostics;

    /**
     * Constructs a new CompilationException.
     * @param message The detail message.
     * @param diagnostics The diagnostics that caused the failure.
     * @param cause The underlying compiler error.
     */
    public CompilationException(String message, List<Diagnostic> diagnostics, Throwable cause) {
        super(message, cause);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The diagnostics that caused the failure.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
