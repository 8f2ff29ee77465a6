package org.tova.compiler.diagnostics;

import java.util.List;

/**
 * Base class of the unchecked errors raised by the compiler phases.
 * Each error carries the diagnostics that describe it.
 */
public abstract class CompilerError extends RuntimeException {

    private final transient List<Diagnostic> diagnostics;

    /**
     * @param message The exception message.
     * @param diagnostics The diagnostics describing the failure.
     */
    protected CompilerError(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The diagnostics describing the failure.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
