package org.tova.compiler.frontend.semantics;

import org.tova.compiler.diagnostics.Diagnostic;
import org.tova.compiler.frontend.types.TypeRegistry;

import java.util.List;

/**
 * The outcome of one analysis walk.
 *
 * @param warnings The warnings in report order.
 * @param errors The errors in report order; only non-empty in tolerant mode.
 * @param types The nominal types declared by the program.
 */
public record AnalysisResult(List<Diagnostic> warnings, List<Diagnostic> errors, TypeRegistry types) {

    public AnalysisResult {
        warnings = List.copyOf(warnings);
        errors = List.copyOf(errors);
    }

    /**
     * @return {@code true} if at least one error was reported.
     */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
