package org.tova.compiler.diagnostics;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Aggregate error thrown after a complete analysis walk that produced at least one error.
 * It carries every error and every warning of the walk.
 */
public class AnalysisError extends CompilerError {

    private final transient List<Diagnostic> errors;
    private final transient List<Diagnostic> warnings;

    /**
     * @param errors The errors of the walk, never empty.
     * @param warnings The warnings of the walk.
     */
    public AnalysisError(List<Diagnostic> errors, List<Diagnostic> warnings) {
        super(describe(errors), concat(errors, warnings));
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
    }

    /**
     * @return The errors, in report order.
     */
    public List<Diagnostic> getErrors() {
        return errors;
    }

    /**
     * @return The warnings, in report order.
     */
    public List<Diagnostic> getWarnings() {
        return warnings;
    }

    private static String describe(List<Diagnostic> errors) {
        return "Analysis failed with " + errors.size() + " error(s):\n"
                + errors.stream().map(Diagnostic::toString).collect(Collectors.joining("\n"));
    }

    private static List<Diagnostic> concat(List<Diagnostic> a, List<Diagnostic> b) {
        List<Diagnostic> all = new ArrayList<>(a);
        all.addAll(b);
        return all;
    }
}
