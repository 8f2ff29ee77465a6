package org.tova.compiler.diagnostics;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur during the compilation process.
 * <p>
 * This decouples error reporting from the analysis logic.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message The error message.
     * @param loc     The location of the error.
     * @param code    The diagnostic code, may be {@code null}.
     * @param hint    A fix suggestion, may be {@code null}.
     */
    public void reportError(String message, SourceInfo loc, CompilerErrorCode code, String hint) {
        diagnostics.add(Diagnostic.at(Diagnostic.Type.ERROR, message, loc, code == null ? null : code.name(), hint));
    }

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param loc     The location of the warning.
     * @param code    The diagnostic code, may be {@code null}.
     * @param hint    A fix suggestion, may be {@code null}.
     */
    public void reportWarning(String message, SourceInfo loc, CompilerErrorCode code, String hint) {
        diagnostics.add(Diagnostic.at(Diagnostic.Type.WARNING, message, loc, code == null ? null : code.name(), hint));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return All errors in report order.
     */
    public List<Diagnostic> getErrors() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).toList();
    }

    /**
     * @return All warnings in report order.
     */
    public List<Diagnostic> getWarnings() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.WARNING).toList();
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
