package org.tova.compiler.diagnostics;

import org.tova.compiler.api.SourceInfo;

/**
 * Represents a single diagnostic message (error, warning, info)
 * that occurs during the compilation process.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The 1-based line number of the issue.
 * @param columnNumber The 1-based column number of the issue.
 * @param code The diagnostic code (e.g. {@code W200}), or {@code null}.
 * @param hint A suggestion for fixing the issue, or {@code null}.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber,
        int columnNumber,
        String code,
        String hint
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING,
        /** An informational message. */
        INFO
    }

    /**
     * Creates a diagnostic at the given source location.
     * @param type The diagnostic type.
     * @param message The message.
     * @param loc The location, may be {@code null}.
     * @param code The code, may be {@code null}.
     * @param hint The hint, may be {@code null}.
     * @return The new diagnostic.
     */
    public static Diagnostic at(Type type, String message, SourceInfo loc, String code, String hint) {
        if (loc == null) {
            return new Diagnostic(type, message, "<unknown>", 0, 0, code, hint);
        }
        return new Diagnostic(type, message, loc.fileName(), loc.lineNumber(), loc.columnNumber(), code, hint);
    }

    @Override
    public String toString() {
        String text = String.format("[%s] %s:%d:%d: %s", type, fileName, lineNumber, columnNumber, message);
        if (code != null) {
            text += " (" + code + ")";
        }
        if (hint != null) {
            text += "\n  hint: " + hint;
        }
        return text;
    }
}
