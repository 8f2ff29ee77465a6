package org.tova.compiler.diagnostics;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * Thrown by the parser on the first syntax error. There is no error recovery.
 */
public class ParseError extends CompilerError {

    private final transient SourceInfo location;
    private final String hint;

    /**
     * @param message The error message.
     * @param location The location of the offending token.
     * @param code The diagnostic code.
     * @param hint A fix suggestion, may be {@code null}.
     */
    public ParseError(String message, SourceInfo location, CompilerErrorCode code, String hint) {
        super(location + ": " + message + (hint == null ? "" : " (" + hint + ")"),
                List.of(Diagnostic.at(Diagnostic.Type.ERROR, message, location, code.name(), hint)));
        this.location = location;
        this.hint = hint;
    }

    /**
     * @param message The error message.
     * @param location The location of the offending token.
     */
    public ParseError(String message, SourceInfo location) {
        this(message, location, CompilerErrorCode.E001, null);
    }

    /**
     * @return The location of the offending token.
     */
    public SourceInfo getLocation() {
        return location;
    }

    /**
     * @return The fix suggestion, or {@code null}.
     */
    public String getHint() {
        return hint;
    }
}
