package org.tova.compiler.diagnostics;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * Thrown by the lexer on malformed input. Lexing never recovers.
 */
public class LexError extends CompilerError {

    private final transient SourceInfo location;

    /**
     * @param message The error message.
     * @param location Where the malformed input starts.
     */
    public LexError(String message, SourceInfo location) {
        super(location + ": " + message,
                List.of(Diagnostic.at(Diagnostic.Type.ERROR, message, location, CompilerErrorCode.E001.name(), null)));
        this.location = location;
    }

    /**
     * @return Where the malformed input starts.
     */
    public SourceInfo getLocation() {
        return location;
    }
}
