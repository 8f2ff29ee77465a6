package org.tova.compiler.diagnostics;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * Internal defect raised during code generation, e.g. for a node kind no emission rule handles.
 */
public class CodegenError extends CompilerError {

    /**
     * @param message The error message.
     * @param location The location of the node being emitted, may be {@code null}.
     */
    public CodegenError(String message, SourceInfo location) {
        super(location == null ? message : location + ": " + message,
                List.of(Diagnostic.at(Diagnostic.Type.ERROR, message, location, null, null)));
    }
}
