package org.tova.compiler.frontend.lexer;

import org.tova.compiler.api.SourceInfo;

/**
 * Represents a single token produced by the {@link Lexer}.
 * A token is an immutable data structure that holds information about a lexical unit.
 *
 * @param type     The type of the token.
 * @param text     The exact source slice the token was scanned from.
 * @param value    The processed literal value (numbers, unescaped strings, template parts, tag names), or null.
 * @param line     The 1-based line number where the token starts.
 * @param column   The 1-based column number where the token starts.
 * @param fileName The logical name of the file in which the token was found.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {
    /**
     * @return The location of this token.
     */
    public SourceInfo loc() {
        return new SourceInfo(fileName, line, column);
    }
}
