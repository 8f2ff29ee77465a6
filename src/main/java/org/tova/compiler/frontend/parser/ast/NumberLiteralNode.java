package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

/**
 * A numeric literal. The value is a {@link Long} for integers and a {@link Double} otherwise.
 *
 * @param value The parsed value.
 * @param loc The source location.
 */
public record NumberLiteralNode(Number value, SourceInfo loc) implements AstNode {

    /**
     * @return {@code true} if the literal has no fraction or exponent.
     */
    public boolean isInteger() {
        return value instanceof Long;
    }
}
