package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code let { a, b } = value} or {@code let [a, b] = value}.
 *
 * @param kind Whether an object or an array is destructured.
 * @param names The bound names in source order.
 * @param value The destructured value.
 * @param loc The location of the keyword.
 */
public record LetDestructureNode(Kind kind, List<String> names, AstNode value, SourceInfo loc) implements AstNode {

    /** The destructuring shape. */
    public enum Kind { OBJECT, ARRAY }

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }
}
