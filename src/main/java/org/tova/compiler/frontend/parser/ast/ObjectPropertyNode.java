package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * One {@code key: value} entry. A shorthand entry has an {@link IdentifierNode} value with the same name.
 *
 * @param key The property key.
 * @param value The value.
 * @param loc The location of the key.
 */
public record ObjectPropertyNode(String key, AstNode value, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(value);
    }
}
