package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code return [value]}.
 *
 * @param value The returned value, or null.
 * @param loc The location of the keyword.
 */
public record ReturnNode(AstNode value, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(value);
    }
}
