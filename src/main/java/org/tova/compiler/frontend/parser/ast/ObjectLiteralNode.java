package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code { key: value, shorthand, ...spread }}.
 *
 * @param entries {@link ObjectPropertyNode}s and {@link SpreadNode}s.
 * @param loc The location of the brace.
 */
public record ObjectLiteralNode(List<AstNode> entries, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(entries);
    }
}
