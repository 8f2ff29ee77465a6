package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code [a, b, ...rest]}.
 *
 * @param elements The elements, possibly including {@link SpreadNode}s.
 * @param loc The location of the bracket.
 */
public record ArrayLiteralNode(List<AstNode> elements, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(elements);
    }
}
