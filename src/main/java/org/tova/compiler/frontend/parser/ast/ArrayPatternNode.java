package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code [p, q]} matching an array of exactly that length.
 *
 * @param elements The element patterns.
 * @param loc The source location.
 */
public record ArrayPatternNode(List<AstNode> elements, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(elements);
    }
}
