package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code obj[index]}.
 *
 * @param object The indexed object.
 * @param index The index expression.
 * @param loc The location of the object.
 */
public record IndexAccessNode(AstNode object, AstNode index, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(object, index);
    }
}
