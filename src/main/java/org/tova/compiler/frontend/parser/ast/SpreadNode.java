package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code ...expr}.
 *
 * @param argument The spread expression.
 * @param loc The location of the operator.
 */
public record SpreadNode(AstNode argument, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(argument);
    }
}
