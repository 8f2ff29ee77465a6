package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code while cond { }}.
 *
 * @param condition The loop condition.
 * @param body The loop body.
 * @param loc The location of the keyword.
 */
public record WhileNode(AstNode condition, BlockNode body, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(condition, body);
    }
}
