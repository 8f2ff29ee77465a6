package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code guard cond else { ... }}.
 *
 * @param condition The condition that must hold.
 * @param elseBody Runs when the condition fails.
 * @param loc The location of the keyword.
 */
public record GuardNode(AstNode condition, BlockNode elseBody, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(condition, elseBody);
    }
}
