package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * An {@code elif} branch of an if statement or expression.
 *
 * @param condition The branch condition.
 * @param body The branch body.
 * @param loc The location of the keyword.
 */
public record ConditionalBranchNode(AstNode condition, BlockNode body, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(condition, body);
    }
}
