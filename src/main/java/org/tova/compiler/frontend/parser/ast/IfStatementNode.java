package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code if / elif / else} in statement position. {@code else if} is normalized into {@code alternates}.
 *
 * @param condition The first condition.
 * @param consequent The first branch.
 * @param alternates The {@code elif} branches.
 * @param elseBody The {@code else} branch, or null.
 * @param loc The location of the keyword.
 */
public record IfStatementNode(AstNode condition, BlockNode consequent, List<ConditionalBranchNode> alternates, BlockNode elseBody, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(condition, consequent, alternates, elseBody);
    }
}
