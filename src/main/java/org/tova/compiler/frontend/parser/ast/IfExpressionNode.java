package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * An {@code if} used as a value. Each branch yields its last expression.
 *
 * @param condition The first condition.
 * @param consequent The first branch.
 * @param alternates The {@code elif} branches.
 * @param elseBranch The {@code else} branch.
 * @param loc The location of the keyword.
 */
public record IfExpressionNode(AstNode condition, BlockNode consequent, List<ConditionalBranchNode> alternates, BlockNode elseBranch, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(condition, consequent, alternates, elseBranch);
    }
}
