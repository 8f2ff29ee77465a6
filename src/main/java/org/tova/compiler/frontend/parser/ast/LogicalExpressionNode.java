package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * A short-circuit {@code and}/{@code or}.
 *
 * @param operator {@link Operator#AND} or {@link Operator#OR}.
 * @param left The left operand.
 * @param right The right operand.
 * @param loc The location of the left operand.
 */
public record LogicalExpressionNode(Operator operator, AstNode left, AstNode right, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(left, right);
    }
}
