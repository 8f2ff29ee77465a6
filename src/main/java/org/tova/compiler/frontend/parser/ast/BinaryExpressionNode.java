package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * An arithmetic, comparison or coalescing operation.
 *
 * @param operator The operator tag.
 * @param left The left operand.
 * @param right The right operand.
 * @param loc The location of the left operand.
 */
public record BinaryExpressionNode(Operator operator, AstNode left, AstNode right, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(left, right);
    }
}
