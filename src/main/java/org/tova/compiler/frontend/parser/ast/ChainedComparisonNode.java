package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code a < b < c}: n operands joined by n-1 comparison operators.
 *
 * @param operands The compared expressions.
 * @param operators The operators between consecutive operands.
 * @param loc The location of the first operand.
 */
public record ChainedComparisonNode(List<AstNode> operands, List<Operator> operators, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(operands);
    }
}
