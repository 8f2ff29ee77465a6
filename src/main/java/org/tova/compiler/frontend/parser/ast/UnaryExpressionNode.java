package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * Negation or logical not.
 *
 * @param operator {@link Operator#NEGATE} or {@link Operator#NOT}.
 * @param operand The operand.
 * @param loc The location of the operator.
 */
public record UnaryExpressionNode(Operator operator, AstNode operand, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(operand);
    }
}
