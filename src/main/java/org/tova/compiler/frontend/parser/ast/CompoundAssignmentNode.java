package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code x += value} and friends.
 *
 * @param target The updated target.
 * @param operator The arithmetic operator.
 * @param value The operand.
 * @param loc The location of the target.
 */
public record CompoundAssignmentNode(AstNode target, Operator operator, AstNode value, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(target, value);
    }
}
