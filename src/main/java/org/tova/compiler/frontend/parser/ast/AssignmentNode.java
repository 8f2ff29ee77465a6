package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code x = value}: declares an immutable binding or assigns a member/index target.
 *
 * @param target An {@link IdentifierNode}, {@link MemberAccessNode} or {@link IndexAccessNode}.
 * @param value The assigned value.
 * @param loc The location of the target.
 */
public record AssignmentNode(AstNode target, AstNode value, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(target, value);
    }
}
