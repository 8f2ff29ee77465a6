package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * A {@code match} expression.
 *
 * @param subject The matched value.
 * @param arms The arms in source order.
 * @param loc The location of the {@code match} keyword.
 */
public record MatchNode(AstNode subject, List<MatchArmNode> arms, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(subject, arms);
    }
}
