package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * One {@code pattern [if guard] => body} arm.
 *
 * @param pattern The pattern.
 * @param guard The guard, or null.
 * @param body An expression or a {@link BlockNode}.
 * @param loc The location of the pattern.
 */
public record MatchArmNode(AstNode pattern, AstNode guard, AstNode body, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(pattern, guard, body);
    }
}
