package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code [expr for x in xs if cond]}.
 *
 * @param expression The mapped expression.
 * @param variable The loop variable.
 * @param iterable The source collection.
 * @param condition The filter, or null.
 * @param loc The location of the bracket.
 */
public record ListComprehensionNode(AstNode expression, String variable, AstNode iterable, AstNode condition, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(iterable, condition, expression);
    }
}
