package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code for x[, y] in iterable { } [else { }]}. The else body runs when the iterable is empty.
 *
 * @param variables One or two loop variables.
 * @param iterable The iterated expression.
 * @param body The loop body.
 * @param elseBody The else body, or null.
 * @param loc The location of the keyword.
 */
public record ForNode(List<String> variables, AstNode iterable, BlockNode body, BlockNode elseBody, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(iterable, body, elseBody);
    }
}
