package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code expr?}: unwraps Ok/Some or returns the failure from the enclosing function.
 *
 * @param expression The Result or Option expression.
 * @param loc The location of the expression.
 */
public record PropagateNode(AstNode expression, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(expression);
    }
}
