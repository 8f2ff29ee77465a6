package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code await expr}.
 *
 * @param argument The awaited expression.
 * @param loc The location of the keyword.
 */
public record AwaitNode(AstNode argument, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(argument);
    }
}
