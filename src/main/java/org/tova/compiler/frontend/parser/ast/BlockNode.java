package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * A braced statement list.
 *
 * @param statements The statements in source order.
 * @param loc The location of the opening brace.
 */
public record BlockNode(List<AstNode> statements, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return statements;
    }
}
