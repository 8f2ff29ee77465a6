package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * The root of a parsed Tova file.
 *
 * @param body The top-level statements and blocks in source order.
 * @param loc The location of the first token.
 */
public record ProgramNode(List<AstNode> body, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return body;
    }
}
