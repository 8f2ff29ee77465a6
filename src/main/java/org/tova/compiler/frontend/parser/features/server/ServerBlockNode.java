package org.tova.compiler.frontend.parser.features.server;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * A {@code server ["name"] { ... }} region.
 *
 * @param name The block name, or null for the default server.
 * @param body Routes, middleware, functions and statements.
 * @param loc The source location.
 */
public record ServerBlockNode(String name, List<AstNode> body, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return body;
    }
}
