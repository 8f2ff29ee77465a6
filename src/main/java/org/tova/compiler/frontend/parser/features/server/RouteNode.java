package org.tova.compiler.frontend.parser.features.server;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * {@code route GET "/users/:id" => handler}.
 *
 * @param method The upper-case HTTP method.
 * @param path The path pattern; {@code :name} segments are parameters.
 * @param handler The handler expression.
 * @param loc The source location.
 */
public record RouteNode(String method, String path, AstNode handler, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(handler);
    }
}
