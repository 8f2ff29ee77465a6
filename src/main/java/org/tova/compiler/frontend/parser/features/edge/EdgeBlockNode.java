package org.tova.compiler.frontend.parser.features.edge;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * An {@code edge ["name"] { ... }} region compiled for a serverless edge platform.
 *
 * @param name The block name, or null for the default edge.
 * @param body Config fields, bindings, routes, middleware, schedules, consumers and statements.
 * @param loc The source location.
 */
public record EdgeBlockNode(String name, List<AstNode> body, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return body;
    }
}
