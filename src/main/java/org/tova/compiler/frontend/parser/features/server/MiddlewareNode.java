package org.tova.compiler.frontend.parser.features.server;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.FunctionDeclarationNode;

import java.util.List;

/**
 * {@code middleware fn name(req, next) { ... }}.
 *
 * @param function The middleware function.
 * @param loc The source location.
 */
public record MiddlewareNode(FunctionDeclarationNode function, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(function);
    }
}
