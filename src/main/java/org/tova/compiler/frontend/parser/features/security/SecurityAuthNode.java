package org.tova.compiler.frontend.parser.features.security;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.ConfigFieldNode;

import java.util.List;

/**
 * {@code auth jwt { secret: env("JWT_SECRET") }}.
 *
 * @param authType The authentication scheme.
 * @param config Scheme settings.
 * @param loc The source location.
 */
public record SecurityAuthNode(String authType, List<ConfigFieldNode> config, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(config);
    }
}
