package org.tova.compiler.frontend.parser.features.security;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.ConfigFieldNode;

import java.util.List;

/**
 * {@code protect "/api/admin/*" { require: Admin }}.
 *
 * @param pattern The route pattern; a trailing {@code *} matches any suffix.
 * @param config Rule settings such as {@code require} and {@code rate_limit}.
 * @param loc The source location.
 */
public record SecurityProtectNode(String pattern, List<ConfigFieldNode> config, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(config);
    }
}
