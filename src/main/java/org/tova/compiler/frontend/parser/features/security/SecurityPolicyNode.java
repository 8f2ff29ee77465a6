package org.tova.compiler.frontend.parser.features.security;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.ConfigFieldNode;

import java.util.List;

/**
 * A global policy: {@code cors}, {@code csp}, {@code rate_limit}, {@code csrf}, {@code audit} or {@code hsts}.
 *
 * @param kind The policy keyword.
 * @param config The settings.
 * @param loc The source location.
 */
public record SecurityPolicyNode(String kind, List<ConfigFieldNode> config, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(config);
    }
}
