package org.tova.compiler.frontend.parser.features.security;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * {@code trust_proxy true}, {@code trust_proxy "loopback"}.
 *
 * @param value The proxy trust setting.
 * @param loc The source location.
 */
public record SecurityTrustProxyNode(AstNode value, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }
}
