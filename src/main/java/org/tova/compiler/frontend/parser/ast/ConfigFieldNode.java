package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * A {@code key: value} entry of a configuration block (deploy, edge, security, cli).
 *
 * @param key The configuration key.
 * @param value The value expression.
 * @param loc The location of the key.
 */
public record ConfigFieldNode(String key, AstNode value, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }
}
