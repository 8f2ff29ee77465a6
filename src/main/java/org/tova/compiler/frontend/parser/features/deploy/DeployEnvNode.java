package org.tova.compiler.frontend.parser.features.deploy;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.ConfigFieldNode;

import java.util.List;

/**
 * {@code env { KEY: value, ... }} inside a deploy block.
 *
 * @param entries The environment variables.
 * @param loc The source location.
 */
public record DeployEnvNode(List<ConfigFieldNode> entries, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(entries);
    }
}
