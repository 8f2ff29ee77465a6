package org.tova.compiler.frontend.parser.features.deploy;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * A {@code deploy "name" { ... }} block describing one deployment target.
 *
 * @param name The environment name, e.g. {@code prod}.
 * @param body {@link org.tova.compiler.frontend.parser.ast.ConfigFieldNode}s, {@link DeployEnvNode}s and {@link DeployDatabasesNode}s.
 * @param loc The source location.
 */
public record DeployBlockNode(String name, List<AstNode> body, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return body;
    }
}
