package org.tova.compiler.frontend.parser.features.deploy;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * A {@code db { ... }} section listing the database engines of a deployment.
 *
 * @param engines The engines in source order.
 * @param loc The source location.
 */
public record DeployDatabasesNode(List<DeployDbNode> engines, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(engines);
    }
}
