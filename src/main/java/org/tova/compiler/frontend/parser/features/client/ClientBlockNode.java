package org.tova.compiler.frontend.parser.features.client;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * A {@code client ["name"] { ... }} region, compiled to browser code.
 *
 * @param name The block name, or null for the default client.
 * @param body The statements of the block.
 * @param loc The source location.
 */
public record ClientBlockNode(String name, List<AstNode> body, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return body;
    }
}
