package org.tova.compiler.frontend.parser.features.shared;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * A {@code shared { ... }} region whose code is visible to every target.
 *
 * @param name The block name, or null.
 * @param body The statements.
 * @param loc The source location.
 */
public record SharedBlockNode(String name, List<AstNode> body, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return body;
    }
}
