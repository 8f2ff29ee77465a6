package org.tova.compiler.frontend.parser.features.client;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * A {@code store Name { state/computed/fn }} grouping shared reactive state.
 *
 * @param name The store name.
 * @param body The members.
 * @param loc The source location.
 */
public record StoreNode(String name, List<AstNode> body, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return body;
    }
}
