package org.tova.compiler.frontend.parser.features.edge;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * {@code consume QUEUE handler}: processes batches from a queue binding.
 *
 * @param queue The queue binding name.
 * @param handler The handler expression.
 * @param loc The source location.
 */
public record EdgeConsumeNode(String queue, AstNode handler, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(handler);
    }
}
