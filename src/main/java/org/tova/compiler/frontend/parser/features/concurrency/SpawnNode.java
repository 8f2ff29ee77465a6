package org.tova.compiler.frontend.parser.features.concurrency;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * {@code spawn expr}: runs the expression as a concurrent task.
 *
 * @param expression The spawned call.
 * @param loc The source location.
 */
public record SpawnNode(AstNode expression, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
