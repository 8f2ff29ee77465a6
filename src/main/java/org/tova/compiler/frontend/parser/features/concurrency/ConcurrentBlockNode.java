package org.tova.compiler.frontend.parser.features.concurrency;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.BlockNode;

import java.util.List;

/**
 * {@code concurrent [mode] [timeout(ms)] { ... }}.
 *
 * @param mode {@code all}, {@code cancel_on_error} or {@code first}.
 * @param timeout The timeout in milliseconds, or null.
 * @param body Statements, typically {@code x = spawn f()} assignments.
 * @param loc The source location.
 */
public record ConcurrentBlockNode(String mode, AstNode timeout, BlockNode body, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(timeout, body);
    }
}
