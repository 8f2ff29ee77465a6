package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code left |> right}.
 *
 * @param left The piped value.
 * @param right The receiving call, function or {@code .method()}.
 * @param loc The location of the left side.
 */
public record PipeNode(AstNode left, AstNode right, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(left, right);
    }
}
