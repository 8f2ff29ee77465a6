package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * A function call. Named arguments appear as {@link NamedArgumentNode}s in {@code arguments}.
 *
 * @param callee The called expression.
 * @param arguments Positional and named arguments in source order.
 * @param loc The location of the callee.
 */
public record CallNode(AstNode callee, List<AstNode> arguments, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(callee, arguments);
    }
}
