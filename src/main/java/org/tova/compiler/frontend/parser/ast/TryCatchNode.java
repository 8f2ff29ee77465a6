package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code try { } catch e { } finally { }}.
 *
 * @param tryBody The protected body.
 * @param catchParam The error binding, or null.
 * @param catchBody The handler, or null.
 * @param finallyBody The finalizer, or null.
 * @param loc The location of the keyword.
 */
public record TryCatchNode(BlockNode tryBody, String catchParam, BlockNode catchBody, BlockNode finallyBody, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(tryBody, catchBody, finallyBody);
    }
}
