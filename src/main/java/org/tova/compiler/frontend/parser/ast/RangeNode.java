package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code a..b} or {@code a..=b}.
 *
 * @param start The first value.
 * @param end The bound.
 * @param inclusive True for {@code ..=}.
 * @param loc The location of the start.
 */
public record RangeNode(AstNode start, AstNode end, boolean inclusive, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(start, end);
    }
}
