package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code Name} or {@code Name(p1, p2)} matching an ADT variant by tag.
 *
 * @param name The variant name.
 * @param fields Sub-patterns for the payload fields, positionally.
 * @param loc The source location.
 */
public record VariantPatternNode(String name, List<AstNode> fields, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(fields);
    }
}
