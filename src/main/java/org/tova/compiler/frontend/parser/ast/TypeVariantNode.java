package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * One ADT variant, {@code Name} or {@code Name(field: Type, ...)}.
 *
 * @param name The variant name.
 * @param fields The payload fields.
 * @param loc The location of the name.
 */
public record TypeVariantNode(String name, List<TypeFieldNode> fields, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(fields);
    }
}
