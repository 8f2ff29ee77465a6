package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * A {@code type} declaration: an ADT when it has variants, a record when it has fields.
 *
 * @param name The type name.
 * @param typeParams Generic parameter names.
 * @param variants The variants of an ADT.
 * @param fields The fields of a record type.
 * @param derives Traits from {@code derive(...)}.
 * @param loc The location of the keyword.
 */
public record TypeDeclarationNode(String name, List<String> typeParams, List<TypeVariantNode> variants, List<TypeFieldNode> fields, List<String> derives, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(variants, fields);
    }
}
