package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code var name[: Type] = value}: a mutable binding.
 *
 * @param name The binding name.
 * @param type The annotation, or null.
 * @param value The initializer.
 * @param loc The location of the keyword.
 */
public record VarDeclarationNode(String name, TypeAnnotationNode type, AstNode value, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(value);
    }
}
