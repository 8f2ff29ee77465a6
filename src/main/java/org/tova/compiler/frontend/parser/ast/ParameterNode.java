package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * A function, lambda or component parameter.
 *
 * @param name The parameter name.
 * @param type The annotation, or null.
 * @param defaultValue The default value, or null.
 * @param loc The location of the name.
 */
public record ParameterNode(String name, TypeAnnotationNode type, AstNode defaultValue, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(defaultValue);
    }
}
