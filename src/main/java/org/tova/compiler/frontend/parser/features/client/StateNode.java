package org.tova.compiler.frontend.parser.features.client;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.TypeAnnotationNode;

import java.util.List;

/**
 * A reactive {@code state name = value} declaration.
 *
 * @param name The signal name.
 * @param type The optional annotation.
 * @param value The initial value.
 * @param loc The source location.
 */
public record StateNode(String name, TypeAnnotationNode type, AstNode value, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }
}
