package org.tova.compiler.frontend.parser.features.client;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * A derived {@code computed name = expression} value.
 *
 * @param name The binding name.
 * @param value The derivation.
 * @param loc The source location.
 */
public record ComputedNode(String name, AstNode value, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }
}
