package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * A {@code name: value} call argument.
 *
 * @param name The parameter name.
 * @param value The argument value.
 * @param loc The location of the name.
 */
public record NamedArgumentNode(String name, AstNode value, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(value);
    }
}
