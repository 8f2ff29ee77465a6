package org.tova.compiler.frontend.parser.features.edge;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * {@code env NAME [= default]}.
 *
 * @param name The variable name.
 * @param defaultValue The fallback, or null.
 * @param loc The source location.
 */
public record EdgeEnvNode(String name, AstNode defaultValue, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(defaultValue);
    }
}
