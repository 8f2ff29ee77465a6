package org.tova.compiler.frontend.parser.features.deploy;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.ConfigFieldNode;

import java.util.List;

/**
 * One database engine inside {@code db { engine { ... } }}.
 *
 * @param engine The engine name, e.g. {@code postgres}.
 * @param fields The engine settings.
 * @param loc The source location.
 */
public record DeployDbNode(String engine, List<ConfigFieldNode> fields, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(fields);
    }
}
