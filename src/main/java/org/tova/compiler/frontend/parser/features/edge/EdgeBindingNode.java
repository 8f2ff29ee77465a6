package org.tova.compiler.frontend.parser.features.edge;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.ConfigFieldNode;

import java.util.List;

/**
 * A platform resource binding: {@code kv CACHE}, {@code sql DB}, {@code storage FILES}, {@code queue JOBS}.
 *
 * @param kind One of {@code kv}, {@code sql}, {@code storage}, {@code queue}.
 * @param name The binding name.
 * @param config Optional binding configuration.
 * @param loc The source location.
 */
public record EdgeBindingNode(String kind, String name, List<ConfigFieldNode> config, SourceInfo loc)
        implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(config);
    }
}
