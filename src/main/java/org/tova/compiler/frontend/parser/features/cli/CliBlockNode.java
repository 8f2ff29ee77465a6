package org.tova.compiler.frontend.parser.features.cli;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.ConfigFieldNode;

import java.util.List;

/**
 * A {@code cli { ... }} block that compiles to a command line program.
 *
 * @param config {@code name}, {@code version} and {@code description} fields.
 * @param commands The commands.
 * @param loc The source location.
 */
public record CliBlockNode(List<ConfigFieldNode> config, List<CliCommandNode> commands, SourceInfo loc)
        implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(config, commands);
    }
}
