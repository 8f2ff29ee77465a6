package org.tova.compiler.frontend.parser.features.cli;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.BlockNode;

import java.util.List;

/**
 * One command: {@code fn add(name: String, --force: Bool) { ... }}.
 *
 * @param name The command name.
 * @param params Positional arguments and flags.
 * @param body The command body.
 * @param async Whether the command is {@code async}.
 * @param loc The source location.
 */
public record CliCommandNode(String name, List<CliParamNode> params, BlockNode body, boolean async, SourceInfo loc)
        implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(params, body);
    }
}
