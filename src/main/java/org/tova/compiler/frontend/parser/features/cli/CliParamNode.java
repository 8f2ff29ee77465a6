package org.tova.compiler.frontend.parser.features.cli;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * A command parameter.
 *
 * @param name The parameter name without dashes.
 * @param type The declared type name, {@code String} when absent.
 * @param defaultValue The default, or null.
 * @param flag Whether it is written {@code --name}.
 * @param optional Whether it may be omitted; true for Bool flags and defaulted parameters.
 * @param repeated Whether it was declared as a list {@code [Type]}.
 * @param loc The source location.
 */
public record CliParamNode(
        String name,
        String type,
        AstNode defaultValue,
        boolean flag,
        boolean optional,
        boolean repeated,
        SourceInfo loc
) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(defaultValue);
    }
}
