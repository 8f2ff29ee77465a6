package org.tova.compiler.frontend.parser.features.client;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.ParameterNode;

import java.util.List;

/**
 * A {@code component Name(props) { ... }} declaration. JSX expression statements in the body
 * form the rendered output.
 *
 * @param name The component name.
 * @param params The props.
 * @param body Client statements and JSX.
 * @param loc The source location.
 */
public record ComponentNode(String name, List<ParameterNode> params, List<AstNode> body, SourceInfo loc)
        implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(params, body);
    }
}
