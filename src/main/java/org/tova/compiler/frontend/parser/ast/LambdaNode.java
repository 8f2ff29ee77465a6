package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * An anonymous function. The body is either a {@link BlockNode} or a single expression.
 *
 * @param params The parameters.
 * @param body The body.
 * @param async True if declared {@code async}.
 * @param loc The location of the lambda.
 */
public record LambdaNode(List<ParameterNode> params, AstNode body, boolean async, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(params, body);
    }
}
