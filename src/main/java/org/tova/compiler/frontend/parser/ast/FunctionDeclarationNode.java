package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * A named function.
 *
 * @param name The function name.
 * @param typeParams Generic type parameter names.
 * @param params The parameters.
 * @param returnType The declared return type, or null.
 * @param body The body.
 * @param async True if declared {@code async}.
 * @param doc The preceding doc comment, or null.
 * @param loc The location of the {@code fn} keyword.
 */
public record FunctionDeclarationNode(String name, List<String> typeParams, List<ParameterNode> params, TypeAnnotationNode returnType, BlockNode body, boolean async, String doc, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(params, body);
    }
}
