package org.tova.compiler.frontend.parser.features.jsx;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * A {@code {expr}} child.
 *
 * @param expression The embedded expression.
 * @param loc The source location.
 */
public record JsxExpressionNode(AstNode expression, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
