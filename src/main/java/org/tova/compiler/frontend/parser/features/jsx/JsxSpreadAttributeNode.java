package org.tova.compiler.frontend.parser.features.jsx;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * A {@code {...props}} attribute.
 *
 * @param expression The spread object.
 * @param loc The source location.
 */
public record JsxSpreadAttributeNode(AstNode expression, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
