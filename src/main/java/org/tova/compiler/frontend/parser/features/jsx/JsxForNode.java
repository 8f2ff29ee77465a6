package org.tova.compiler.frontend.parser.features.jsx;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * A loop child: {@code for item in items { <li>{item}</li> }}.
 *
 * @param variables One or two loop variables.
 * @param iterable The iterated expression.
 * @param children Children rendered per element.
 * @param loc The source location.
 */
public record JsxForNode(List<String> variables, AstNode iterable, List<AstNode> children, SourceInfo loc)
        implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(iterable, children);
    }
}
