package org.tova.compiler.frontend.parser.features.jsx;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * A conditional child: {@code if cond { ... } elif other { ... } else { ... }}.
 *
 * @param condition The first condition.
 * @param children Children of the first branch.
 * @param alternates The {@code elif} branches in order.
 * @param elseChildren Children of the {@code else} branch, or null.
 * @param loc The source location.
 */
public record JsxIfNode(
        AstNode condition,
        List<AstNode> children,
        List<JsxBranchNode> alternates,
        List<AstNode> elseChildren,
        SourceInfo loc
) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(condition, children, alternates, elseChildren);
    }
}
