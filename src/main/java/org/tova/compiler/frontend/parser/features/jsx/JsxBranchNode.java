package org.tova.compiler.frontend.parser.features.jsx;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * An {@code elif} branch of a {@link JsxIfNode}.
 *
 * @param condition The branch condition.
 * @param children The children rendered when the condition holds.
 * @param loc The source location.
 */
public record JsxBranchNode(AstNode condition, List<AstNode> children, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(condition, children);
    }
}
