package org.tova.compiler.frontend.parser.features.select;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * {@code select { case ... => ... }}: waits for the first ready channel operation.
 *
 * @param cases The arms in source order.
 * @param loc The source location.
 */
public record SelectNode(List<SelectCaseNode> cases, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(cases);
    }
}
