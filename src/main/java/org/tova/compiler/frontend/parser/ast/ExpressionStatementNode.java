package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * An expression evaluated for its effect or as an implicit return value.
 *
 * @param expression The expression.
 * @param loc The location of the expression.
 */
public record ExpressionStatementNode(AstNode expression, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(expression);
    }
}
