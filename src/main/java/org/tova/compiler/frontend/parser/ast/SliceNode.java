package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code obj[start:end:step]}; each bound may be null.
 *
 * @param object The sliced object.
 * @param start The start bound, or null.
 * @param end The end bound, or null.
 * @param step The step, or null.
 * @param loc The location of the object.
 */
public record SliceNode(AstNode object, AstNode start, AstNode end, AstNode step, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(object, start, end, step);
    }
}
