package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * An interpolated string.
 *
 * @param segments Text and expression segments in source order.
 * @param loc The source location.
 */
public record TemplateLiteralNode(List<Segment> segments, SourceInfo loc) implements AstNode {

    /**
     * One segment; exactly one of {@code text} and {@code expression} is non-null.
     *
     * @param text Literal text, or null.
     * @param expression Embedded expression, or null.
     */
    public record Segment(String text, AstNode expression) {
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(segments.stream().map(Segment::expression).toList());
    }
}
