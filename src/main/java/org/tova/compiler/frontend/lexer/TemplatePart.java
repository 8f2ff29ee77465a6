package org.tova.compiler.frontend.lexer;

import java.util.List;

/**
 * One segment of an interpolated string.
 *
 * @param kind   Whether the segment is literal text or an embedded expression.
 * @param text   The unescaped text for {@link Kind#TEXT}, the raw expression source for {@link Kind#EXPR}.
 * @param tokens The sub-token run of an expression segment (without END_OF_FILE); empty for text.
 */
public record TemplatePart(Kind kind, String text, List<Token> tokens) {

    /**
     * The kind of template segment.
     */
    public enum Kind { TEXT, EXPR }

    /**
     * @param text The unescaped literal text.
     * @return A text segment.
     */
    public static TemplatePart text(String text) {
        return new TemplatePart(Kind.TEXT, text, List.of());
    }

    /**
     * @param source The raw expression source.
     * @param tokens The expression tokens.
     * @return An expression segment.
     */
    public static TemplatePart expr(String source, List<Token> tokens) {
        return new TemplatePart(Kind.EXPR, source, List.copyOf(tokens));
    }
}
