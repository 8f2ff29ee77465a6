package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * A parsed type annotation. Annotations are not visited as children.
 *
 * @param kind The annotation shape.
 * @param name The type name for {@link Kind#NAMED}, otherwise null.
 * @param arguments Type arguments, the element type, tuple members, function parameters or the wrapped type.
 * @param returnType The return type of a {@link Kind#FUNCTION} annotation, otherwise null.
 * @param loc The source location.
 */
public record TypeAnnotationNode(
        Kind kind,
        String name,
        List<TypeAnnotationNode> arguments,
        TypeAnnotationNode returnType,
        SourceInfo loc
) implements AstNode {

    /** The shape of an annotation. */
    public enum Kind {
        /** {@code Int}, {@code Result<T, E>}. */
        NAMED,
        /** {@code [T]}. */
        ARRAY,
        /** {@code (A, B)}. */
        TUPLE,
        /** {@code fn(A) -> B}. */
        FUNCTION,
        /** {@code T?}. */
        OPTIONAL
    }

    /**
     * @param name The type name.
     * @param loc The source location.
     * @return A named annotation without type arguments.
     */
    public static TypeAnnotationNode named(String name, SourceInfo loc) {
        return new TypeAnnotationNode(Kind.NAMED, name, List.of(), null, loc);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NAMED -> arguments.isEmpty() ? name
                    : name + "<" + String.join(", ", arguments.stream().map(TypeAnnotationNode::toString).toList()) + ">";
            case ARRAY -> "[" + arguments.get(0) + "]";
            case TUPLE -> "(" + String.join(", ", arguments.stream().map(TypeAnnotationNode::toString).toList()) + ")";
            case FUNCTION -> "fn(" + String.join(", ", arguments.stream().map(TypeAnnotationNode::toString).toList())
                    + ") -> " + returnType;
            case OPTIONAL -> arguments.get(0) + "?";
        };
    }
}
