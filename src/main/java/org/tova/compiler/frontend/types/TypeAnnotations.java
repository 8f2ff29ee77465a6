package org.tova.compiler.frontend.types;

import org.tova.compiler.frontend.parser.ast.TypeAnnotationNode;

import java.util.List;
import java.util.Set;

/**
 * Converts parsed type annotations into {@link Type}s.
 */
public final class TypeAnnotations {

    private TypeAnnotations() {}

    /**
     * @param annotation The annotation, may be {@code null}.
     * @param typeParams The type parameters in scope.
     * @param registry The declared types.
     * @return The resolved type; {@link UnknownType} for a missing annotation or an unknown name.
     */
    public static Type resolve(TypeAnnotationNode annotation, Set<String> typeParams, TypeRegistry registry) {
        if (annotation == null) return UnknownType.INSTANCE;
        return switch (annotation.kind()) {
            case NAMED -> named(annotation, typeParams, registry);
            case ARRAY -> new ArrayType(resolve(annotation.arguments().get(0), typeParams, registry));
            case TUPLE -> new TupleType(resolveAll(annotation.arguments(), typeParams, registry));
            case FUNCTION -> new FunctionType(resolveAll(annotation.arguments(), typeParams, registry),
                    resolve(annotation.returnType(), typeParams, registry));
            case OPTIONAL -> new UnionType(List.of(resolve(annotation.arguments().get(0), typeParams, registry),
                    NilType.INSTANCE));
        };
    }

    private static Type named(TypeAnnotationNode annotation, Set<String> typeParams, TypeRegistry registry) {
        String name = annotation.name();
        switch (name) {
            case "Int": return PrimitiveType.INT;
            case "Float": return PrimitiveType.FLOAT;
            case "String": return PrimitiveType.STRING;
            case "Bool": return PrimitiveType.BOOL;
            case "Nil": return NilType.INSTANCE;
            case "Any": return AnyType.INSTANCE;
            default: break;
        }
        if (typeParams.contains(name)) return new TypeVariable(name);
        if (!annotation.arguments().isEmpty()) {
            return new GenericType(name, resolveAll(annotation.arguments(), typeParams, registry));
        }
        return registry.get(name).orElse(UnknownType.INSTANCE);
    }

    private static List<Type> resolveAll(List<TypeAnnotationNode> annotations, Set<String> typeParams, TypeRegistry registry) {
        return annotations.stream().map(a -> resolve(a, typeParams, registry)).toList();
    }
}
