package org.tova.compiler.frontend.types;

/**
 * A static type in the gradual type model.
 * The hierarchy is closed; Unknown and Any are compatible with every other type in both directions.
 */
public sealed interface Type
        permits PrimitiveType, NilType, AnyType, UnknownType, ArrayType, TupleType, FunctionType,
                RecordType, AdtType, GenericType, TypeVariable, UnionType {

    /**
     * @return The display form used in diagnostics, e.g. {@code Int}, {@code [String]}, {@code Result<Int, String>}.
     */
    String display();

    /**
     * @param target The type a value of this type flows into.
     * @return {@code true} if the assignment is allowed.
     */
    default boolean isAssignableTo(Type target) {
        return TypeCompatibility.isAssignable(this, target);
    }

    /**
     * @return {@code false} for Unknown, Any and unresolved type variables.
     */
    default boolean isKnown() {
        return !(this instanceof UnknownType || this instanceof AnyType || this instanceof TypeVariable);
    }

    /**
     * @return {@code true} for Int and Float.
     */
    default boolean isNumeric() {
        return this == PrimitiveType.INT || this == PrimitiveType.FLOAT;
    }
}
