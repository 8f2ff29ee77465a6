package org.tova.compiler.frontend.types;

/**
 * One of the four primitive types.
 *
 * @param name The Tova spelling.
 */
public record PrimitiveType(String name) implements Type {

    public static final PrimitiveType INT = new PrimitiveType("Int");
    public static final PrimitiveType FLOAT = new PrimitiveType("Float");
    public static final PrimitiveType STRING = new PrimitiveType("String");
    public static final PrimitiveType BOOL = new PrimitiveType("Bool");

    @Override
    public String display() {
        return name;
    }
}
