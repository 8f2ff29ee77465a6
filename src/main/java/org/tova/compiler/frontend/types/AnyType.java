package org.tova.compiler.frontend.types;

/** The explicit {@code Any} annotation. */
public record AnyType() implements Type {

    public static final AnyType INSTANCE = new AnyType();

    @Override
    public String display() {
        return "Any";
    }
}
