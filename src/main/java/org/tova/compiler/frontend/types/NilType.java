package org.tova.compiler.frontend.types;

/** The type of {@code nil}. */
public record NilType() implements Type {

    public static final NilType INSTANCE = new NilType();

    @Override
    public String display() {
        return "Nil";
    }
}
