package org.tova.compiler.frontend.types;

/**
 * A declared type parameter such as {@code T}.
 *
 * @param name The parameter name.
 */
public record TypeVariable(String name) implements Type {

    @Override
    public String display() {
        return name;
    }
}
