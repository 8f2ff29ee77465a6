package org.tova.compiler.frontend.types;

/**
 * @param element The element type.
 */
public record ArrayType(Type element) implements Type {

    @Override
    public String display() {
        return "[" + element.display() + "]";
    }
}
