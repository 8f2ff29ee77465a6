package org.tova.compiler.frontend.types;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An applied generic such as {@code Result<Int, String>}.
 *
 * @param name The base name.
 * @param typeArgs The type arguments; may be empty when the arguments are not known.
 */
public record GenericType(String name, List<Type> typeArgs) implements Type {

    public GenericType {
        typeArgs = List.copyOf(typeArgs);
    }

    @Override
    public String display() {
        if (typeArgs.isEmpty()) return name;
        return typeArgs.stream().map(Type::display).collect(Collectors.joining(", ", name + "<", ">"));
    }
}
