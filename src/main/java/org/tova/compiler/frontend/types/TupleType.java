package org.tova.compiler.frontend.types;

import java.util.List;
import java.util.stream.Collectors;

/**
 * @param elements The member types in order.
 */
public record TupleType(List<Type> elements) implements Type {

    public TupleType {
        elements = List.copyOf(elements);
    }

    @Override
    public String display() {
        return elements.stream().map(Type::display).collect(Collectors.joining(", ", "(", ")"));
    }
}
