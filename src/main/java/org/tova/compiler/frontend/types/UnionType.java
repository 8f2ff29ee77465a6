package org.tova.compiler.frontend.types;

import java.util.List;
import java.util.stream.Collectors;

/**
 * @param members The alternatives; {@code T?} is the union of {@code T} and Nil.
 */
public record UnionType(List<Type> members) implements Type {

    public UnionType {
        members = List.copyOf(members);
    }

    /**
     * @return {@code true} if one member is Nil.
     */
    public boolean containsNil() {
        return members.stream().anyMatch(NilType.class::isInstance);
    }

    @Override
    public String display() {
        if (members.size() == 2 && containsNil()) {
            Type other = members.stream().filter(m -> !(m instanceof NilType)).findFirst().orElse(NilType.INSTANCE);
            return other.display() + "?";
        }
        return members.stream().map(Type::display).collect(Collectors.joining(" | "));
    }
}
