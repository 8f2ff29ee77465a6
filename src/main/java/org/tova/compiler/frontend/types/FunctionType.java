package org.tova.compiler.frontend.types;

import java.util.List;
import java.util.stream.Collectors;

/**
 * @param params The parameter types; unannotated parameters are {@link UnknownType}.
 * @param returnType The return type; unannotated returns are {@link UnknownType}.
 */
public record FunctionType(List<Type> params, Type returnType) implements Type {

    public FunctionType {
        params = List.copyOf(params);
    }

    @Override
    public String display() {
        return params.stream().map(Type::display).collect(Collectors.joining(", ", "fn(", ") -> ")) + returnType.display();
    }
}
