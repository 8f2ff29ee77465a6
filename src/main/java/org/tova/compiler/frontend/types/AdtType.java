package org.tova.compiler.frontend.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A declared sum type: {@code type Shape { Circle(r: Float), Square(side: Float) }}.
 *
 * @param name The type name.
 * @param typeParams The declared type parameters.
 * @param variants Variant name to its fields (name to type), in declaration order.
 */
public record AdtType(String name, List<String> typeParams, Map<String, Map<String, Type>> variants) implements Type {

    public AdtType {
        typeParams = List.copyOf(typeParams);
        variants = Collections.unmodifiableMap(new LinkedHashMap<>(variants));
    }

    /**
     * @param variant A variant name.
     * @return {@code true} if this type declares the variant.
     */
    public boolean hasVariant(String variant) {
        return variants.containsKey(variant);
    }

    @Override
    public String display() {
        return typeParams.isEmpty() ? name : name + "<" + String.join(", ", typeParams) + ">";
    }
}
