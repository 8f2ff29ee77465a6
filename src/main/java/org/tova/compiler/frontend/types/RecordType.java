package org.tova.compiler.frontend.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A declared product type: {@code type User { name: String, age: Int }}.
 *
 * @param name The type name.
 * @param fields Field name to field type, in declaration order.
 */
public record RecordType(String name, Map<String, Type> fields) implements Type {

    public RecordType {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    @Override
    public String display() {
        return name;
    }
}
