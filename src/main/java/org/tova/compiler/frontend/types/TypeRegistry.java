package org.tova.compiler.frontend.types;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declared nominal types of one compilation, plus the built-in Result and Option.
 * Variant names map back to every ADT that declares them.
 */
public class TypeRegistry {

    private final Map<String, Type> types = new LinkedHashMap<>();
    private final Map<String, List<AdtType>> variantOwners = new LinkedHashMap<>();

    /**
     * Creates a registry holding the built-in {@code Result} and {@code Option} types.
     */
    public TypeRegistry() {
        Map<String, Map<String, Type>> result = new LinkedHashMap<>();
        result.put("Ok", Map.of("value", new TypeVariable("T")));
        result.put("Err", Map.of("error", new TypeVariable("E")));
        register(new AdtType("Result", List.of("T", "E"), result));

        Map<String, Map<String, Type>> option = new LinkedHashMap<>();
        option.put("Some", Map.of("value", new TypeVariable("T")));
        option.put("None", Map.of());
        register(new AdtType("Option", List.of("T"), option));
    }

    /**
     * Registers an ADT or record. A later registration under the same name replaces the earlier one.
     * @param type The declared type.
     */
    public void register(Type type) {
        String name = TypeCompatibility.nominalName(type);
        if (name == null) throw new IllegalArgumentException("Only nominal types can be registered: " + type.display());
        types.put(name, type);
        if (type instanceof AdtType adt) {
            for (String variant : adt.variants().keySet()) {
                List<AdtType> owners = variantOwners.computeIfAbsent(variant, k -> new ArrayList<>());
                owners.removeIf(o -> o.name().equals(adt.name()));
                owners.add(adt);
            }
        }
    }

    /**
     * @param name A type name.
     * @return The declared type, if any.
     */
    public Optional<Type> get(String name) {
        return Optional.ofNullable(types.get(name));
    }

    /**
     * @param name A type name.
     * @return The ADT with that name, if one is declared.
     */
    public Optional<AdtType> getAdt(String name) {
        return get(name).filter(AdtType.class::isInstance).map(AdtType.class::cast);
    }

    /**
     * @param variant A variant name.
     * @return Every ADT declaring the variant, in registration order.
     */
    public List<AdtType> ownersOf(String variant) {
        return List.copyOf(variantOwners.getOrDefault(variant, List.of()));
    }

    /**
     * @return All declared ADTs, built-ins first.
     */
    public List<AdtType> adts() {
        return types.values().stream().filter(AdtType.class::isInstance).map(AdtType.class::cast).toList();
    }
}
