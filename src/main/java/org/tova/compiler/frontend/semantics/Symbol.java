package org.tova.compiler.frontend.semantics;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.types.Type;
import org.tova.compiler.frontend.types.UnknownType;

import java.util.List;

/**
 * Represents a single named binding in the symbol table.
 *
 * @param name The name of the binding.
 * @param kind The kind of binding.
 * @param type The declared or inferred type.
 * @param mutable {@code true} for {@code var} and {@code state} bindings.
 * @param params Parameter names for functions, components and variant constructors; empty otherwise.
 * @param loc Where the binding was declared.
 */
public record Symbol(String name, Kind kind, Type type, boolean mutable, List<String> params, SourceInfo loc) {

    public Symbol {
        params = params == null ? List.of() : List.copyOf(params);
        if (type == null) type = UnknownType.INSTANCE;
    }

    /**
     * Defines the kind of symbol.
     */
    public enum Kind {
        VARIABLE,
        PARAMETER,
        FUNCTION,
        TYPE,
        VARIANT,
        STATE,
        COMPUTED,
        COMPONENT,
        STORE,
        IMPORT
    }

    /**
     * @param name The name.
     * @param type The inferred type.
     * @param loc The declaration site.
     * @return An immutable variable binding.
     */
    public static Symbol variable(String name, Type type, SourceInfo loc) {
        return new Symbol(name, Kind.VARIABLE, type, false, List.of(), loc);
    }

    /**
     * @param name The name.
     * @param type The declared or inferred type.
     * @param loc The declaration site.
     * @return A mutable ({@code var}) binding.
     */
    public static Symbol mutableVariable(String name, Type type, SourceInfo loc) {
        return new Symbol(name, Kind.VARIABLE, type, true, List.of(), loc);
    }
}
