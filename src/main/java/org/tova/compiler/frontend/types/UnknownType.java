package org.tova.compiler.frontend.types;

/** The type of anything the analyzer cannot infer. Suppresses type diagnostics. */
public record UnknownType() implements Type {

    public static final UnknownType INSTANCE = new UnknownType();

    @Override
    public String display() {
        return "Unknown";
    }
}
