package org.tova.compiler.frontend.semantics;

import org.tova.compiler.frontend.types.PrimitiveType;
import org.tova.compiler.frontend.types.Type;
import org.tova.compiler.frontend.types.TypeCompatibility;
import org.tova.compiler.internal.i18n.Messages;

/**
 * Suggests the call that converts a value of one type into another.
 */
public final class ConversionHints {

    private ConversionHints() {}

    /**
     * @param expected The type the slot requires.
     * @param actual The type of the value.
     * @return The hint text, or {@code null} when no conversion is known.
     */
    public static String hint(Type expected, Type actual) {
        if (actual == PrimitiveType.STRING && expected == PrimitiveType.INT) return Messages.get("hint.parse.int");
        if (actual == PrimitiveType.STRING && expected == PrimitiveType.FLOAT) return Messages.get("hint.parse.float");
        if (actual == PrimitiveType.FLOAT && expected == PrimitiveType.INT) return Messages.get("hint.float.int");
        if (expected == PrimitiveType.STRING) return Messages.get("hint.to.string");
        String name = TypeCompatibility.nominalName(expected);
        if ("Result".equals(name)) return Messages.get("hint.wrap.ok");
        if ("Option".equals(name) || TypeCompatibility.isOptionShaped(expected)) return Messages.get("hint.wrap.some");
        return null;
    }
}
