package org.tova.compiler.frontend.types;

import java.util.List;

/**
 * The assignability lattice of the gradual type model.
 */
public final class TypeCompatibility {

    private TypeCompatibility() {}

    /**
     * @param source The type of the value.
     * @param target The type of the slot receiving the value.
     * @return {@code true} if a value of {@code source} may flow into {@code target}.
     */
    public static boolean isAssignable(Type source, Type target) {
        if (!source.isKnown() || !target.isKnown()) return true;
        if (source.equals(target)) return true;
        if (source == PrimitiveType.INT && target == PrimitiveType.FLOAT) return true;
        if (source instanceof NilType) return target instanceof NilType || isOptionShaped(target);

        if (target instanceof UnionType union) {
            if (source instanceof UnionType sourceUnion) {
                return sourceUnion.members().stream().allMatch(m -> isAssignable(m, union));
            }
            return union.members().stream().anyMatch(m -> isAssignable(source, m));
        }
        if (source instanceof UnionType union) {
            return union.members().stream().allMatch(m -> isAssignable(m, target));
        }

        if (source instanceof ArrayType a && target instanceof ArrayType b) {
            return isAssignable(a.element(), b.element());
        }
        if (source instanceof TupleType a && target instanceof TupleType b) {
            return pairwise(a.elements(), b.elements());
        }
        if (source instanceof FunctionType a && target instanceof FunctionType b) {
            if (a.params().size() != b.params().size()) return false;
            // Parameters are contravariant.
            return pairwise(b.params(), a.params()) && isAssignable(a.returnType(), b.returnType());
        }
        if (source instanceof GenericType a && target instanceof GenericType b) {
            if (!a.name().equals(b.name())) return false;
            if (a.typeArgs().isEmpty() || b.typeArgs().isEmpty()) return true;
            return pairwise(a.typeArgs(), b.typeArgs());
        }

        String sourceName = nominalName(source);
        return sourceName != null && sourceName.equals(nominalName(target));
    }

    /**
     * @param type A type.
     * @return {@code true} for {@code Option<T>}, an ADT named Option and unions containing Nil.
     */
    public static boolean isOptionShaped(Type type) {
        if (type instanceof UnionType union) return union.containsNil();
        return "Option".equals(nominalName(type));
    }

    /**
     * @param type A type.
     * @return The declared name of a nominal type (ADT, record or generic), otherwise {@code null}.
     */
    public static String nominalName(Type type) {
        if (type instanceof AdtType adt) return adt.name();
        if (type instanceof RecordType record) return record.name();
        if (type instanceof GenericType generic) return generic.name();
        return null;
    }

    private static boolean pairwise(List<Type> sources, List<Type> targets) {
        if (sources.size() != targets.size()) return false;
        for (int i = 0; i < sources.size(); i++) {
            if (!isAssignable(sources.get(i), targets.get(i))) return false;
        }
        return true;
    }
}
