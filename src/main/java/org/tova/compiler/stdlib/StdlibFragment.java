package org.tova.compiler.stdlib;

import java.util.List;

/**
 * One tree-shakable piece of the Tova runtime.
 *
 * @param name The fragment name; for functions and namespaces also the JS binding it declares.
 * @param kind What the fragment declares.
 * @param dependencies Fragments that must be emitted before this one.
 * @param provides Names the fragment binds besides its own name.
 * @param code The JavaScript source.
 */
public record StdlibFragment(String name, Kind kind, List<String> dependencies, List<String> provides, String code) {

    public StdlibFragment {
        dependencies = List.copyOf(dependencies);
        provides = List.copyOf(provides);
    }

    /** What a fragment declares. */
    public enum Kind {
        /** Compiler-internal helper such as {@code __propagate}. Never visible to user code. */
        HELPER,
        /** A runtime class. */
        CLASS,
        /** A free builtin function. */
        FUNCTION,
        /** A frozen namespace object such as {@code math}. */
        NAMESPACE
    }

    /**
     * @return {@code true} if user code can refer to the fragment by name.
     */
    public boolean isUserVisible() {
        return kind != Kind.HELPER;
    }
}
