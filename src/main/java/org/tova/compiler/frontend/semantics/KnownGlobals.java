package org.tova.compiler.frontend.semantics;

import org.tova.compiler.stdlib.StdlibRegistry;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Names that are always in scope: runtime builtins, Tova runtime objects and the JS platform globals
 * the generated code may touch.
 */
public final class KnownGlobals {

    private static final Set<String> JS_GLOBALS = Set.of(
            "console", "document", "window", "globalThis", "self",
            "JSON", "Math", "Date", "RegExp", "Error", "TypeError", "RangeError",
            "Promise", "Set", "Map", "WeakSet", "WeakMap", "Symbol",
            "Array", "Object", "String", "Number", "Boolean", "Function",
            "parseInt", "parseFloat", "isNaN", "isFinite", "NaN", "Infinity", "undefined",
            "setTimeout", "setInterval", "clearTimeout", "clearInterval", "queueMicrotask", "structuredClone",
            "URL", "URLSearchParams", "Headers", "Request", "Response", "FormData", "Blob", "File",
            "AbortController", "TextEncoder", "TextDecoder",
            "crypto", "performance", "navigator", "location", "history", "localStorage", "sessionStorage",
            "fetch", "alert", "confirm", "prompt",
            "Bun", "Deno", "process", "require", "module", "exports", "Buffer", "atob", "btoa");

    private static final Set<String> TOVA_RUNTIME = Set.of(
            "Ok", "Err", "Some", "None", "Result", "Option", "db", "server", "client", "shared", "self");

    private final StdlibRegistry stdlib;

    /**
     * @param stdlib The runtime fragment registry.
     */
    public KnownGlobals(StdlibRegistry stdlib) {
        this.stdlib = stdlib;
    }

    /**
     * @param name An identifier.
     * @return {@code true} if the name needs no declaration.
     */
    public boolean contains(String name) {
        return TOVA_RUNTIME.contains(name) || JS_GLOBALS.contains(name) || stdlib.isBuiltin(name);
    }

    /**
     * @return All global names, Tova builtins first.
     */
    public Set<String> names() {
        Set<String> names = new LinkedHashSet<>(stdlib.builtinNames());
        names.addAll(TOVA_RUNTIME);
        names.addAll(JS_GLOBALS);
        return names;
    }
}
