package org.tova.compiler.backend.emit;

import org.tova.compiler.diagnostics.CompilerLogger;
import org.tova.compiler.stdlib.StdlibFragment;
import org.tova.compiler.stdlib.StdlibRegistry;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tree-shaking accumulator for one {@code generate()} call. Records the builtins found by the
 * pre-pass and the helpers the emitters asked for, and renders only those runtime fragments.
 */
public final class EmissionContext {

    private static final CompilerLogger log = CompilerLogger.of(EmissionContext.class);

    private final StdlibRegistry stdlib;
    private final Set<String> used = new LinkedHashSet<>();
    private int nextId;

    public EmissionContext(StdlibRegistry stdlib) {
        this.stdlib = stdlib;
    }

    /**
     * Marks a builtin, namespace or helper as needed. Unknown names are ignored.
     * @param name The fragment name or one of the names it provides.
     */
    public void use(String name) {
        if (stdlib.isBuiltin(name) || stdlib.get(name).isPresent()) {
            used.add(name);
        }
    }

    /**
     * @param name A fragment name.
     * @return {@code true} if the name was marked as used.
     */
    public boolean isUsed(String name) {
        return used.contains(name);
    }

    /**
     * @return The marked names in the order they were first seen.
     */
    public Set<String> used() {
        return Collections.unmodifiableSet(used);
    }

    /**
     * Temporaries are numbered per compilation since shared code is inlined into every target.
     * @return A number not handed out before in this compilation.
     */
    public int nextId() {
        return nextId++;
    }

    public StdlibRegistry stdlib() {
        return stdlib;
    }

    /**
     * Renders the used fragments and their transitive dependencies, dependencies first.
     * @return The runtime prelude, empty if nothing is used.
     */
    public String renderPrelude() {
        List<StdlibFragment> fragments = stdlib.resolve(used);
        if (!fragments.isEmpty()) {
            log.debug("Tree-shaken runtime: {}", fragments.stream().map(StdlibFragment::name)
                    .collect(Collectors.joining(", ")));
        }
        return stdlib.render(used);
    }
}
