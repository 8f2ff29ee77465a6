package org.tova.compiler.stdlib;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The registry of runtime fragments, loaded from the {@code stdlib/tova-stdlib.js} resource.
 * <p>
 * The resource is a sequence of sections, each introduced by a header line
 * {@code //# <kind> <name> [deps=a,b] [provides=x,y]}.
 */
public class StdlibRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(StdlibRegistry.class);
    private static final String RESOURCE = "stdlib/tova-stdlib.js";
    private static final String HEADER = "//# ";

    private static volatile StdlibRegistry defaultInstance;

    private final Map<String, StdlibFragment> fragments = new LinkedHashMap<>();
    private final Map<String, String> aliases = new LinkedHashMap<>();

    /**
     * Registers a fragment. A later fragment with the same name replaces the earlier one.
     * @param fragment The fragment.
     */
    public void register(StdlibFragment fragment) {
        fragments.put(fragment.name(), fragment);
        for (String provided : fragment.provides()) {
            aliases.put(provided, fragment.name());
        }
    }

    /**
     * @param name A fragment name or a name provided by a fragment ({@code Ok} resolves to {@code Result}).
     * @return The fragment, if registered.
     */
    public Optional<StdlibFragment> get(String name) {
        return Optional.ofNullable(fragments.get(aliases.getOrDefault(name, name)));
    }

    /**
     * @param name An identifier.
     * @return {@code true} if user code may reference the name without declaring it.
     */
    public boolean isBuiltin(String name) {
        return get(name).map(StdlibFragment::isUserVisible).orElse(false);
    }

    /**
     * @param name An identifier.
     * @return {@code true} if the name is a namespace object such as {@code math}.
     */
    public boolean isNamespace(String name) {
        return get(name).map(f -> f.kind() == StdlibFragment.Kind.NAMESPACE).orElse(false);
    }

    /**
     * @return Every user-visible name, including provided aliases.
     */
    public Set<String> builtinNames() {
        Set<String> names = new LinkedHashSet<>();
        for (StdlibFragment fragment : fragments.values()) {
            if (!fragment.isUserVisible()) continue;
            names.add(fragment.name());
            names.addAll(fragment.provides());
        }
        names.remove("Result");
        return Collections.unmodifiableSet(names);
    }

    /**
     * Resolves the transitive dependencies of the used names and orders them so that every fragment
     * follows its dependencies. Unrelated fragments keep resource order.
     *
     * @param used Names referenced by the program; unknown names are ignored.
     * @return The fragments to emit, in emission order.
     */
    public List<StdlibFragment> resolve(Collection<String> used) {
        Set<String> wanted = new LinkedHashSet<>();
        for (String name : used) {
            get(name).ifPresent(f -> collect(f, wanted));
        }
        List<StdlibFragment> ordered = new ArrayList<>();
        Set<String> visited = new LinkedHashSet<>();
        for (String name : fragments.keySet()) {
            if (wanted.contains(name)) visit(fragments.get(name), visited, ordered);
        }
        return ordered;
    }

    /**
     * @param used Names referenced by the program.
     * @return The concatenated code of {@link #resolve(Collection)}, or an empty string.
     */
    public String render(Collection<String> used) {
        return resolve(used).stream().map(StdlibFragment::code).collect(Collectors.joining("\n"));
    }

    private void collect(StdlibFragment fragment, Set<String> wanted) {
        if (!wanted.add(fragment.name())) return;
        for (String dep : fragment.dependencies()) {
            get(dep).ifPresent(d -> collect(d, wanted));
        }
    }

    private void visit(StdlibFragment fragment, Set<String> visited, List<StdlibFragment> ordered) {
        if (!visited.add(fragment.name())) return;
        for (String dep : fragment.dependencies()) {
            get(dep).ifPresent(d -> visit(d, visited, ordered));
        }
        ordered.add(fragment);
    }

    /**
     * @return The shared registry loaded from the classpath.
     */
    public static StdlibRegistry defaultRegistry() {
        StdlibRegistry instance = defaultInstance;
        if (instance == null) {
            synchronized (StdlibRegistry.class) {
                instance = defaultInstance;
                if (instance == null) {
                    instance = initialize();
                    defaultInstance = instance;
                }
            }
        }
        return instance;
    }

    /**
     * Loads every fragment from the classpath resource.
     * @return A new registry.
     */
    public static StdlibRegistry initialize() {
        try (InputStream in = StdlibRegistry.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) throw new IllegalStateException("Missing runtime resource " + RESOURCE);
            StdlibRegistry registry = new StdlibRegistry();
            parse(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)), registry);
            LOG.debug("Loaded {} runtime fragments", registry.fragments.size());
            return registry;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    static void parse(BufferedReader reader, StdlibRegistry registry) throws IOException {
        String[] header = null;
        StringBuilder body = new StringBuilder();
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.startsWith(HEADER)) {
                if (header != null) registry.register(fragment(header, body));
                header = line.substring(HEADER.length()).trim().split("\\s+");
                body.setLength(0);
            } else if (header != null) {
                body.append(line).append('\n');
            }
        }
        if (header != null) registry.register(fragment(header, body));
    }

    private static StdlibFragment fragment(String[] header, StringBuilder body) {
        if (header.length < 2) throw new IllegalStateException("Malformed fragment header: " + String.join(" ", header));
        StdlibFragment.Kind kind = StdlibFragment.Kind.valueOf(header[0].toUpperCase());
        List<String> deps = List.of();
        List<String> provides = List.of();
        for (int i = 2; i < header.length; i++) {
            String option = header[i];
            if (option.startsWith("deps=")) deps = Arrays.asList(option.substring(5).split(","));
            else if (option.startsWith("provides=")) provides = Arrays.asList(option.substring(9).split(","));
        }
        String code = body.toString().stripTrailing();
        return new StdlibFragment(header[1], kind, deps, provides, code);
    }
}
