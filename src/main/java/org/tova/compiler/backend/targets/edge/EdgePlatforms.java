package org.tova.compiler.backend.targets.edge;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lookup of the supported edge platforms by target name.
 */
public final class EdgePlatforms {

    /** Target used when an edge block does not name one. */
    public static final String DEFAULT_TARGET = "cloudflare";

    private static final Map<String, EdgePlatform> PLATFORMS = new LinkedHashMap<>();

    static {
        register(new CloudflarePlatform());
        register(new DenoPlatform());
        register(new ProcessEnvPlatform.Vercel());
        register(new ProcessEnvPlatform.Lambda());
        register(new BunPlatform());
    }

    private EdgePlatforms() {}

    private static void register(EdgePlatform platform) {
        PLATFORMS.put(platform.name(), platform);
    }

    /**
     * @param target A target name.
     * @return The platform, or empty if the name is unknown.
     */
    public static Optional<EdgePlatform> find(String target) {
        return Optional.ofNullable(PLATFORMS.get(target));
    }

    /**
     * @return The supported target names.
     */
    public static Set<String> names() {
        return PLATFORMS.keySet();
    }
}
