package org.tova.compiler.api;

import com.typesafe.config.Config;

/**
 * Options that control one compilation.
 *
 * @param tolerant   If true, analysis errors are returned instead of thrown.
 * @param strict     If true, gradual type warnings become errors.
 * @param sourceMaps If true, a source map is generated for the shared output.
 * @param namingLint If true, naming convention warnings are reported.
 */
public record CompilerOptions(boolean tolerant, boolean strict, boolean sourceMaps, boolean namingLint) {

    private static final String COMPILER_PATH = "tova.compiler";

    /**
     * @return The default options: not tolerant, not strict, no source maps, naming lint on.
     */
    public static CompilerOptions defaults() {
        return new CompilerOptions(false, false, false, true);
    }

    /**
     * Reads the options from the {@code tova.compiler} section of a configuration.
     * Missing keys fall back to {@link #defaults()}.
     *
     * @param config The resolved configuration.
     * @return The options described by the configuration.
     */
    public static CompilerOptions fromConfig(Config config) {
        CompilerOptions defaults = defaults();
        if (!config.hasPath(COMPILER_PATH)) {
            return defaults;
        }
        Config c = config.getConfig(COMPILER_PATH);
        return new CompilerOptions(
                c.hasPath("tolerant") ? c.getBoolean("tolerant") : defaults.tolerant(),
                c.hasPath("strict") ? c.getBoolean("strict") : defaults.strict(),
                c.hasPath("source-maps") ? c.getBoolean("source-maps") : defaults.sourceMaps(),
                c.hasPath("naming-lint") ? c.getBoolean("naming-lint") : defaults.namingLint());
    }

    /**
     * @param value The new tolerant flag.
     * @return A copy of these options with the given tolerant flag.
     */
    public CompilerOptions withTolerant(boolean value) {
        return new CompilerOptions(value, strict, sourceMaps, namingLint);
    }

    /**
     * @param value The new source map flag.
     * @return A copy of these options with the given source map flag.
     */
    public CompilerOptions withSourceMaps(boolean value) {
        return new CompilerOptions(tolerant, strict, value, namingLint);
    }
}
