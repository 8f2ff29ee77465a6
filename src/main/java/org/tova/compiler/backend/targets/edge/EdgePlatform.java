package org.tova.compiler.backend.targets.edge;

import org.tova.compiler.backend.targets.EdgeCodegen;

import java.util.List;

/**
 * A serverless platform an edge block can be compiled for. The platform decides how bindings are
 * obtained and how the shared request dispatcher is exported.
 */
public interface EdgePlatform {

    /**
     * @return The value of the {@code target} setting selecting this platform.
     */
    String name();

    /**
     * @param config The merged edge block.
     * @return Lines that must open the file.
     */
    default List<String> imports(EdgeCodegen.EdgeConfig config) {
        return List.of();
    }

    /**
     * @param config The merged edge block.
     * @param gen The emitter, for default value expressions.
     * @return Module-level declarations of bindings, env vars and secrets; empty if there are none.
     */
    String bindings(EdgeCodegen.EdgeConfig config, EdgeCodegen gen);

    /**
     * @param config The merged edge block.
     * @param gen The emitter, for schedule bodies and consumer handlers.
     * @return The exported entry point calling {@code __dispatch}.
     */
    String entry(EdgeCodegen.EdgeConfig config, EdgeCodegen gen);

    /**
     * @return True if {@code schedule} declarations are honoured.
     */
    default boolean supportsSchedules() {
        return false;
    }

    /**
     * @return True if {@code consume} declarations are honoured.
     */
    default boolean supportsQueues() {
        return false;
    }
}
