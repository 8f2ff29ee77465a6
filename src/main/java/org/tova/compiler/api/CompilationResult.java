package org.tova.compiler.api;

import org.tova.compiler.backend.CodeGenerator;
import org.tova.compiler.diagnostics.Diagnostic;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The outputs of a successful compilation.
 *
 * @param fileName The compiled file name.
 * @param outputs The generated code keyed by the result keys of {@link CodeGenerator}.
 * @param warnings The warnings reported by the analysis.
 */
public record CompilationResult(String fileName, Map<String, Object> outputs, List<Diagnostic> warnings) {

    public CompilationResult {
        outputs = Map.copyOf(outputs);
        warnings = List.copyOf(warnings);
    }

    /** @return The shared code including the runtime prelude. */
    public String shared() {
        return text(CodeGenerator.SHARED);
    }

    /** @return The default server file, empty if the program has no unnamed server block. */
    public String server() {
        return text(CodeGenerator.SERVER);
    }

    /** @return The default client file, empty if the program has no unnamed client block. */
    public String client() {
        return text(CodeGenerator.CLIENT);
    }

    /** @return The default edge file, empty if the program has no unnamed edge block. */
    public String edge() {
        return text(CodeGenerator.EDGE);
    }

    /** @return The CLI executable, if the program declares a cli block. */
    public Optional<String> cli() {
        return Optional.ofNullable((String) outputs.get(CodeGenerator.CLI));
    }

    /** @return The source map of the shared code, if source maps were requested. */
    public Optional<String> sourceMap() {
        return Optional.ofNullable((String) outputs.get(CodeGenerator.SOURCE_MAP));
    }

    public Map<String, String> servers() {
        return named(CodeGenerator.SERVERS);
    }

    public Map<String, String> clients() {
        return named(CodeGenerator.CLIENTS);
    }

    public Map<String, String> edges() {
        return named(CodeGenerator.EDGES);
    }

    /** @return The deploy manifests keyed by deploy block name. */
    @SuppressWarnings("unchecked")
    public Map<String, Map<String, Object>> deploy() {
        Object value = outputs.get(CodeGenerator.DEPLOY);
        return value == null ? Map.of() : (Map<String, Map<String, Object>>) value;
    }

    public boolean isCli() {
        return outputs.containsKey(CodeGenerator.CLI);
    }

    private String text(String key) {
        Object value = outputs.get(key);
        return value == null ? "" : (String) value;
    }

    @SuppressWarnings("unchecked")
    private Map<String, String> named(String key) {
        Object value = outputs.get(key);
        return value == null ? Map.of() : (Map<String, String>) value;
    }
}
