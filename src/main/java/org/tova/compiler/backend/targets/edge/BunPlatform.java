package org.tova.compiler.backend.targets.edge;

import org.tova.compiler.backend.BaseCodegen;
import org.tova.compiler.backend.targets.EdgeCodegen;
import org.tova.compiler.frontend.parser.features.edge.EdgeBindingNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeEnvNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeSecretNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Bun. {@code sql} bindings open a local SQLite file through {@code bun:sqlite}.
 */
public class BunPlatform implements EdgePlatform {

    @Override
    public String name() {
        return "bun";
    }

    @Override
    public List<String> imports(EdgeCodegen.EdgeConfig config) {
        return config.bindingsOf("sql").isEmpty() ? List.of() : List.of("import { Database } from \"bun:sqlite\";");
    }

    @Override
    public String bindings(EdgeCodegen.EdgeConfig config, EdgeCodegen gen) {
        if (!config.hasBindings()) return "";
        List<String> lines = new ArrayList<>();
        lines.add("// ── Bindings ──");
        for (EdgeBindingNode b : config.bindings()) {
            if (b.kind().equals("sql")) {
                lines.add("const " + b.name() + " = new Database(" + BaseCodegen.quote(b.name() + ".sqlite") + ");");
            } else {
                lines.add("const " + b.name() + " = null; // " + b.kind() + " bindings are not available on Bun");
            }
        }
        for (EdgeEnvNode e : config.envVars()) {
            lines.add("const " + e.name() + " = process.env." + e.name() + gen.envDefault(e) + ";");
        }
        for (EdgeSecretNode s : config.secrets()) {
            lines.add("const " + s.name() + " = process.env." + s.name() + ";");
        }
        return String.join("\n", lines);
    }

    @Override
    public String entry(EdgeCodegen.EdgeConfig config, EdgeCodegen gen) {
        return "Bun.serve({\n"
                + "  port: Number(process.env.PORT || 3000),\n"
                + "  fetch: (request) => __dispatch(request),\n"
                + "});";
    }
}
