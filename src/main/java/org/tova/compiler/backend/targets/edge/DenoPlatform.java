package org.tova.compiler.backend.targets.edge;

import org.tova.compiler.backend.BaseCodegen;
import org.tova.compiler.backend.targets.EdgeCodegen;
import org.tova.compiler.frontend.parser.features.edge.EdgeBindingNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeEnvNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeScheduleNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeSecretNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Deno Deploy. All {@code kv} bindings share the one store returned by {@code Deno.openKv()};
 * schedules use {@code Deno.cron}.
 */
public class DenoPlatform implements EdgePlatform {

    @Override
    public String name() {
        return "deno";
    }

    @Override
    public boolean supportsSchedules() {
        return true;
    }

    @Override
    public String bindings(EdgeCodegen.EdgeConfig config, EdgeCodegen gen) {
        if (!config.hasBindings()) return "";
        List<String> lines = new ArrayList<>();
        lines.add("// ── Bindings ──");
        List<EdgeBindingNode> kv = config.bindingsOf("kv");
        for (int i = 0; i < kv.size(); i++) {
            lines.add("const " + kv.get(i).name() + " = " + (i == 0 ? "await Deno.openKv()" : kv.get(0).name()) + ";");
        }
        for (EdgeBindingNode b : config.bindings()) {
            if (b.kind().equals("kv")) continue;
            lines.add("const " + b.name() + " = null; // " + b.kind() + " bindings are not available on Deno Deploy");
        }
        for (EdgeEnvNode e : config.envVars()) {
            lines.add("const " + e.name() + " = Deno.env.get(" + BaseCodegen.quote(e.name()) + ")" + gen.envDefault(e) + ";");
        }
        for (EdgeSecretNode s : config.secrets()) {
            lines.add("const " + s.name() + " = Deno.env.get(" + BaseCodegen.quote(s.name()) + ");");
        }
        return String.join("\n", lines);
    }

    @Override
    public String entry(EdgeCodegen.EdgeConfig config, EdgeCodegen gen) {
        List<String> lines = new ArrayList<>();
        for (EdgeScheduleNode schedule : config.schedules()) {
            lines.add("Deno.cron(" + BaseCodegen.quote(schedule.name()) + ", " + BaseCodegen.quote(schedule.cron()) + ", async () => {");
            String body = gen.scheduleBody(schedule, 0);
            if (!body.isBlank()) lines.add(body);
            lines.add("});");
        }
        lines.add("Deno.serve((request) => __dispatch(request));");
        return String.join("\n", lines);
    }
}
