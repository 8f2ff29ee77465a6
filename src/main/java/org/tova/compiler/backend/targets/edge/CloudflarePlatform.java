package org.tova.compiler.backend.targets.edge;

import org.tova.compiler.backend.BaseCodegen;
import org.tova.compiler.backend.targets.EdgeCodegen;
import org.tova.compiler.frontend.parser.features.edge.EdgeBindingNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeConsumeNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeEnvNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeScheduleNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeSecretNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Cloudflare Workers. Bindings only exist on the {@code env} argument of each handler, so they are
 * module-level {@code let} variables assigned at the start of {@code fetch}, {@code scheduled} and
 * {@code queue}.
 */
public class CloudflarePlatform implements EdgePlatform {

    @Override
    public String name() {
        return "cloudflare";
    }

    @Override
    public boolean supportsSchedules() {
        return true;
    }

    @Override
    public boolean supportsQueues() {
        return true;
    }

    @Override
    public String bindings(EdgeCodegen.EdgeConfig config, EdgeCodegen gen) {
        if (!config.hasBindings()) return "";
        List<String> names = new ArrayList<>();
        config.bindings().forEach(b -> names.add(b.name()));
        config.envVars().forEach(e -> names.add(e.name()));
        config.secrets().forEach(s -> names.add(s.name()));
        return "// ── Bindings ──\nlet " + String.join(", ", names) + ";";
    }

    @Override
    public String entry(EdgeCodegen.EdgeConfig config, EdgeCodegen gen) {
        List<String> init = initLines(config, gen);
        List<String> lines = new ArrayList<>();
        lines.add("export default {");
        lines.add("  async fetch(request, env, ctx) {");
        lines.addAll(init);
        lines.add("    return __dispatch(request, env, ctx);");
        lines.add("  },");
        if (!config.schedules().isEmpty()) {
            lines.add("  async scheduled(event, env, ctx) {");
            lines.addAll(init);
            for (EdgeScheduleNode schedule : config.schedules()) {
                lines.add("    if (event.cron === " + BaseCodegen.quote(schedule.cron()) + ") {");
                lines.add("      // " + schedule.name());
                String body = gen.scheduleBody(schedule, 2);
                if (!body.isBlank()) lines.add(body);
                lines.add("    }");
            }
            lines.add("  },");
        }
        if (!config.consumers().isEmpty()) {
            lines.add("  async queue(batch, env, ctx) {");
            lines.addAll(init);
            for (EdgeConsumeNode consumer : config.consumers()) {
                lines.add("    // consume " + consumer.queue());
                lines.add("    await " + gen.consumerHandler(consumer) + "(batch.messages);");
            }
            lines.add("  },");
        }
        lines.add("};");
        return String.join("\n", lines);
    }

    private static List<String> initLines(EdgeCodegen.EdgeConfig config, EdgeCodegen gen) {
        List<String> lines = new ArrayList<>();
        for (EdgeBindingNode b : config.bindings()) lines.add("    " + b.name() + " = env." + b.name() + ";");
        for (EdgeEnvNode e : config.envVars()) lines.add("    " + e.name() + " = env." + e.name() + gen.envDefault(e) + ";");
        for (EdgeSecretNode s : config.secrets()) lines.add("    " + s.name() + " = env." + s.name() + ";");
        return lines;
    }
}
