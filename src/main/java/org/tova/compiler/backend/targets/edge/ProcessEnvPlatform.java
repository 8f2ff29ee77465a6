package org.tova.compiler.backend.targets.edge;

import org.tova.compiler.backend.targets.EdgeCodegen;
import org.tova.compiler.frontend.parser.features.edge.EdgeBindingNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeEnvNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeSecretNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Platforms that expose configuration through {@code process.env} and offer no resource bindings.
 */
public abstract class ProcessEnvPlatform implements EdgePlatform {

    /**
     * @return The platform name used in binding comments.
     */
    protected abstract String displayName();

    @Override
    public String bindings(EdgeCodegen.EdgeConfig config, EdgeCodegen gen) {
        if (!config.hasBindings()) return "";
        List<String> lines = new ArrayList<>();
        lines.add("// ── Bindings ──");
        for (EdgeBindingNode b : config.bindings()) {
            lines.add("const " + b.name() + " = null; // " + b.kind() + " bindings are not available on " + displayName());
        }
        for (EdgeEnvNode e : config.envVars()) {
            lines.add("const " + e.name() + " = process.env." + e.name() + gen.envDefault(e) + ";");
        }
        for (EdgeSecretNode s : config.secrets()) {
            lines.add("const " + s.name() + " = process.env." + s.name() + ";");
        }
        return String.join("\n", lines);
    }

    /**
     * Vercel Edge Functions.
     */
    public static class Vercel extends ProcessEnvPlatform {

        @Override
        public String name() {
            return "vercel";
        }

        @Override
        protected String displayName() {
            return "Vercel Edge";
        }

        @Override
        public List<String> imports(EdgeCodegen.EdgeConfig config) {
            return List.of("export const config = { runtime: \"edge\" };");
        }

        @Override
        public String entry(EdgeCodegen.EdgeConfig config, EdgeCodegen gen) {
            return "export default async function handler(request) {\n"
                    + "  return __dispatch(request);\n"
                    + "}";
        }
    }

    /**
     * AWS Lambda behind API Gateway. The event is turned into a {@code Request} and the
     * {@code Response} back into a proxy result.
     */
    public static class Lambda extends ProcessEnvPlatform {

        @Override
        public String name() {
            return "lambda";
        }

        @Override
        protected String displayName() {
            return "AWS Lambda";
        }

        @Override
        public String entry(EdgeCodegen.EdgeConfig config, EdgeCodegen gen) {
            return "export const handler = async (event, context) => {\n"
                    + "  const method = event.httpMethod || event.requestContext?.http?.method || \"GET\";\n"
                    + "  const path = event.path || event.rawPath || \"/\";\n"
                    + "  const query = event.rawQueryString ? \"?\" + event.rawQueryString : \"\";\n"
                    + "  const body = event.body ? (event.isBase64Encoded ? Buffer.from(event.body, \"base64\").toString() : event.body) : undefined;\n"
                    + "  const hasBody = body !== undefined && method !== \"GET\" && method !== \"HEAD\";\n"
                    + "  const request = new Request(\"https://lambda.local\" + path + query, { method, headers: event.headers || {}, body: hasBody ? body : undefined });\n"
                    + "  const response = await __dispatch(request, context);\n"
                    + "  return { statusCode: response.status, headers: Object.fromEntries(response.headers), body: await response.text() };\n"
                    + "};";
        }
    }
}
