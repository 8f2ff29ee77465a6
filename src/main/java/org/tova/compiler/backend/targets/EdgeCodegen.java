package org.tova.compiler.backend.targets;

import org.tova.compiler.backend.BaseCodegen;
import org.tova.compiler.backend.emit.EmissionContext;
import org.tova.compiler.backend.targets.edge.EdgePlatform;
import org.tova.compiler.backend.targets.edge.EdgePlatforms;
import org.tova.compiler.diagnostics.CompilerLogger;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.ConfigFieldNode;
import org.tova.compiler.frontend.parser.ast.FunctionDeclarationNode;
import org.tova.compiler.frontend.parser.ast.LambdaNode;
import org.tova.compiler.frontend.parser.ast.StringLiteralNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeBindingNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeBlockNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeConsumeNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeEnvNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeScheduleNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeSecretNode;
import org.tova.compiler.frontend.parser.features.server.MiddlewareNode;
import org.tova.compiler.frontend.parser.features.server.RouteNode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Emits a serverless function for one edge block group.
 * <p>
 * The platform-independent part is a route table, a matcher, a middleware chain and a
 * {@code __dispatch(request, ...extra)} function that answers with a {@code Response}. The selected
 * {@link EdgePlatform} declares the bindings and exports an entry point around the dispatcher.
 */
public class EdgeCodegen extends BaseCodegen {

    private static final CompilerLogger log = CompilerLogger.of(EdgeCodegen.class);

    /**
     * The merged declarations of one edge group. The last {@code target} setting wins.
     */
    public record EdgeConfig(
            String target,
            List<RouteNode> routes,
            List<FunctionDeclarationNode> functions,
            List<MiddlewareNode> middleware,
            List<EdgeBindingNode> bindings,
            List<EdgeEnvNode> envVars,
            List<EdgeSecretNode> secrets,
            List<EdgeScheduleNode> schedules,
            List<EdgeConsumeNode> consumers,
            List<AstNode> statements
    ) {
        public List<EdgeBindingNode> bindingsOf(String kind) {
            return bindings.stream().filter(b -> b.kind().equals(kind)).toList();
        }

        public boolean hasBindings() {
            return !bindings.isEmpty() || !envVars.isEmpty() || !secrets.isEmpty();
        }
    }

    public EdgeCodegen(EmissionContext context) {
        super(context);
    }

    /**
     * @param blocks The edge blocks of one group, in source order.
     * @return The merged configuration.
     */
    public static EdgeConfig merge(List<EdgeBlockNode> blocks) {
        String target = EdgePlatforms.DEFAULT_TARGET;
        List<RouteNode> routes = new ArrayList<>();
        List<FunctionDeclarationNode> functions = new ArrayList<>();
        List<MiddlewareNode> middleware = new ArrayList<>();
        List<EdgeBindingNode> bindings = new ArrayList<>();
        List<EdgeEnvNode> envVars = new ArrayList<>();
        List<EdgeSecretNode> secrets = new ArrayList<>();
        List<EdgeScheduleNode> schedules = new ArrayList<>();
        List<EdgeConsumeNode> consumers = new ArrayList<>();
        List<AstNode> statements = new ArrayList<>();
        for (EdgeBlockNode block : blocks) {
            for (AstNode stmt : block.body()) {
                if (stmt instanceof ConfigFieldNode field) {
                    if (field.key().equals("target") && field.value() instanceof StringLiteralNode s) target = s.value();
                    else log.debug("Ignoring edge setting '{}'", field.key());
                } else if (stmt instanceof RouteNode r) routes.add(r);
                else if (stmt instanceof FunctionDeclarationNode f) functions.add(f);
                else if (stmt instanceof MiddlewareNode m) middleware.add(m);
                else if (stmt instanceof EdgeBindingNode b) bindings.add(b);
                else if (stmt instanceof EdgeEnvNode e) envVars.add(e);
                else if (stmt instanceof EdgeSecretNode s) secrets.add(s);
                else if (stmt instanceof EdgeScheduleNode s) schedules.add(s);
                else if (stmt instanceof EdgeConsumeNode c) consumers.add(c);
                else statements.add(stmt);
            }
        }
        return new EdgeConfig(target, routes, functions, middleware, bindings, envVars, secrets, schedules,
                consumers, statements);
    }

    /**
     * @param config The merged configuration.
     * @return The edge file without the shared code.
     */
    public TargetCode generate(EdgeConfig config) {
        EdgePlatform platform = EdgePlatforms.find(config.target()).orElseGet(() -> {
            log.warn("Unknown edge target '{}', using {} (supported: {})", config.target(),
                    EdgePlatforms.DEFAULT_TARGET, String.join(", ", EdgePlatforms.names()));
            return EdgePlatforms.find(EdgePlatforms.DEFAULT_TARGET).orElseThrow();
        });
        if (!config.schedules().isEmpty() && !platform.supportsSchedules()) {
            log.warn("Edge target '{}' has no scheduler; schedule declarations are skipped", platform.name());
        }
        if (!config.consumers().isEmpty() && !platform.supportsQueues()) {
            log.warn("Edge target '{}' has no queue consumers; consume declarations are skipped", platform.name());
        }
        log.debug("Edge target {}: {} route(s)", platform.name(), config.routes().size());

        declareBindings(config);
        List<String> sections = new ArrayList<>();
        String bindings = platform.bindings(config, this);
        if (!bindings.isBlank()) sections.add(bindings);
        if (!config.functions().isEmpty()) {
            List<String> lines = new ArrayList<>();
            lines.add("// ── Functions ──");
            config.functions().forEach(f -> lines.add(statement(f)));
            sections.add(String.join("\n\n", lines));
        }
        String misc = statements(config.statements());
        if (!misc.isBlank()) sections.add(misc);
        if (!config.middleware().isEmpty()) {
            List<String> lines = new ArrayList<>();
            lines.add("// ── Middleware ──");
            config.middleware().forEach(m -> lines.add(statement(m.function())));
            sections.add(String.join("\n\n", lines));
        }
        sections.add(routeMatcher());
        sections.add(routeTable(config));
        sections.add(dispatcher(config));
        sections.add(platform.entry(config, this));
        return new TargetCode(String.join("\n", platform.imports(config)), String.join("\n\n", sections));
    }

    private void declareBindings(EdgeConfig config) {
        config.bindings().forEach(b -> declare(b.name(), false));
        config.envVars().forEach(e -> declare(e.name(), false));
        config.secrets().forEach(s -> declare(s.name(), false));
        config.functions().forEach(f -> declare(f.name(), false));
        config.middleware().forEach(m -> declare(m.function().name(), false));
    }

    private static String routeMatcher() {
        return "// ── Route Matching ──\n"
                + "function __matchRoute(method, pathname, routes) {\n"
                + "  for (const route of routes) {\n"
                + "    if (route.method !== method && route.method !== \"*\") continue;\n"
                + "    const match = route.pattern.exec(pathname);\n"
                + "    if (!match) continue;\n"
                + "    const params = {};\n"
                + "    route.paramNames.forEach((name, i) => { params[name] = decodeURIComponent(match[i + 1]); });\n"
                + "    return { handler: route.handler, params };\n"
                + "  }\n"
                + "  return null;\n"
                + "}";
    }

    private String routeTable(EdgeConfig config) {
        List<String> lines = new ArrayList<>();
        lines.add("// ── Route Table ──");
        lines.add("const __routes = [];");
        for (RouteNode route : config.routes()) {
            List<String> params = new ArrayList<>();
            String pattern = pathPattern(route.path(), params);
            String handler = expression(route.handler());
            if (route.handler() instanceof LambdaNode) handler = "(" + handler + ")";
            lines.add("__routes.push({ method: " + quote(route.method()) + ", pattern: /^" + pattern + "$/, paramNames: ["
                    + String.join(", ", params.stream().map(BaseCodegen::quote).toList()) + "], handler: " + handler + " });");
        }
        return String.join("\n", lines);
    }

    /**
     * Converts a route path to a regular expression body. {@code :name} segments capture one path
     * segment and a trailing {@code *} captures the rest under the name {@code wildcard}.
     * @param path The route path.
     * @param paramNames Receives the capture names in order.
     * @return The regex body without anchors.
     */
    public static String pathPattern(String path, List<String> paramNames) {
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < path.length()) {
            char c = path.charAt(i);
            if (c == ':' && (i == 0 || path.charAt(i - 1) == '/')) {
                int end = i + 1;
                while (end < path.length() && (Character.isLetterOrDigit(path.charAt(end)) || path.charAt(end) == '_')) end++;
                paramNames.add(path.substring(i + 1, end));
                out.append("([^/]+)");
                i = end;
                continue;
            }
            if (c == '*') {
                paramNames.add("wildcard");
                out.append("(.*)");
            } else if (".+?^${}()|[]\\/".indexOf(c) >= 0) {
                out.append('\\').append(c);
            } else {
                out.append(c);
            }
            i++;
        }
        return out.toString();
    }

    // Middleware receives (request, next); next(req) continues with the possibly replaced request.
    private static String dispatcher(EdgeConfig config) {
        List<String> chain = config.middleware().stream().map(m -> m.function().name()).toList();
        return "// ── Dispatch ──\n"
                + "async function __handle(request, ...extra) {\n"
                + "  const url = new URL(request.url);\n"
                + "  const __match = __matchRoute(request.method, url.pathname, __routes);\n"
                + "  if (!__match) return new Response(\"Not Found\", { status: 404 });\n"
                + "  try {\n"
                + "    const __result = await __match.handler(request, __match.params, ...extra);\n"
                + "    if (__result instanceof Response) return __result;\n"
                + "    return Response.json(__result);\n"
                + "  } catch (e) {\n"
                + "    return Response.json({ error: e.message }, { status: 500 });\n"
                + "  }\n"
                + "}\n"
                + "const __middleware = [" + String.join(", ", chain) + "];\n"
                + "function __dispatch(request, ...extra) {\n"
                + "  const run = (i, req) => i < __middleware.length\n"
                + "    ? __middleware[i](req, (next) => run(i + 1, next ?? req))\n"
                + "    : __handle(req, ...extra);\n"
                + "  return run(0, request);\n"
                + "}";
    }

    /**
     * @param env An env declaration.
     * @return {@code " ?? default"}, or an empty string without a default.
     */
    public String envDefault(EdgeEnvNode env) {
        return env.defaultValue() == null ? "" : " ?? " + expression(env.defaultValue());
    }

    /**
     * @param schedule A schedule declaration.
     * @param depth The indentation depth of the enclosing code.
     * @return The schedule body, indented one level deeper than {@code depth}.
     */
    public String scheduleBody(EdgeScheduleNode schedule, int depth) {
        return nestedAt(depth, () -> block(schedule.body()));
    }

    private String nestedAt(int depth, Supplier<String> emitter) {
        if (depth == 0) return emitter.get();
        return nested(() -> nestedAt(depth - 1, emitter));
    }

    /**
     * @param consumer A consume declaration.
     * @return The handler expression, parenthesized for a direct call.
     */
    public String consumerHandler(EdgeConsumeNode consumer) {
        return "(" + expression(consumer.handler()) + ")";
    }
}
