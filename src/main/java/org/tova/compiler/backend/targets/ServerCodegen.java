package org.tova.compiler.backend.targets;

import org.tova.compiler.backend.BaseCodegen;
import org.tova.compiler.backend.emit.EmissionContext;
import org.tova.compiler.diagnostics.CompilerLogger;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.FunctionDeclarationNode;
import org.tova.compiler.frontend.parser.ast.LambdaNode;
import org.tova.compiler.frontend.parser.features.server.MiddlewareNode;
import org.tova.compiler.frontend.parser.features.server.RouteNode;
import org.tova.compiler.frontend.parser.features.server.ServerBlockNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Emits a Hono application for one server block group.
 * <p>
 * Every top-level function of the group is also exposed as {@code POST /rpc/<name>}; the request
 * body carries the positional arguments as {@code { args: [...] }} and the response is
 * {@code { result }}. Declared routes call their handler with the Hono context and answer with the
 * JSON of its result.
 */
public class ServerCodegen extends BaseCodegen {

    private static final CompilerLogger log = CompilerLogger.of(ServerCodegen.class);

    private final SecurityCodegen security;

    public ServerCodegen(EmissionContext context) {
        super(context);
        this.security = new SecurityCodegen(context);
    }

    /**
     * @param blocks The server blocks of one group, in source order.
     * @param securityConfig The merged security configuration of the program.
     * @return The server file without the shared code.
     */
    public TargetCode generate(List<ServerBlockNode> blocks, SecurityCodegen.SecurityConfig securityConfig) {
        List<RouteNode> routes = new ArrayList<>();
        List<MiddlewareNode> middleware = new ArrayList<>();
        List<FunctionDeclarationNode> functions = new ArrayList<>();
        List<AstNode> other = new ArrayList<>();
        for (ServerBlockNode block : blocks) {
            for (AstNode stmt : block.body()) {
                if (stmt instanceof RouteNode route) routes.add(route);
                else if (stmt instanceof MiddlewareNode m) middleware.add(m);
                else if (stmt instanceof FunctionDeclarationNode fn) functions.add(fn);
                else other.add(stmt);
            }
        }
        functions.forEach(fn -> declare(fn.name(), false));
        middleware.forEach(m -> declare(m.function().name(), false));
        log.debug("Server target: {} function(s), {} route(s)", functions.size(), routes.size());

        List<String> header = new ArrayList<>();
        header.add("import { Hono } from 'hono';");
        header.add("import { cors } from 'hono/cors';");
        header.add("import { serve } from '@hono/node-server';");
        header.addAll(security.serverImports(securityConfig));

        List<String> sections = new ArrayList<>();
        sections.add("const app = new Hono();\napp.use(\"/*\", cors(" + security.corsOptions(securityConfig) + "));");
        sections.addAll(security.serverSections(securityConfig));
        boolean sanitize = security.sanitizes(securityConfig);

        String statementsCode = statements(other);
        if (!statementsCode.isBlank()) sections.add(statementsCode);

        if (!middleware.isEmpty()) {
            List<String> lines = new ArrayList<>();
            lines.add("// ── Middleware ──");
            for (MiddlewareNode m : middleware) {
                lines.add(statement(m.function()));
                lines.add("app.use(\"/*\", " + m.function().name() + ");");
            }
            sections.add(String.join("\n", lines));
        }

        if (!functions.isEmpty()) {
            List<String> fnLines = new ArrayList<>();
            fnLines.add("// ── Server Functions ──");
            for (FunctionDeclarationNode fn : functions) fnLines.add(statement(fn));
            sections.add(String.join("\n\n", fnLines));

            List<String> rpcLines = new ArrayList<>();
            rpcLines.add("// ── RPC Endpoints ──");
            for (FunctionDeclarationNode fn : functions) rpcLines.add(rpcEndpoint(fn.name(), sanitize));
            sections.add(String.join("\n", rpcLines));
        }

        if (!routes.isEmpty()) {
            List<String> routeLines = new ArrayList<>();
            routeLines.add("// ── Routes ──");
            for (RouteNode route : routes) routeLines.add(route(route, sanitize));
            sections.add(String.join("\n", routeLines));
        }

        sections.add("// ── Start Server ──\n"
                + "const port = Number(process.env.PORT || 3000);\n"
                + "if (process.env.TOVA_STANDALONE) serve({ fetch: app.fetch, port });\n"
                + "export default { port, fetch: app.fetch };");
        return new TargetCode(String.join("\n", header), String.join("\n\n", sections));
    }

    private static String rpcEndpoint(String name, boolean sanitize) {
        String result = sanitize ? "__autoSanitize(result, c.get(\"user\"))" : "result";
        return "app.post(" + quote("/rpc/" + name) + ", async (c) => {\n"
                + "  const { args = [] } = await c.req.json().catch(() => ({}));\n"
                + "  const result = await " + name + "(...args);\n"
                + "  return c.json({ result: " + result + " });\n"
                + "});";
    }

    private String route(RouteNode route, boolean sanitize) {
        String handler = expression(route.handler());
        if (route.handler() instanceof LambdaNode) handler = "(" + handler + ")";
        String result = sanitize ? "__autoSanitize(result, c.get(\"user\"))" : "result";
        return "app." + route.method().toLowerCase(Locale.ROOT) + "(" + quote(route.path()) + ", async (c) => {\n"
                + "  const result = await " + handler + "(c);\n"
                + "  return c.json(" + result + ");\n"
                + "});";
    }
}
