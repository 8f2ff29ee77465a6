package org.tova.compiler.backend.targets;

import org.tova.compiler.backend.BaseCodegen;
import org.tova.compiler.backend.emit.EmissionContext;
import org.tova.compiler.diagnostics.CompilerLogger;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.BooleanLiteralNode;
import org.tova.compiler.frontend.parser.ast.ConfigFieldNode;
import org.tova.compiler.frontend.parser.ast.IdentifierNode;
import org.tova.compiler.frontend.parser.ast.ObjectLiteralNode;
import org.tova.compiler.frontend.parser.ast.ObjectPropertyNode;
import org.tova.compiler.frontend.parser.ast.StringLiteralNode;
import org.tova.compiler.frontend.parser.features.security.SecurityAuthNode;
import org.tova.compiler.frontend.parser.features.security.SecurityBlockNode;
import org.tova.compiler.frontend.parser.features.security.SecurityPolicyNode;
import org.tova.compiler.frontend.parser.features.security.SecurityProtectNode;
import org.tova.compiler.frontend.parser.features.security.SecurityRoleNode;
import org.tova.compiler.frontend.parser.features.security.SecuritySensitiveNode;
import org.tova.compiler.frontend.parser.features.security.SecurityTrustProxyNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges every {@code security} block of a program and emits the server and browser fragments that
 * enforce it: role tables, route protection, field sanitization, response headers and audit logging.
 */
public class SecurityCodegen extends BaseCodegen {

    private static final CompilerLogger log = CompilerLogger.of(SecurityCodegen.class);

    /**
     * The merged declarations of all security blocks. Roles, protect rules and sensitive fields
     * accumulate; auth, trust_proxy and each policy keep the last declaration.
     */
    public record SecurityConfig(
            SecurityAuthNode auth,
            List<SecurityRoleNode> roles,
            List<SecurityProtectNode> protects,
            List<SecuritySensitiveNode> sensitives,
            Map<String, SecurityPolicyNode> policies,
            AstNode trustProxy
    ) {
        public boolean isEmpty() {
            return auth == null && roles.isEmpty() && protects.isEmpty() && sensitives.isEmpty()
                    && policies.isEmpty() && trustProxy == null;
        }

        public SecurityPolicyNode policy(String kind) {
            return policies.get(kind);
        }
    }

    public SecurityCodegen(EmissionContext context) {
        super(context);
    }

    /**
     * @param blocks The security blocks in source order.
     * @return The merged configuration.
     */
    public static SecurityConfig merge(List<SecurityBlockNode> blocks) {
        SecurityAuthNode auth = null;
        AstNode trustProxy = null;
        List<SecurityRoleNode> roles = new ArrayList<>();
        List<SecurityProtectNode> protects = new ArrayList<>();
        List<SecuritySensitiveNode> sensitives = new ArrayList<>();
        Map<String, SecurityPolicyNode> policies = new LinkedHashMap<>();
        for (SecurityBlockNode block : blocks) {
            for (AstNode node : block.body()) {
                if (node instanceof SecurityAuthNode a) auth = a;
                else if (node instanceof SecurityRoleNode r) roles.add(r);
                else if (node instanceof SecurityProtectNode p) protects.add(p);
                else if (node instanceof SecuritySensitiveNode s) sensitives.add(s);
                else if (node instanceof SecurityPolicyNode p) policies.put(p.kind(), p);
                else if (node instanceof SecurityTrustProxyNode t) trustProxy = t.value();
            }
        }
        return new SecurityConfig(auth, List.copyOf(roles), List.copyOf(protects), List.copyOf(sensitives),
                policies, trustProxy);
    }

    /**
     * @param config The merged configuration.
     * @return Import lines the server fragments rely on.
     */
    public List<String> serverImports(SecurityConfig config) {
        List<String> imports = new ArrayList<>();
        if (isJwt(config)) imports.add("import { verify } from 'hono/jwt';");
        if (config.policy("csrf") != null || isCookieAuth(config)) imports.add("import { getCookie } from 'hono/cookie';");
        return imports;
    }

    /**
     * @param config The merged configuration.
     * @return The options object for Hono's {@code cors()}, or an empty string for the defaults.
     */
    public String corsOptions(SecurityConfig config) {
        SecurityPolicyNode cors = config.policy("cors");
        if (cors == null) return "";
        List<String> options = new ArrayList<>();
        AstNode origins = field(cors.config(), "origins");
        if (origins != null) options.add("origin: " + expression(origins));
        AstNode methods = field(cors.config(), "methods");
        if (methods != null) options.add("allowMethods: " + expression(methods));
        AstNode credentials = field(cors.config(), "credentials");
        if (credentials != null) options.add("credentials: " + expression(credentials));
        return options.isEmpty() ? "" : "{ " + String.join(", ", options) + " }";
    }

    /**
     * @param config The merged configuration.
     * @return True if route results must pass through {@code __autoSanitize}.
     */
    public boolean sanitizes(SecurityConfig config) {
        return !config.sensitives().isEmpty();
    }

    /**
     * Emits the server-side helper sections in dependency order.
     * @param config The merged configuration.
     * @return The sections; empty when the program declares no security.
     */
    public List<String> serverSections(SecurityConfig config) {
        List<String> sections = new ArrayList<>();
        if (config.isEmpty()) return sections;
        log.debug("Emitting security: {} role(s), {} protect rule(s), {} sensitive field(s)",
                config.roles().size(), config.protects().size(), config.sensitives().size());
        sections.add(roles(config));
        if (config.auth() != null) sections.add(authenticate(config));
        if (!config.protects().isEmpty()) sections.add(protection(config));
        if (!config.sensitives().isEmpty()) sections.add(sanitization(config));
        if (config.policy("csp") != null) sections.add(csp(config.policy("csp")));
        if (needsRateLimiter(config)) sections.add(rateLimiter(config));
        if (config.policy("audit") != null) sections.add(audit(config.policy("audit")));
        sections.add(middleware(config));
        return sections;
    }

    private String roles(SecurityConfig config) {
        List<String> lines = new ArrayList<>();
        lines.add("// ── Security Roles ──");
        lines.add("const __securityRoles = {");
        for (SecurityRoleNode role : config.roles()) {
            lines.add("  " + quote(role.name()) + ": [" + String.join(", ", role.permissions().stream().map(BaseCodegen::quote).toList()) + "],");
        }
        lines.add("};");
        lines.add("function __getUserRoles(user) {");
        lines.add("  if (!user) return [];");
        lines.add("  if (Array.isArray(user.roles)) return user.roles;");
        lines.add("  if (user.role) return [user.role];");
        lines.add("  return [];");
        lines.add("}");
        lines.add("function __hasRole(user, roleName) {");
        lines.add("  return __getUserRoles(user).includes(roleName);");
        lines.add("}");
        lines.add("function __hasPermission(user, permission) {");
        lines.add("  for (const r of __getUserRoles(user)) {");
        lines.add("    const perms = __securityRoles[r];");
        lines.add("    if (perms && perms.includes(permission)) return true;");
        lines.add("  }");
        lines.add("  return false;");
        lines.add("}");
        return String.join("\n", lines);
    }

    // jwt verifies a bearer token (or the auth cookie); other auth types expect earlier middleware to set "user".
    private String authenticate(SecurityConfig config) {
        List<String> lines = new ArrayList<>();
        lines.add("// ── Authentication ──");
        if (!isJwt(config)) {
            lines.add("async function __authenticate(c) {");
            lines.add("  return c.get(\"user\") ?? null;");
            lines.add("}");
            return String.join("\n", lines);
        }
        AstNode secret = field(config.auth().config(), "secret");
        lines.add("const __authSecret = " + (secret == null ? "process.env.JWT_SECRET" : expression(secret)) + ";");
        lines.add("async function __authenticate(c) {");
        lines.add("  const header = c.req.header(\"Authorization\") || \"\";");
        if (isCookieAuth(config)) {
            lines.add("  const token = header.startsWith(\"Bearer \") ? header.slice(7) : getCookie(c, \"__tova_auth\");");
        } else {
            lines.add("  const token = header.startsWith(\"Bearer \") ? header.slice(7) : null;");
        }
        lines.add("  if (!token) return null;");
        lines.add("  try {");
        lines.add("    return await verify(token, __authSecret);");
        lines.add("  } catch (__authErr) {");
        lines.add("    return null;");
        lines.add("  }");
        lines.add("}");
        return String.join("\n", lines);
    }

    private String protection(SecurityConfig config) {
        List<String> lines = new ArrayList<>();
        lines.add("// ── Route Protection ──");
        lines.add("const __protectRules = [");
        for (SecurityProtectNode protect : config.protects()) {
            AstNode require = field(protect.config(), "require");
            String requirement = require == null ? quote("authenticated")
                    : require instanceof IdentifierNode id ? quote(id.name()) : expression(require);
            String max = "null";
            String window = "null";
            if (field(protect.config(), "rate_limit") instanceof ObjectLiteralNode limit) {
                for (AstNode entry : limit.entries()) {
                    if (!(entry instanceof ObjectPropertyNode property)) continue;
                    if (property.key().equals("max")) max = expression(property.value());
                    if (property.key().equals("window")) window = expression(property.value());
                }
            }
            lines.add("  { pattern: /^" + globToRegex(protect.pattern()) + "$/, require: " + requirement
                    + ", rateLimit: { max: " + max + ", window: " + window + " } },");
        }
        lines.add("];");
        lines.add("function __checkProtection(path, user) {");
        lines.add("  for (const rule of __protectRules) {");
        lines.add("    if (!rule.pattern.test(path)) continue;");
        lines.add("    if (!user) return { allowed: false, status: 401, reason: \"Authentication required\" };");
        lines.add("    if (rule.require !== \"authenticated\" && !__hasRole(user, rule.require)) {");
        lines.add("      return { allowed: false, status: 403, reason: \"Insufficient permissions\" };");
        lines.add("    }");
        lines.add("    return { allowed: true, rateLimit: rule.rateLimit };");
        lines.add("  }");
        lines.add("  return { allowed: true, rateLimit: null };");
        lines.add("}");
        return String.join("\n", lines);
    }

    /**
     * Converts a route glob to a regular expression body: {@code *} matches within one path segment
     * and {@code **} across segments. Everything else is matched literally.
     * @param glob The glob.
     * @return The regex body without anchors.
     */
    public static String globToRegex(String glob) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    out.append(".*");
                    i++;
                } else {
                    out.append("[^/]*");
                }
            } else if (".+?^${}()|[]\\/".indexOf(c) >= 0) {
                out.append('\\').append(c);
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private String sanitization(SecurityConfig config) {
        List<String> lines = new ArrayList<>();
        lines.add("// ── Sensitive Field Sanitization ──");
        boolean visibleTo = config.sensitives().stream().anyMatch(s -> field(s.config(), "visible_to") != null);
        if (visibleTo) {
            lines.add("function __isSameIdentity(user, obj) {");
            lines.add("  for (const f of [\"id\", \"_id\", \"userId\", \"user_id\", \"uuid\"]) {");
            lines.add("    if (user[f] != null && obj[f] != null && user[f] === obj[f]) return true;");
            lines.add("  }");
            lines.add("  return false;");
            lines.add("}");
        }
        Map<String, List<SecuritySensitiveNode>> byType = new LinkedHashMap<>();
        for (SecuritySensitiveNode s : config.sensitives()) {
            byType.computeIfAbsent(s.typeName(), k -> new ArrayList<>()).add(s);
        }
        for (Map.Entry<String, List<SecuritySensitiveNode>> entry : byType.entrySet()) {
            lines.add("function __sanitize" + entry.getKey() + "(obj, user) {");
            lines.add("  if (!obj) return obj;");
            lines.add("  const result = { ...obj };");
            for (SecuritySensitiveNode s : entry.getValue()) {
                AstNode visible = field(s.config(), "visible_to");
                if (isTrue(field(s.config(), "never_expose")) || visible == null) {
                    lines.add("  delete result[" + quote(s.field()) + "];");
                } else {
                    lines.add("  if (!" + expression(visible) + ".some((v) => v === \"self\" ? (user && __isSameIdentity(user, obj)) : __hasRole(user, v))) {");
                    lines.add("    delete result[" + quote(s.field()) + "];");
                    lines.add("  }");
                }
            }
            lines.add("  return result;");
            lines.add("}");
        }
        lines.add("function __autoSanitize(data, user) {");
        lines.add("  if (data == null || typeof data !== \"object\") return data;");
        lines.add("  if (Array.isArray(data)) return data.map((item) => __autoSanitize(item, user));");
        lines.add("  const typeName = data.__type || data.__tag || (data.constructor && data.constructor.name !== \"Object\" ? data.constructor.name : null);");
        for (String typeName : byType.keySet()) {
            lines.add("  if (typeName === " + quote(typeName) + ") return __sanitize" + typeName + "(data, user);");
        }
        lines.add("  const out = {};");
        lines.add("  for (const [k, v] of Object.entries(data)) out[k] = __autoSanitize(v, user);");
        lines.add("  return out;");
        lines.add("}");
        return String.join("\n", lines);
    }

    // Directive keys use underscores in source: default_src becomes default-src.
    private String csp(SecurityPolicyNode policy) {
        List<String> lines = new ArrayList<>();
        lines.add("// ── Content Security Policy ──");
        lines.add("const __cspKeywords = new Set([\"self\", \"none\", \"unsafe-inline\", \"unsafe-eval\", \"strict-dynamic\"]);");
        lines.add("function __getCspHeader() {");
        lines.add("  const parts = [];");
        for (ConfigFieldNode directive : policy.config()) {
            lines.add("  parts.push(" + quote(directive.key().replace('_', '-') + " ") + " + " + expression(directive.value())
                    + ".map((v) => __cspKeywords.has(v) ? \"'\" + v + \"'\" : v).join(\" \"));");
        }
        lines.add("  return parts.join(\"; \");");
        lines.add("}");
        return String.join("\n", lines);
    }

    private static boolean needsRateLimiter(SecurityConfig config) {
        return config.policy("rate_limit") != null
                || config.protects().stream().anyMatch(p -> field(p.config(), "rate_limit") != null);
    }

    // Fixed-window counters kept in memory per client key.
    private String rateLimiter(SecurityConfig config) {
        List<String> lines = new ArrayList<>();
        lines.add("// ── Rate Limiting ──");
        lines.add("const __rateBuckets = new Map();");
        lines.add("function __rateLimit(key, max, windowSeconds) {");
        lines.add("  const now = Date.now();");
        lines.add("  const bucket = __rateBuckets.get(key);");
        lines.add("  if (!bucket || now - bucket.start >= windowSeconds * 1000) {");
        lines.add("    __rateBuckets.set(key, { start: now, count: 1 });");
        lines.add("    return true;");
        lines.add("  }");
        lines.add("  bucket.count += 1;");
        lines.add("  return bucket.count <= max;");
        lines.add("}");
        lines.add("function __clientKey(c) {");
        if (config.trustProxy() != null) {
            lines.add("  if (" + expression(config.trustProxy()) + ") {");
            lines.add("    const forwarded = c.req.header(\"X-Forwarded-For\");");
            lines.add("    if (forwarded) return forwarded.split(\",\")[0].trim();");
            lines.add("  }");
        }
        lines.add("  return c.req.header(\"X-Real-IP\") || \"anonymous\";");
        lines.add("}");
        SecurityPolicyNode policy = config.policy("rate_limit");
        if (policy != null) {
            AstNode max = field(policy.config(), "max");
            AstNode window = field(policy.config(), "window");
            lines.add("const __globalRateLimit = { max: " + (max == null ? "100" : expression(max))
                    + ", window: " + (window == null ? "60" : expression(window)) + " };");
        }
        return String.join("\n", lines);
    }

    private String audit(SecurityPolicyNode policy) {
        AstNode store = field(policy.config(), "store");
        AstNode retain = field(policy.config(), "retain");
        AstNode events = field(policy.config(), "events");
        List<String> lines = new ArrayList<>();
        lines.add("// ── Audit Logging ──");
        lines.add("const __auditStore = " + (store == null ? quote("audit_log") : expression(store)) + ";");
        lines.add("if (!/^[a-zA-Z_][a-zA-Z0-9_]*$/.test(__auditStore)) throw new Error(\"Invalid audit store table name: \" + __auditStore);");
        lines.add("const __auditRetainDays = " + (retain == null ? "90" : expression(retain)) + ";");
        lines.add("const __auditEvents = " + (events == null ? "[]" : expression(events)) + ";");
        lines.add("async function __auditLog(event, details, user) {");
        lines.add("  if (__auditEvents.length > 0 && !__auditEvents.includes(event)) return;");
        lines.add("  const entry = { event, timestamp: new Date().toISOString(), user: user ? { id: user.id, roles: __getUserRoles(user) } : null, details };");
        lines.add("  if (typeof db !== \"undefined\" && db.run) {");
        lines.add("    try {");
        lines.add("      await db.run(\"INSERT INTO \" + __auditStore + \" (event, timestamp, user_id, details) VALUES (?, ?, ?, ?)\", entry.event, entry.timestamp, entry.user ? entry.user.id : null, JSON.stringify(entry.details));");
        lines.add("    } catch (__auditErr) {");
        lines.add("      console.error(\"[tova:audit] Failed to write audit log:\", __auditErr.message || __auditErr);");
        lines.add("    }");
        lines.add("  } else {");
        lines.add("    console.log(\"[tova:audit]\", JSON.stringify(entry));");
        lines.add("  }");
        lines.add("}");
        return String.join("\n", lines);
    }

    // HSTS is on by default once auth is configured.
    private String middleware(SecurityConfig config) {
        boolean audit = config.policy("audit") != null;
        List<String> lines = new ArrayList<>();
        lines.add("// ── Security Middleware ──");
        lines.add("app.use(\"/*\", async (c, next) => {");
        lines.add("  const user = " + (config.auth() != null ? "await __authenticate(c)" : "c.get(\"user\") ?? null") + ";");
        lines.add("  c.set(\"user\", user);");
        lines.add("  const path = new URL(c.req.url).pathname;");
        if (config.policy("rate_limit") != null) {
            lines.add("  if (!__rateLimit(\"global:\" + __clientKey(c), __globalRateLimit.max, __globalRateLimit.window)) {");
            lines.add("    return c.json({ error: \"Too many requests\" }, 429);");
            lines.add("  }");
        }
        if (!config.protects().isEmpty()) {
            lines.add("  const check = __checkProtection(path, user);");
            lines.add("  if (!check.allowed) {");
            if (audit) lines.add("    await __auditLog(\"access_denied\", { path, reason: check.reason }, user);");
            lines.add("    return c.json({ error: check.reason }, check.status);");
            lines.add("  }");
            if (needsRateLimiter(config)) {
                lines.add("  if (check.rateLimit && check.rateLimit.max != null) {");
                lines.add("    if (!__rateLimit(path + \":\" + __clientKey(c), check.rateLimit.max, check.rateLimit.window ?? 60)) {");
                lines.add("      return c.json({ error: \"Too many requests\" }, 429);");
                lines.add("    }");
                lines.add("  }");
            }
        }
        if (config.policy("csrf") != null) {
            lines.add("  if (![\"GET\", \"HEAD\", \"OPTIONS\"].includes(c.req.method)) {");
            lines.add("    const token = c.req.header(\"X-CSRF-Token\");");
            lines.add("    if (!token || token !== getCookie(c, \"__tova_csrf\")) {");
            if (audit) lines.add("      await __auditLog(\"csrf_rejected\", { path }, user);");
            lines.add("      return c.json({ error: \"Invalid CSRF token\" }, 403);");
            lines.add("    }");
            lines.add("  }");
        }
        lines.add("  await next();");
        if (config.policy("csp") != null) lines.add("  c.header(\"Content-Security-Policy\", __getCspHeader());");
        String hsts = hstsHeader(config);
        if (hsts != null) lines.add("  c.header(\"Strict-Transport-Security\", " + hsts + ");");
        lines.add("});");
        return String.join("\n", lines);
    }

    private String hstsHeader(SecurityConfig config) {
        SecurityPolicyNode hsts = config.policy("hsts");
        if (hsts == null) return config.auth() != null ? quote("max-age=31536000; includeSubDomains") : null;
        AstNode enabled = field(hsts.config(), "enabled");
        if (enabled instanceof BooleanLiteralNode b && !b.value()) return null;
        AstNode maxAge = field(hsts.config(), "max_age");
        String header = "\"max-age=\" + " + (maxAge == null ? "31536000" : expression(maxAge));
        if (isTrue(field(hsts.config(), "include_subdomains"))) header += " + \"; includeSubDomains\"";
        if (isTrue(field(hsts.config(), "preload"))) header += " + \"; preload\"";
        return header;
    }

    /**
     * Emits browser helpers: auth token storage and a {@code can(user, permission)} check backed by
     * the role table.
     * @param config The merged configuration.
     * @return The sections, empty when nothing applies.
     */
    public List<String> browserSections(SecurityConfig config) {
        List<String> sections = new ArrayList<>();
        if (config.auth() != null) {
            List<String> lines = new ArrayList<>();
            if (isCookieAuth(config)) {
                lines.add("// ── Security: Auth Token (HttpOnly Cookie) ──");
                lines.add("function getAuthToken() { return null; }");
                lines.add("function setAuthToken(_token) {}");
                lines.add("function clearAuthToken() {");
                lines.add("  fetch(\"/rpc/__logout\", { method: \"POST\", credentials: \"include\" }).catch(() => {});");
                lines.add("}");
            } else {
                lines.add("// ── Security: Auth Token ──");
                lines.add("function getAuthToken() { return localStorage.getItem(\"__tova_auth_token\"); }");
                lines.add("function setAuthToken(token) { localStorage.setItem(\"__tova_auth_token\", token); }");
                lines.add("function clearAuthToken() { localStorage.removeItem(\"__tova_auth_token\"); }");
            }
            sections.add(String.join("\n", lines));
        }
        if (!config.roles().isEmpty()) {
            List<String> lines = new ArrayList<>();
            lines.add("// ── Security: Permissions ──");
            lines.add("const __clientRoles = {");
            for (SecurityRoleNode role : config.roles()) {
                lines.add("  " + quote(role.name()) + ": [" + String.join(", ", role.permissions().stream().map(BaseCodegen::quote).toList()) + "],");
            }
            lines.add("};");
            lines.add("function can(user, permission) {");
            lines.add("  if (!user) return false;");
            lines.add("  const roles = Array.isArray(user.roles) ? user.roles : user.role ? [user.role] : [];");
            lines.add("  return roles.some((r) => (__clientRoles[r] || []).includes(permission));");
            lines.add("}");
            sections.add(String.join("\n", lines));
        }
        return sections;
    }

    private static boolean isJwt(SecurityConfig config) {
        return config.auth() != null && config.auth().authType().equals("jwt");
    }

    private static boolean isCookieAuth(SecurityConfig config) {
        return config.auth() != null
                && field(config.auth().config(), "storage") instanceof StringLiteralNode s && s.value().equals("cookie");
    }

    private static boolean isTrue(AstNode node) {
        return node instanceof BooleanLiteralNode b && b.value();
    }

    static AstNode field(List<ConfigFieldNode> config, String key) {
        AstNode found = null;
        for (ConfigFieldNode f : config) {
            if (f.key().equals(key)) found = f.value();
        }
        return found;
    }
}
