package org.tova.compiler.backend.targets;

import org.tova.compiler.backend.BaseCodegen;
import org.tova.compiler.backend.emit.EmissionContext;
import org.tova.compiler.backend.emit.features.CallEmissionRule;
import org.tova.compiler.backend.emit.features.StatementRules;
import org.tova.compiler.diagnostics.CompilerLogger;
import org.tova.compiler.frontend.parser.ast.AssignmentNode;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.CallNode;
import org.tova.compiler.frontend.parser.ast.CompoundAssignmentNode;
import org.tova.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.tova.compiler.frontend.parser.ast.FunctionDeclarationNode;
import org.tova.compiler.frontend.parser.ast.IdentifierNode;
import org.tova.compiler.frontend.parser.ast.LambdaNode;
import org.tova.compiler.frontend.parser.ast.MemberAccessNode;
import org.tova.compiler.frontend.parser.ast.ParameterNode;
import org.tova.compiler.frontend.parser.ast.StringLiteralNode;
import org.tova.compiler.frontend.parser.features.client.ClientBlockNode;
import org.tova.compiler.frontend.parser.features.client.ComponentNode;
import org.tova.compiler.frontend.parser.features.client.ComputedNode;
import org.tova.compiler.frontend.parser.features.client.EffectNode;
import org.tova.compiler.frontend.parser.features.client.StateNode;
import org.tova.compiler.frontend.parser.features.client.StoreNode;
import org.tova.compiler.frontend.parser.features.client.StyleNode;
import org.tova.compiler.frontend.parser.features.jsx.JsxAttributeNode;
import org.tova.compiler.frontend.parser.features.jsx.JsxBranchNode;
import org.tova.compiler.frontend.parser.features.jsx.JsxElementNode;
import org.tova.compiler.frontend.parser.features.jsx.JsxExpressionNode;
import org.tova.compiler.frontend.parser.features.jsx.JsxForNode;
import org.tova.compiler.frontend.parser.features.jsx.JsxIfNode;
import org.tova.compiler.frontend.parser.features.jsx.JsxSpreadAttributeNode;
import org.tova.compiler.frontend.parser.features.jsx.JsxTextNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Emits the browser bundle of one client block group.
 * <p>
 * {@code state} becomes a signal, {@code computed} a derived signal and {@code effect} an effect.
 * Reads of these tracked bindings become getter calls and writes become setter calls. JSX lowers to
 * {@code tova_el} calls; values that read a tracked binding are passed as zero-argument closures so
 * the runtime can re-evaluate them. Calls through the {@code server} proxy are awaited and make the
 * enclosing function async.
 */
public class ClientCodegen extends BaseCodegen {

    private static final CompilerLogger log = CompilerLogger.of(ClientCodegen.class);

    private static final String SERVER = "server";

    private final Set<String> states = new HashSet<>();
    private final Set<String> tracked = new HashSet<>();
    private final CallEmissionRule calls = new CallEmissionRule();

    public ClientCodegen(EmissionContext context) {
        super(context);
        registerClientRules();
    }

    private void registerClientRules() {
        expressions.register(IdentifierNode.class, (node, gen) ->
                isTracked(node.name()) ? node.name() + "()" : node.name());
        expressions.register(CallNode.class, this::call);
        expressions.register(JsxElementNode.class, (node, gen) -> element(node));
        expressions.register(JsxTextNode.class, (node, gen) -> quote(node.text()));
        expressions.register(JsxExpressionNode.class, (node, gen) -> dynamic(node.expression()));
        expressions.register(JsxForNode.class, (node, gen) -> forChild(node));
        expressions.register(JsxIfNode.class, (node, gen) -> ifChild(node));

        statements.register(AssignmentNode.class, this::assignment);
        statements.register(CompoundAssignmentNode.class, this::compoundAssignment);
        statements.register(StateNode.class, (node, gen) -> {
            states.add(node.name());
            tracked.add(node.name());
            return indent() + "const [" + node.name() + ", " + setter(node.name()) + "] = createSignal("
                    + expression(node.value()) + ");";
        });
        statements.register(ComputedNode.class, (node, gen) -> {
            tracked.add(node.name());
            return indent() + "const " + node.name() + " = createComputed(() => " + expression(node.value()) + ");";
        });
        statements.register(EffectNode.class, (node, gen) -> effect(node));
        statements.register(ComponentNode.class, (node, gen) -> component(node));
        statements.register(StoreNode.class, (node, gen) -> store(node));
        statements.register(StyleNode.class, (node, gen) -> indent()
                + "(() => { const __style = document.createElement(\"style\"); __style.textContent = "
                + quote(node.css()) + "; document.head.appendChild(__style); })();");
    }

    /**
     * Emits the merged client blocks of one name.
     * @param blocks The blocks, in source order.
     * @return The client file without the shared code.
     */
    public TargetCode generate(List<ClientBlockNode> blocks) {
        List<AstNode> stateNodes = new ArrayList<>();
        List<AstNode> computedNodes = new ArrayList<>();
        List<AstNode> componentNodes = new ArrayList<>();
        List<AstNode> effectNodes = new ArrayList<>();
        List<AstNode> other = new ArrayList<>();
        for (ClientBlockNode block : blocks) {
            for (AstNode stmt : block.body()) {
                if (stmt instanceof StateNode) stateNodes.add(stmt);
                else if (stmt instanceof ComputedNode) computedNodes.add(stmt);
                else if (stmt instanceof ComponentNode) componentNodes.add(stmt);
                else if (stmt instanceof EffectNode) effectNodes.add(stmt);
                else other.add(stmt);
            }
        }
        // Tracked names are known before any code reads them.
        stateNodes.forEach(s -> { states.add(((StateNode) s).name()); tracked.add(((StateNode) s).name()); });
        computedNodes.forEach(c -> tracked.add(((ComputedNode) c).name()));
        componentNodes.forEach(c -> declare(((ComponentNode) c).name(), false));
        log.debug("Client target: {} state(s), {} component(s)", stateNodes.size(), componentNodes.size());

        String header = "import { createSignal, createEffect, createComputed, mount, tova_el, tova_fragment } from './runtime/reactivity.js';\n"
                + "import { rpc } from './runtime/rpc.js';";

        List<String> sections = new ArrayList<>();
        sections.add("// ── Server RPC Proxy ──\n"
                + "const server = new Proxy({}, {\n"
                + "  get(_, name) {\n"
                + "    return (...args) => rpc(name, args);\n"
                + "  }\n"
                + "});");
        section(sections, "// ── Reactive State ──", stateNodes);
        section(sections, "// ── Computed Values ──", computedNodes);
        section(sections, null, other);
        section(sections, "// ── Components ──", componentNodes);
        section(sections, "// ── Effects ──", effectNodes);
        boolean hasApp = componentNodes.stream().anyMatch(c -> ((ComponentNode) c).name().equals("App"));
        if (hasApp) {
            sections.add("// ── Mount ──\n"
                    + "document.addEventListener(\"DOMContentLoaded\", () => {\n"
                    + "  mount(App, document.getElementById(\"app\") || document.body);\n"
                    + "});");
        }
        return new TargetCode(header, String.join("\n\n", sections));
    }

    private void section(List<String> sections, String title, List<AstNode> nodes) {
        if (nodes.isEmpty()) return;
        String code = nodes.stream().map(this::statement).filter(s -> !s.isBlank()).collect(Collectors.joining("\n"));
        if (code.isBlank()) return;
        sections.add(title == null ? code : title + "\n" + code);
    }

    @Override
    public boolean needsAsync(List<? extends AstNode> body) {
        return super.needsAsync(body) || callsServer(body);
    }

    private boolean callsServer(List<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            if (node == null || node instanceof FunctionDeclarationNode || node instanceof LambdaNode) continue;
            if (node instanceof CallNode call && isServerCall(call)) return true;
            if (callsServer(node.getChildren())) return true;
        }
        return false;
    }

    private boolean isServerCall(CallNode call) {
        return call.callee() instanceof MemberAccessNode member
                && member.object() instanceof IdentifierNode id
                && id.name().equals(SERVER)
                && lookup(SERVER) == null;
    }

    private String call(CallNode node, BaseCodegen gen) {
        if (isServerCall(node)) {
            MemberAccessNode member = (MemberAccessNode) node.callee();
            return "(await server." + member.property() + "(" + CallEmissionRule.arguments(node.arguments(), this) + "))";
        }
        return calls.emit(node, this);
    }

    // --- Tracked bindings ---

    private boolean isTracked(String name) {
        return tracked.contains(name) && lookup(name) == null;
    }

    private static String setter(String name) {
        return "set" + Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    /**
     * Decides whether a value depends on a tracked binding. Every branch of if-expressions and
     * match arms is searched; lambda bodies are not, since they run later.
     * @param node An expression.
     * @return {@code true} if evaluating the node reads a signal.
     */
    boolean readsTracked(AstNode node) {
        if (node == null || node instanceof LambdaNode) return false;
        if (node instanceof IdentifierNode id) return isTracked(id.name());
        for (AstNode child : node.getChildren()) {
            if (readsTracked(child)) return true;
        }
        return false;
    }

    private String dynamic(AstNode value) {
        String code = expression(value);
        return readsTracked(value) ? "() => " + code : code;
    }

    private String assignment(AssignmentNode node, BaseCodegen gen) {
        if (node.target() instanceof IdentifierNode id && states.contains(id.name()) && lookup(id.name()) == null) {
            return indent() + setter(id.name()) + "(" + expression(node.value()) + ");";
        }
        return StatementRules.assignment(node, this);
    }

    private String compoundAssignment(CompoundAssignmentNode node, BaseCodegen gen) {
        if (node.target() instanceof IdentifierNode id && states.contains(id.name()) && lookup(id.name()) == null) {
            return indent() + setter(id.name()) + "(__prev => __prev " + node.operator().js() + " " + expression(node.value()) + ");";
        }
        return StatementRules.compoundAssignment(node, this);
    }

    // --- Reactive declarations ---

    private String effect(EffectNode node) {
        List<AstNode> body = node.body().statements();
        String indent = indent();
        if (!needsAsync(body)) {
            return indent + "createEffect(() => {\n" + block(node.body()) + "\n" + indent + "});";
        }
        String inner = nested(this::indent);
        return indent + "createEffect(() => {\n"
                + inner + "(async () => {\n"
                + nested(() -> block(node.body())) + "\n"
                + inner + "})();\n"
                + indent + "});";
    }

    private String component(ComponentNode node) {
        declare(node.name(), false);
        String params = node.params().isEmpty() ? "" : "{ " + params(node.params()) + " }";
        List<AstNode> statements = new ArrayList<>();
        List<AstNode> roots = new ArrayList<>();
        for (AstNode stmt : node.body()) {
            if (stmt instanceof ExpressionStatementNode expr && expr.expression() instanceof JsxElementNode) {
                roots.add(expr.expression());
            } else {
                statements.add(stmt);
            }
        }
        String body = nested(() -> {
            node.params().stream().map(ParameterNode::name).forEach(n -> declare(n, false));
            List<String> lines = new ArrayList<>();
            String code = statements(statements);
            if (!code.isBlank()) lines.add(code);
            if (roots.size() == 1) {
                lines.add(indent() + "return " + expression(roots.get(0)) + ";");
            } else if (roots.size() > 1) {
                lines.add(indent() + "return tova_fragment([" + roots.stream().map(this::expression)
                        .collect(Collectors.joining(", ")) + "]);");
            }
            return String.join("\n", lines);
        });
        return indent() + "function " + node.name() + "(" + params + ") {\n" + body + "\n" + indent() + "}";
    }

    // A store is a singleton object exposing its signals as properties.
    private String store(StoreNode node) {
        declare(node.name(), false);
        List<String> exposed = new ArrayList<>();
        Set<String> ownTracked = new HashSet<>();
        String body = nested(() -> {
            for (AstNode stmt : node.body()) {
                if (stmt instanceof StateNode state) {
                    states.add(state.name());
                    ownTracked.add(state.name());
                    exposed.add("get " + state.name() + "() { return " + state.name() + "(); }");
                    exposed.add("set " + state.name() + "(v) { " + setter(state.name()) + "(v); }");
                } else if (stmt instanceof ComputedNode computed) {
                    ownTracked.add(computed.name());
                    exposed.add("get " + computed.name() + "() { return " + computed.name() + "(); }");
                } else if (stmt instanceof FunctionDeclarationNode fn) {
                    exposed.add(fn.name());
                }
            }
            tracked.addAll(ownTracked);
            String code = statements(node.body());
            return code + "\n" + indent() + "return { " + String.join(", ", exposed) + " };";
        });
        tracked.removeAll(ownTracked);
        states.removeAll(ownTracked);
        return indent() + "const " + node.name() + " = (() => {\n" + body + "\n" + indent() + "})();";
    }

    // --- JSX ---

    private String element(JsxElementNode node) {
        List<String> props = new ArrayList<>();
        for (AstNode attribute : node.attributes()) {
            if (attribute instanceof JsxSpreadAttributeNode spread) {
                props.add("..." + expression(spread.expression()));
            } else if (attribute instanceof JsxAttributeNode attr) {
                props.add(attribute(attr));
            }
        }
        String propsCode = "{" + String.join(", ", props) + "}";
        List<String> children = node.children().stream()
                .filter(c -> !(c instanceof JsxTextNode text) || !text.text().isBlank())
                .map(this::expression)
                .toList();
        if (node.isComponent()) {
            if (!children.isEmpty()) {
                String withChildren = props.isEmpty() ? "" : String.join(", ", props) + ", ";
                return node.tag() + "({" + withChildren + "children: [" + String.join(", ", children) + "]})";
            }
            return node.tag() + "(" + propsCode + ")";
        }
        String tag = quote(node.tag());
        if (node.selfClosing() || children.isEmpty()) {
            return "tova_el(" + tag + ", " + propsCode + ")";
        }
        return "tova_el(" + tag + ", " + propsCode + ", [" + String.join(", ", children) + "])";
    }

    private String attribute(JsxAttributeNode attr) {
        if (attr.isEvent()) {
            String event = attr.name().substring(3);
            String handler = attr.value() instanceof LambdaNode || !readsTracked(attr.value())
                    ? expression(attr.value())
                    : "() => " + expression(attr.value());
            return "on" + Character.toUpperCase(event.charAt(0)) + event.substring(1) + ": " + handler;
        }
        if (attr.isAction()) {
            String value = attr.value() == null ? "true" : dynamic(attr.value());
            return quote(attr.name()) + ": " + value;
        }
        String name = attr.name().equals("class") ? "className" : attr.name();
        String key = name.matches("[A-Za-z_$][A-Za-z0-9_$]*") ? name : quote(name);
        if (attr.value() instanceof StringLiteralNode literal) return key + ": " + quote(literal.value());
        return key + ": " + dynamic(attr.value());
    }

    private String children(List<AstNode> children) {
        List<String> parts = children.stream()
                .filter(c -> !(c instanceof JsxTextNode text) || !text.text().isBlank())
                .map(this::expression)
                .toList();
        if (parts.size() == 1 && !parts.get(0).startsWith("...")) return parts.get(0);
        if (parts.isEmpty()) return "null";
        return "tova_fragment([" + String.join(", ", parts) + "])";
    }

    private String forChild(JsxForNode node) {
        String binding = node.variables().size() == 1 ? node.variables().get(0) : "[" + String.join(", ", node.variables()) + "]";
        String body = nested(() -> {
            node.variables().forEach(v -> declare(v, false));
            return children(node.children());
        });
        String mapped = expression(node.iterable()) + ".map((" + binding + ") => " + body + ")";
        return readsTracked(node.iterable()) ? "() => " + mapped : "..." + mapped;
    }

    private String ifChild(JsxIfNode node) {
        String tail = node.elseChildren() == null || node.elseChildren().isEmpty() ? "null" : children(node.elseChildren());
        for (int i = node.alternates().size() - 1; i >= 0; i--) {
            JsxBranchNode branch = node.alternates().get(i);
            tail = "(" + expression(branch.condition()) + ") ? " + children(branch.children()) + " : " + tail;
        }
        String code = "(" + expression(node.condition()) + ") ? " + children(node.children()) + " : " + tail;
        boolean reactive = readsTracked(node.condition())
                || node.alternates().stream().anyMatch(b -> readsTracked(b.condition()));
        return reactive ? "() => " + code : code;
    }
}
