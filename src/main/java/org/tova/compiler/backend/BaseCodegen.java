package org.tova.compiler.backend;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.tova.compiler.backend.emit.EmissionContext;
import org.tova.compiler.backend.emit.EmissionRegistry;
import org.tova.compiler.backend.emit.features.CallEmissionRule;
import org.tova.compiler.backend.emit.features.ConcurrentBlockEmissionRule;
import org.tova.compiler.backend.emit.features.ExpressionRules;
import org.tova.compiler.backend.emit.features.FunctionEmissionRule;
import org.tova.compiler.backend.emit.features.IfExpressionEmissionRule;
import org.tova.compiler.backend.emit.features.LambdaEmissionRule;
import org.tova.compiler.backend.emit.features.MatchEmissionRule;
import org.tova.compiler.backend.emit.features.PipeEmissionRule;
import org.tova.compiler.backend.emit.features.SelectEmissionRule;
import org.tova.compiler.backend.emit.features.StatementRules;
import org.tova.compiler.backend.emit.features.TypeDeclarationEmissionRule;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.AwaitNode;
import org.tova.compiler.frontend.parser.ast.BlockNode;
import org.tova.compiler.frontend.parser.ast.CallNode;
import org.tova.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.tova.compiler.frontend.parser.ast.FunctionDeclarationNode;
import org.tova.compiler.frontend.parser.ast.IfExpressionNode;
import org.tova.compiler.frontend.parser.ast.IfStatementNode;
import org.tova.compiler.frontend.parser.ast.LambdaNode;
import org.tova.compiler.frontend.parser.ast.MatchNode;
import org.tova.compiler.frontend.parser.ast.ParameterNode;
import org.tova.compiler.frontend.parser.ast.PipeNode;
import org.tova.compiler.frontend.parser.ast.PropagateNode;
import org.tova.compiler.frontend.parser.ast.TypeDeclarationNode;
import org.tova.compiler.frontend.parser.features.concurrency.ConcurrentBlockNode;
import org.tova.compiler.frontend.parser.features.select.SelectNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * The emitter shared by all targets. Lowers expressions, statements and patterns to JavaScript by
 * dispatching each node to the rule registered for its class. Target backends extend this class and
 * re-register the rules they lower differently.
 */
public class BaseCodegen {

    private static final String INDENT = "  ";
    private static final Gson JS_STRINGS = new GsonBuilder().disableHtmlEscaping().create();

    protected final EmissionContext context;
    protected final EmissionRegistry expressions = new EmissionRegistry();
    protected final EmissionRegistry statements = new EmissionRegistry();

    private final Deque<Map<String, Boolean>> scopes = new ArrayDeque<>();
    private final Map<String, List<String>> variantFields = new HashMap<>();
    private int indent;

    /**
     * @param context The tree-shaking accumulator of the current {@code generate()} call.
     */
    public BaseCodegen(EmissionContext context) {
        this.context = context;
        scopes.push(new HashMap<>());
        variantFields.put("Ok", List.of("value"));
        variantFields.put("Err", List.of("error"));
        variantFields.put("Some", List.of("value"));
        registerDefaultRules();
    }

    private void registerDefaultRules() {
        ExpressionRules.registerAll(expressions);
        expressions.register(CallNode.class, new CallEmissionRule());
        expressions.register(PipeNode.class, new PipeEmissionRule());
        expressions.register(LambdaNode.class, new LambdaEmissionRule());
        expressions.register(MatchNode.class, new MatchEmissionRule());
        expressions.register(IfExpressionNode.class, new IfExpressionEmissionRule());

        StatementRules.registerAll(statements);
        statements.register(FunctionDeclarationNode.class, new FunctionEmissionRule());
        statements.register(TypeDeclarationNode.class, new TypeDeclarationEmissionRule());
        statements.register(ConcurrentBlockNode.class, new ConcurrentBlockEmissionRule());
        statements.register(SelectNode.class, new SelectEmissionRule());
    }

    // --- Dispatch ---

    /**
     * Lowers an expression.
     * @param node The expression, may be {@code null}.
     * @return The JavaScript expression; {@code undefined} for {@code null}.
     * @throws org.tova.compiler.diagnostics.CodegenError if no rule handles the node.
     */
    public String expression(AstNode node) {
        if (node == null) return "undefined";
        return expressions.resolve(node).emit(node, this);
    }

    /**
     * @param node A node.
     * @return {@code true} if the node lowers as a statement rather than an expression.
     */
    public boolean isStatement(AstNode node) {
        return statements.has(node.getClass()) && !expressions.has(node.getClass());
    }

    /**
     * Decides whether a function body must be emitted {@code async}.
     * @param body The body statements.
     * @return {@code true} if the body awaits.
     */
    public boolean needsAsync(List<? extends AstNode> body) {
        return containsAwait(body);
    }

    /**
     * Lowers a statement at the current indentation. Nodes without a statement rule are emitted as
     * expression statements.
     * @param node The statement.
     * @return The JavaScript statement.
     */
    public String statement(AstNode node) {
        if (node == null) return "";
        if (statements.has(node.getClass())) {
            return statements.resolve(node).emit(node, this);
        }
        return indent() + expression(node) + ";";
    }

    /**
     * @param nodes Statements.
     * @return The statements, one per line, at the current indentation.
     */
    public String statements(List<AstNode> nodes) {
        return nodes.stream().map(this::statement).filter(s -> !s.isBlank()).collect(Collectors.joining("\n"));
    }

    /**
     * Lowers the statements of a block one level deeper in a fresh scope.
     * @param block The block, may be {@code null}.
     * @return The indented statements without braces.
     */
    public String block(BlockNode block) {
        if (block == null) return "";
        return nested(() -> statements(block.statements()));
    }

    /**
     * Lowers a function body one level deeper. The last expression statement becomes the return value,
     * and a trailing {@code if} with an {@code else} returns from every branch.
     * @param body The body statements.
     * @return The indented body without braces.
     */
    public String functionBody(List<AstNode> body) {
        return functionBody(List.of(), body);
    }

    /**
     * Lowers a function body with the given names already bound in its scope.
     * @param bound Parameter or binding names visible in the body.
     * @param body The body statements.
     * @return The indented body without braces.
     */
    public String functionBody(List<String> bound, List<AstNode> body) {
        return nested(() -> {
            bound.forEach(name -> declare(name, false));
            List<String> lines = new ArrayList<>();
            for (int i = 0; i < body.size(); i++) {
                AstNode stmt = body.get(i);
                boolean last = i == body.size() - 1;
                if (last && stmt instanceof ExpressionStatementNode expr) {
                    lines.add(indent() + "return " + expression(expr.expression()) + ";");
                } else if (last && stmt instanceof IfStatementNode ifStmt && ifStmt.elseBody() != null) {
                    lines.add(ifWithReturns(ifStmt));
                } else {
                    String code = statement(stmt);
                    if (!code.isBlank()) lines.add(code);
                }
            }
            return String.join("\n", lines);
        });
    }

    private String ifWithReturns(IfStatementNode node) {
        StringBuilder code = new StringBuilder();
        code.append(indent()).append("if (").append(expression(node.condition())).append(") {\n")
                .append(functionBody(node.consequent().statements())).append("\n").append(indent()).append("}");
        for (var alt : node.alternates()) {
            code.append(" else if (").append(expression(alt.condition())).append(") {\n")
                    .append(functionBody(alt.body().statements())).append("\n").append(indent()).append("}");
        }
        code.append(" else {\n").append(functionBody(node.elseBody().statements())).append("\n").append(indent()).append("}");
        return code.toString();
    }

    // --- Functions ---

    /**
     * @param params Declared parameters.
     * @return The JavaScript parameter list, defaults included.
     */
    public String params(List<ParameterNode> params) {
        return params.stream()
                .map(p -> p.defaultValue() == null ? p.name() : p.name() + " = " + expression(p.defaultValue()))
                .collect(Collectors.joining(", "));
    }

    /**
     * Searches a function body for {@code ?}. Nested functions and lambdas are not searched since
     * they get their own wrapper.
     * @param nodes The nodes to search.
     * @return {@code true} if any node propagates.
     */
    public static boolean containsPropagate(List<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            if (node == null || node instanceof FunctionDeclarationNode || node instanceof LambdaNode) continue;
            if (node instanceof PropagateNode) return true;
            if (containsPropagate(node.getChildren())) return true;
        }
        return false;
    }

    /**
     * Searches for {@code await} outside nested functions and lambdas. Concurrent and select
     * blocks await internally.
     * @param nodes The nodes to search.
     * @return {@code true} if any node awaits.
     */
    public static boolean containsAwait(List<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            if (node == null || node instanceof FunctionDeclarationNode || node instanceof LambdaNode) continue;
            if (node instanceof AwaitNode || node instanceof ConcurrentBlockNode || node instanceof SelectNode) return true;
            if (containsAwait(node.getChildren())) return true;
        }
        return false;
    }

    /**
     * Wraps a function body so that a propagated failure becomes the function's return value.
     * @param body The indented body.
     * @return The wrapped body, at the same indentation.
     */
    public String wrapPropagation(String body) {
        String inner = indent() + INDENT;
        String indentedBody = body.lines().map(line -> INDENT + line).collect(Collectors.joining("\n"));
        return inner + "try {\n"
                + indentedBody + "\n"
                + inner + "} catch (__e) {\n"
                + inner + INDENT + "if (__e && __e.__tova_propagate) return __e.value;\n"
                + inner + INDENT + "throw __e;\n"
                + inner + "}";
    }

    // --- Layout and naming ---

    /**
     * @return The current indentation.
     */
    public String indent() {
        return INDENT.repeat(indent);
    }

    /**
     * Runs an emitter one level deeper in a fresh scope.
     * @param emitter Produces the nested code.
     * @return What the emitter produced.
     */
    public String nested(Supplier<String> emitter) {
        indent++;
        pushScope();
        try {
            return emitter.get();
        } finally {
            popScope();
            indent--;
        }
    }

    public void pushScope() {
        scopes.push(new HashMap<>());
    }

    public void popScope() {
        scopes.pop();
    }

    /**
     * Binds a name in the current JavaScript scope.
     * @param name The name.
     * @param mutable {@code true} for {@code let} bindings.
     */
    public void declare(String name, boolean mutable) {
        scopes.peek().put(name, mutable);
    }

    /**
     * @param name A name.
     * @return Whether the innermost binding of the name is mutable, or {@code null} if it is unbound.
     */
    public Boolean lookup(String name) {
        for (Map<String, Boolean> scope : scopes) {
            Boolean mutable = scope.get(name);
            if (mutable != null) return mutable;
        }
        return null;
    }

    /**
     * @param name A name.
     * @return {@code true} if the name is bound in the innermost scope.
     */
    public boolean isDeclaredHere(String name) {
        return scopes.peek().containsKey(name);
    }

    /**
     * @return A number unique within this compilation, for temporaries.
     */
    public int uid() {
        return context.nextId();
    }

    /**
     * Records the declared field names of a variant so patterns can destructure it.
     * @param variant The variant name.
     * @param fields Its field names.
     */
    public void registerVariant(String variant, List<String> fields) {
        variantFields.put(variant, List.copyOf(fields));
    }

    /**
     * @param variant The variant name.
     * @return Its declared field names; empty if unknown.
     */
    public List<String> variantFields(String variant) {
        return variantFields.getOrDefault(variant, List.of());
    }

    /**
     * @param text Any string.
     * @return A double-quoted JavaScript string literal.
     */
    public static String quote(String text) {
        return JS_STRINGS.toJson(text);
    }

    /**
     * @param value A literal value from the AST: string, number, boolean or {@code null}.
     * @return Its JavaScript spelling.
     */
    public static String literal(Object value) {
        if (value == null) return "null";
        if (value instanceof String text) return quote(text);
        if (value instanceof Double d && d == Math.rint(d) && !d.isInfinite()) return Long.toString(d.longValue());
        return value.toString();
    }

    public EmissionContext context() {
        return context;
    }
}
