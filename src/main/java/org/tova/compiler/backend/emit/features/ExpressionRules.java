package org.tova.compiler.backend.emit.features;

import org.tova.compiler.backend.BaseCodegen;
import org.tova.compiler.backend.emit.EmissionRegistry;
import org.tova.compiler.diagnostics.CodegenError;
import org.tova.compiler.frontend.parser.ast.ArrayLiteralNode;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.AwaitNode;
import org.tova.compiler.frontend.parser.ast.BinaryExpressionNode;
import org.tova.compiler.frontend.parser.ast.BooleanLiteralNode;
import org.tova.compiler.frontend.parser.ast.ChainedComparisonNode;
import org.tova.compiler.frontend.parser.ast.IdentifierNode;
import org.tova.compiler.frontend.parser.ast.IndexAccessNode;
import org.tova.compiler.frontend.parser.ast.ListComprehensionNode;
import org.tova.compiler.frontend.parser.ast.LogicalExpressionNode;
import org.tova.compiler.frontend.parser.ast.MemberAccessNode;
import org.tova.compiler.frontend.parser.ast.MembershipNode;
import org.tova.compiler.frontend.parser.ast.NamedArgumentNode;
import org.tova.compiler.frontend.parser.ast.NilLiteralNode;
import org.tova.compiler.frontend.parser.ast.NumberLiteralNode;
import org.tova.compiler.frontend.parser.ast.ObjectLiteralNode;
import org.tova.compiler.frontend.parser.ast.ObjectPropertyNode;
import org.tova.compiler.frontend.parser.ast.Operator;
import org.tova.compiler.frontend.parser.ast.PropagateNode;
import org.tova.compiler.frontend.parser.ast.RangeNode;
import org.tova.compiler.frontend.parser.ast.SliceNode;
import org.tova.compiler.frontend.parser.ast.SpreadNode;
import org.tova.compiler.frontend.parser.ast.StringLiteralNode;
import org.tova.compiler.frontend.parser.ast.TemplateLiteralNode;
import org.tova.compiler.frontend.parser.ast.UnaryExpressionNode;
import org.tova.compiler.frontend.parser.features.concurrency.SpawnNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Emission rules for the expressions that lower one-to-one: literals, operators, member access,
 * collections and the helper-backed forms ({@code in}, ranges, slices, {@code ?}).
 */
public final class ExpressionRules {

    private static final Pattern JS_IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    private ExpressionRules() {}

    /**
     * Registers every rule of this class.
     * @param registry The expression registry of a backend.
     */
    public static void registerAll(EmissionRegistry registry) {
        registry.register(NumberLiteralNode.class, (node, gen) -> BaseCodegen.literal(node.value()));
        registry.register(StringLiteralNode.class, (node, gen) -> BaseCodegen.quote(node.value()));
        registry.register(BooleanLiteralNode.class, (node, gen) -> Boolean.toString(node.value()));
        registry.register(NilLiteralNode.class, (node, gen) -> "null");
        registry.register(IdentifierNode.class, (node, gen) -> node.name());
        registry.register(TemplateLiteralNode.class, ExpressionRules::template);
        registry.register(ArrayLiteralNode.class, (node, gen) -> "[" + list(node.elements(), gen) + "]");
        registry.register(ObjectLiteralNode.class, ExpressionRules::object);
        registry.register(SpreadNode.class, (node, gen) -> "..." + gen.expression(node.argument()));
        registry.register(BinaryExpressionNode.class, ExpressionRules::binary);
        registry.register(LogicalExpressionNode.class, ExpressionRules::logical);
        registry.register(UnaryExpressionNode.class, (node, gen) -> {
            String operand = gen.expression(node.operand());
            // "--" would lex as a decrement
            String gap = operand.startsWith("-") ? " " : "";
            return "(" + node.operator().js() + gap + operand + ")";
        });
        registry.register(ChainedComparisonNode.class, ExpressionRules::chain);
        registry.register(MembershipNode.class, ExpressionRules::membership);
        registry.register(MemberAccessNode.class, (node, gen) ->
                gen.expression(node.object()) + (node.optional() ? "?." : ".") + node.property());
        registry.register(IndexAccessNode.class, (node, gen) ->
                gen.expression(node.object()) + "[" + gen.expression(node.index()) + "]");
        registry.register(SliceNode.class, ExpressionRules::slice);
        registry.register(RangeNode.class, (node, gen) -> {
            gen.context().use("__range");
            return "__range(" + gen.expression(node.start()) + ", " + gen.expression(node.end()) + ", " + node.inclusive() + ")";
        });
        registry.register(AwaitNode.class, (node, gen) -> "(await " + gen.expression(node.argument()) + ")");
        registry.register(PropagateNode.class, (node, gen) -> {
            gen.context().use("__propagate");
            return "__propagate(" + gen.expression(node.expression()) + ")";
        });
        registry.register(ListComprehensionNode.class, ExpressionRules::comprehension);
        registry.register(SpawnNode.class, (node, gen) ->
                "Promise.resolve().then(() => " + gen.expression(node.expression()) + ")");
        registry.register(NamedArgumentNode.class, (node, gen) -> {
            throw new CodegenError("Named argument '" + node.name() + "' outside of a call", node.loc());
        });
    }

    /**
     * @param nodes Expressions.
     * @param gen The backend.
     * @return The expressions separated by commas.
     */
    public static String list(List<AstNode> nodes, BaseCodegen gen) {
        return nodes.stream().map(gen::expression).collect(Collectors.joining(", "));
    }

    /**
     * @param key An object key.
     * @return The key as written in a JavaScript object literal.
     */
    public static String key(String key) {
        return JS_IDENTIFIER.matcher(key).matches() ? key : BaseCodegen.quote(key);
    }

    private static String template(TemplateLiteralNode node, BaseCodegen gen) {
        StringBuilder out = new StringBuilder("`");
        for (TemplateLiteralNode.Segment segment : node.segments()) {
            if (segment.expression() != null) {
                out.append("${").append(gen.expression(segment.expression())).append("}");
            } else {
                out.append(segment.text().replace("\\", "\\\\").replace("`", "\\`").replace("$", "\\$"));
            }
        }
        return out.append("`").toString();
    }

    private static String object(ObjectLiteralNode node, BaseCodegen gen) {
        if (node.entries().isEmpty()) return "{}";
        List<String> parts = new ArrayList<>();
        for (AstNode entry : node.entries()) {
            if (entry instanceof ObjectPropertyNode property) {
                parts.add(key(property.key()) + ": " + gen.expression(property.value()));
            } else {
                parts.add(gen.expression(entry));
            }
        }
        return "{ " + String.join(", ", parts) + " }";
    }

    private static String binary(BinaryExpressionNode node, BaseCodegen gen) {
        if (node.operator() == Operator.MULTIPLY && isStringLiteral(node.left())) {
            return gen.expression(node.left()) + ".repeat(" + gen.expression(node.right()) + ")";
        }
        if (node.operator() == Operator.COALESCE) {
            return coalesce(node.left(), node.right(), gen);
        }
        return "(" + gen.expression(node.left()) + " " + node.operator().js() + " " + gen.expression(node.right()) + ")";
    }

    private static String logical(LogicalExpressionNode node, BaseCodegen gen) {
        if (node.operator() == Operator.COALESCE) {
            return coalesce(node.left(), node.right(), gen);
        }
        return "(" + gen.expression(node.left()) + " " + node.operator().js() + " " + gen.expression(node.right()) + ")";
    }

    // NaN counts as missing, unlike the native ??.
    private static String coalesce(AstNode left, AstNode right, BaseCodegen gen) {
        return "((__tova_v) => __tova_v != null && __tova_v === __tova_v ? __tova_v : "
                + gen.expression(right) + ")(" + gen.expression(left) + ")";
    }

    private static boolean isStringLiteral(AstNode node) {
        return node instanceof StringLiteralNode || node instanceof TemplateLiteralNode;
    }

    private static String chain(ChainedComparisonNode node, BaseCodegen gen) {
        List<String> operands = node.operands().stream().map(gen::expression).toList();
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < node.operators().size(); i++) {
            parts.add("(" + operands.get(i) + " " + node.operators().get(i).js() + " " + operands.get(i + 1) + ")");
        }
        return "(" + String.join(" && ", parts) + ")";
    }

    private static String membership(MembershipNode node, BaseCodegen gen) {
        gen.context().use("__contains");
        String call = "__contains(" + gen.expression(node.collection()) + ", " + gen.expression(node.value()) + ")";
        return node.negated() ? "(!" + call + ")" : call;
    }

    private static String slice(SliceNode node, BaseCodegen gen) {
        String object = gen.expression(node.object());
        if (node.step() != null) {
            gen.context().use("__slice_step");
            return "__slice_step(" + object + ", " + gen.expression(node.start()) + ", "
                    + gen.expression(node.end()) + ", " + gen.expression(node.step()) + ")";
        }
        String start = node.start() == null ? "0" : gen.expression(node.start());
        if (node.end() == null) return object + ".slice(" + start + ")";
        return object + ".slice(" + start + ", " + gen.expression(node.end()) + ")";
    }

    private static String comprehension(ListComprehensionNode node, BaseCodegen gen) {
        String variable = node.variable();
        StringBuilder out = new StringBuilder(gen.expression(node.iterable()));
        if (node.condition() != null) {
            out.append(".filter((").append(variable).append(") => ").append(gen.expression(node.condition())).append(")");
        }
        boolean identity = node.expression() instanceof IdentifierNode id && id.name().equals(variable);
        if (!identity) {
            out.append(".map((").append(variable).append(") => ").append(gen.expression(node.expression())).append(")");
        }
        return out.toString();
    }
}
