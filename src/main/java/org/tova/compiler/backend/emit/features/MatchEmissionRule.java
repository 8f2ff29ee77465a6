package org.tova.compiler.backend.emit.features;

import org.tova.compiler.backend.BaseCodegen;
import org.tova.compiler.backend.emit.IEmissionRule;
import org.tova.compiler.frontend.parser.ast.ArrayPatternNode;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.BindingPatternNode;
import org.tova.compiler.frontend.parser.ast.BlockNode;
import org.tova.compiler.frontend.parser.ast.LiteralPatternNode;
import org.tova.compiler.frontend.parser.ast.MatchArmNode;
import org.tova.compiler.frontend.parser.ast.MatchNode;
import org.tova.compiler.frontend.parser.ast.RangePatternNode;
import org.tova.compiler.frontend.parser.ast.VariantPatternNode;
import org.tova.compiler.frontend.parser.ast.WildcardPatternNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lowers {@code match} to an immediately invoked arrow function holding an if-chain over the arms.
 * The subject is evaluated once and bound to {@code __match}.
 */
public class MatchEmissionRule implements IEmissionRule<MatchNode> {

    private static final String SUBJECT = "__match";

    @Override
    public String emit(MatchNode node, BaseCodegen gen) {
        boolean async = gen.needsAsync(node.arms());
        String body = gen.nested(() -> arms(node.arms(), gen));
        String iife = "(" + (async ? "async " : "") + "(" + SUBJECT + ") => {\n" + body + "\n" + gen.indent() + "})("
                + gen.expression(node.subject()) + ")";
        return async ? "(await " + iife + ")" : iife;
    }

    private String arms(List<MatchArmNode> arms, BaseCodegen gen) {
        StringBuilder out = new StringBuilder();
        for (MatchArmNode arm : arms) {
            Map<String, String> bindings = new LinkedHashMap<>();
            collectBindings(arm.pattern(), SUBJECT, gen, bindings);
            String condition = condition(arm, bindings, gen);
            String armBody = armBody(arm, bindings, gen);
            if (condition == null) {
                // catch-all: later arms are unreachable
                if (out.length() == 0) return dedent(armBody);
                out.append(" else {\n").append(armBody).append("\n").append(gen.indent()).append("}");
                return out.toString();
            }
            out.append(out.length() == 0 ? gen.indent() + "if (" : " else if (").append(condition).append(") {\n")
                    .append(armBody).append("\n").append(gen.indent()).append("}");
        }
        return out.toString();
    }

    private static String dedent(String body) {
        return body.lines().map(line -> line.startsWith("  ") ? line.substring(2) : line)
                .reduce((a, b) -> a + "\n" + b).orElse("");
    }

    private String condition(MatchArmNode arm, Map<String, String> bindings, BaseCodegen gen) {
        String pattern = patternCondition(arm.pattern(), SUBJECT, gen);
        if (arm.guard() == null) return pattern;
        String guard = guard(arm.guard(), bindings, gen);
        return pattern == null ? guard : "(" + pattern + ") && " + guard;
    }

    // The guard sees the arm's bindings before the arm is selected.
    private String guard(AstNode guard, Map<String, String> bindings, BaseCodegen gen) {
        String code = gen.nested(() -> {
            bindings.keySet().forEach(n -> gen.declare(n, false));
            return gen.expression(guard);
        });
        if (bindings.isEmpty()) return "(" + code + ")";
        return "((" + String.join(", ", bindings.keySet()) + ") => " + code + ")("
                + String.join(", ", bindings.values()) + ")";
    }

    private String armBody(MatchArmNode arm, Map<String, String> bindings, BaseCodegen gen) {
        List<String> names = new ArrayList<>(bindings.keySet());
        String body;
        if (arm.body() instanceof BlockNode block) {
            body = gen.functionBody(names, block.statements());
        } else {
            body = gen.nested(() -> {
                names.forEach(n -> gen.declare(n, false));
                return gen.indent() + "return " + gen.expression(arm.body()) + ";";
            });
        }
        if (bindings.isEmpty()) return body;
        String inner = gen.nested(gen::indent);
        StringBuilder out = new StringBuilder();
        bindings.forEach((name, path) -> out.append(inner).append("const ").append(name).append(" = ").append(path).append(";\n"));
        return out.append(body).toString();
    }

    /**
     * @param pattern A pattern.
     * @param path The JavaScript expression for the matched value.
     * @param gen The backend.
     * @return The test for the pattern, or {@code null} if it always matches.
     */
    static String patternCondition(AstNode pattern, String path, BaseCodegen gen) {
        if (pattern instanceof WildcardPatternNode || pattern instanceof BindingPatternNode) return null;
        if (pattern instanceof LiteralPatternNode literal) {
            return literal.value() == null ? path + " == null" : path + " === " + BaseCodegen.literal(literal.value());
        }
        if (pattern instanceof RangePatternNode range) {
            return path + " >= " + BaseCodegen.literal(range.start()) + " && " + path
                    + (range.inclusive() ? " <= " : " < ") + BaseCodegen.literal(range.end());
        }
        if (pattern instanceof VariantPatternNode variant) {
            List<String> parts = new ArrayList<>();
            parts.add(path + "?.__tag === " + BaseCodegen.quote(variant.name()));
            for (int i = 0; i < variant.fields().size(); i++) {
                String sub = patternCondition(variant.fields().get(i), fieldPath(variant, i, path, gen), gen);
                if (sub != null) parts.add(sub);
            }
            return String.join(" && ", parts);
        }
        if (pattern instanceof ArrayPatternNode array) {
            List<String> parts = new ArrayList<>();
            parts.add("Array.isArray(" + path + ")");
            parts.add(path + ".length === " + array.elements().size());
            for (int i = 0; i < array.elements().size(); i++) {
                String sub = patternCondition(array.elements().get(i), path + "[" + i + "]", gen);
                if (sub != null) parts.add(sub);
            }
            return String.join(" && ", parts);
        }
        return null;
    }

    static void collectBindings(AstNode pattern, String path, BaseCodegen gen, Map<String, String> out) {
        if (pattern instanceof BindingPatternNode binding) {
            out.put(binding.name(), path);
        } else if (pattern instanceof VariantPatternNode variant) {
            for (int i = 0; i < variant.fields().size(); i++) {
                collectBindings(variant.fields().get(i), fieldPath(variant, i, path, gen), gen, out);
            }
        } else if (pattern instanceof ArrayPatternNode array) {
            for (int i = 0; i < array.elements().size(); i++) {
                collectBindings(array.elements().get(i), path + "[" + i + "]", gen, out);
            }
        }
    }

    private static String fieldPath(VariantPatternNode variant, int index, String path, BaseCodegen gen) {
        List<String> fields = gen.variantFields(variant.name());
        if (index < fields.size()) return path + "." + fields.get(index);
        return "Object.values(" + path + ")[" + (index + 1) + "]";
    }
}
