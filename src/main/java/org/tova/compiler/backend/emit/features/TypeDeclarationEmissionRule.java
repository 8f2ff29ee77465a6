package org.tova.compiler.backend.emit.features;

import org.tova.compiler.backend.BaseCodegen;
import org.tova.compiler.backend.emit.IEmissionRule;
import org.tova.compiler.frontend.parser.ast.TypeDeclarationNode;
import org.tova.compiler.frontend.parser.ast.TypeFieldNode;
import org.tova.compiler.frontend.parser.ast.TypeVariantNode;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Lowers type declarations. Variants become frozen objects tagged with {@code __tag} (a constant
 * for fieldless variants, a constructor function otherwise). Records become constructor functions.
 * {@code derive(Eq, Show, JSON)} adds the matching helpers.
 */
public class TypeDeclarationEmissionRule implements IEmissionRule<TypeDeclarationNode> {

    @Override
    public String emit(TypeDeclarationNode node, BaseCodegen gen) {
        String indent = gen.indent();
        List<String> lines = new ArrayList<>();
        if (!node.variants().isEmpty()) {
            for (TypeVariantNode variant : node.variants()) {
                List<String> fields = names(variant.fields());
                gen.registerVariant(variant.name(), fields);
                gen.declare(variant.name(), false);
                String tag = "__tag: " + BaseCodegen.quote(variant.name());
                if (fields.isEmpty()) {
                    lines.add(indent + "const " + variant.name() + " = Object.freeze({ " + tag + " });");
                } else {
                    lines.add(indent + "function " + variant.name() + "(" + String.join(", ", fields) + ") { return Object.freeze({ "
                            + tag + ", " + String.join(", ", fields) + " }); }");
                }
            }
            node.derives().forEach(trait -> deriveForVariants(node.name(), trait, indent, lines));
        } else if (!node.fields().isEmpty()) {
            List<String> fields = names(node.fields());
            gen.declare(node.name(), false);
            lines.add(indent + "function " + node.name() + "(" + String.join(", ", fields) + ") { return { "
                    + String.join(", ", fields) + " }; }");
            node.derives().forEach(trait -> deriveForRecord(node.name(), fields, trait, indent, lines));
        }
        return String.join("\n", lines);
    }

    private static List<String> names(List<TypeFieldNode> fields) {
        return fields.stream().map(TypeFieldNode::name).toList();
    }

    private static void deriveForRecord(String type, List<String> fields, String trait, String indent, List<String> lines) {
        switch (trait) {
            case "Eq" -> {
                String checks = fields.stream().map(f -> "a." + f + " === b." + f).collect(Collectors.joining(" && "));
                lines.add(indent + type + ".__eq = function(a, b) { return " + (checks.isEmpty() ? "true" : checks) + "; };");
            }
            case "Show" -> {
                String shown = fields.stream().map(f -> f + ": ${JSON.stringify(obj." + f + ")}").collect(Collectors.joining(", "));
                lines.add(indent + type + ".__show = function(obj) { return `" + type + "(" + shown + ")`; };");
            }
            case "JSON" -> {
                lines.add(indent + type + ".toJSON = function(obj) { return JSON.stringify(obj); };");
                String args = fields.stream().map(f -> "o." + f).collect(Collectors.joining(", "));
                lines.add(indent + type + ".fromJSON = function(s) { const o = JSON.parse(s); return " + type + "(" + args + "); };");
            }
            default -> { }
        }
    }

    private static void deriveForVariants(String type, String trait, String indent, List<String> lines) {
        switch (trait) {
            case "Eq" -> lines.add(indent + "function __eq_" + type
                    + "(a, b) { return a.__tag === b.__tag && JSON.stringify(a) === JSON.stringify(b); }");
            case "Show" -> lines.add(indent + "function __show_" + type + "(obj) { return obj.__tag + \"(\" + Object.entries(obj)"
                    + ".filter(([k]) => k !== \"__tag\").map(([k, v]) => k + \": \" + JSON.stringify(v)).join(\", \") + \")\"; }");
            case "JSON" -> lines.add(indent + "function __toJSON_" + type + "(obj) { return JSON.stringify(obj); }");
            default -> { }
        }
    }
}
