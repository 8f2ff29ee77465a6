package org.tova.compiler.backend.emit.features;

import org.tova.compiler.backend.BaseCodegen;
import org.tova.compiler.backend.emit.EmissionRegistry;
import org.tova.compiler.frontend.parser.ast.AssignmentNode;
import org.tova.compiler.frontend.parser.ast.BlockNode;
import org.tova.compiler.frontend.parser.ast.BreakNode;
import org.tova.compiler.frontend.parser.ast.CompoundAssignmentNode;
import org.tova.compiler.frontend.parser.ast.ConditionalBranchNode;
import org.tova.compiler.frontend.parser.ast.ContinueNode;
import org.tova.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.tova.compiler.frontend.parser.ast.ForNode;
import org.tova.compiler.frontend.parser.ast.GuardNode;
import org.tova.compiler.frontend.parser.ast.IdentifierNode;
import org.tova.compiler.frontend.parser.ast.IfStatementNode;
import org.tova.compiler.frontend.parser.ast.ImportNode;
import org.tova.compiler.frontend.parser.ast.LetDestructureNode;
import org.tova.compiler.frontend.parser.ast.ReturnNode;
import org.tova.compiler.frontend.parser.ast.TryCatchNode;
import org.tova.compiler.frontend.parser.ast.VarDeclarationNode;
import org.tova.compiler.frontend.parser.ast.WhileNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Emission rules for statements: bindings, assignments and structured control flow.
 * Each rule returns its code prefixed with the current indentation.
 */
public final class StatementRules {

    private StatementRules() {}

    /**
     * Registers every rule of this class.
     * @param registry The statement registry of a backend.
     */
    public static void registerAll(EmissionRegistry registry) {
        registry.register(ExpressionStatementNode.class, (node, gen) -> gen.indent() + gen.expression(node.expression()) + ";");
        registry.register(AssignmentNode.class, StatementRules::assignment);
        registry.register(VarDeclarationNode.class, (node, gen) -> {
            String value = gen.expression(node.value());
            gen.declare(node.name(), true);
            return gen.indent() + "let " + node.name() + " = " + value + ";";
        });
        registry.register(LetDestructureNode.class, StatementRules::destructure);
        registry.register(CompoundAssignmentNode.class, StatementRules::compoundAssignment);
        registry.register(ReturnNode.class, (node, gen) -> node.value() == null
                ? gen.indent() + "return;"
                : gen.indent() + "return " + gen.expression(node.value()) + ";");
        registry.register(BreakNode.class, (node, gen) -> gen.indent() + "break;");
        registry.register(ContinueNode.class, (node, gen) -> gen.indent() + "continue;");
        registry.register(BlockNode.class, (node, gen) -> gen.indent() + "{\n" + gen.block(node) + "\n" + gen.indent() + "}");
        registry.register(IfStatementNode.class, StatementRules::ifStatement);
        registry.register(WhileNode.class, (node, gen) -> gen.indent() + "while (" + gen.expression(node.condition()) + ") {\n"
                + gen.block(node.body()) + "\n" + gen.indent() + "}");
        registry.register(ForNode.class, StatementRules::forLoop);
        registry.register(GuardNode.class, (node, gen) -> gen.indent() + "if (!(" + gen.expression(node.condition()) + ")) {\n"
                + gen.block(node.elseBody()) + "\n" + gen.indent() + "}");
        registry.register(TryCatchNode.class, StatementRules::tryCatch);
        registry.register(ImportNode.class, StatementRules::importStatement);
    }

    /**
     * The first assignment to a name declares it with {@code const}; later assignments to a
     * {@code var} binding are plain. Assigning an immutable name of an enclosing scope shadows it.
     */
    public static String assignment(AssignmentNode node, BaseCodegen gen) {
        String value = gen.expression(node.value());
        if (!(node.target() instanceof IdentifierNode id)) {
            return gen.indent() + gen.expression(node.target()) + " = " + value + ";";
        }
        String name = id.name();
        if (name.equals("_")) return gen.indent() + value + ";";
        Boolean mutable = gen.lookup(name);
        if (mutable == null || (!mutable && !gen.isDeclaredHere(name))) {
            gen.declare(name, false);
            return gen.indent() + "const " + name + " = " + value + ";";
        }
        return gen.indent() + name + " = " + value + ";";
    }

    public static String compoundAssignment(CompoundAssignmentNode node, BaseCodegen gen) {
        return gen.indent() + gen.expression(node.target()) + " " + node.operator().js() + "= " + gen.expression(node.value()) + ";";
    }

    private static String destructure(LetDestructureNode node, BaseCodegen gen) {
        String value = gen.expression(node.value());
        node.names().stream().filter(n -> !n.equals("_")).forEach(n -> gen.declare(n, false));
        String names = String.join(", ", node.names().stream().map(n -> n.equals("_") ? "" : n).toList());
        String pattern = node.kind() == LetDestructureNode.Kind.OBJECT ? "{ " + names + " }" : "[" + names + "]";
        return gen.indent() + "const " + pattern + " = " + value + ";";
    }

    private static String ifStatement(IfStatementNode node, BaseCodegen gen) {
        StringBuilder out = new StringBuilder();
        out.append(gen.indent()).append("if (").append(gen.expression(node.condition())).append(") {\n")
                .append(gen.block(node.consequent())).append("\n").append(gen.indent()).append("}");
        for (ConditionalBranchNode branch : node.alternates()) {
            out.append(" else if (").append(gen.expression(branch.condition())).append(") {\n")
                    .append(gen.block(branch.body())).append("\n").append(gen.indent()).append("}");
        }
        if (node.elseBody() != null) {
            out.append(" else {\n").append(gen.block(node.elseBody())).append("\n").append(gen.indent()).append("}");
        }
        return out.toString();
    }

    private static String forLoop(ForNode node, BaseCodegen gen) {
        String binding = node.variables().size() == 1
                ? node.variables().get(0)
                : "[" + String.join(", ", node.variables()) + "]";
        String iterable = gen.expression(node.iterable());
        if (node.elseBody() == null) {
            return gen.indent() + "for (const " + binding + " of " + iterable + ") {\n"
                    + loopBody(node, gen, null) + "\n" + gen.indent() + "}";
        }
        // for-else: the else body runs when the loop never entered
        int id = gen.uid();
        String iter = "__iter_" + id;
        String entered = "__entered_" + id;
        String indent = gen.indent();
        String inner = gen.nested(gen::indent);
        return indent + "{\n"
                + inner + "const " + iter + " = " + iterable + ";\n"
                + inner + "let " + entered + " = false;\n"
                + inner + "for (const " + binding + " of " + iter + ") {\n"
                + gen.nested(() -> loopBody(node, gen, entered)) + "\n"
                + inner + "}\n"
                + inner + "if (!" + entered + ") {\n"
                + gen.nested(() -> gen.block(node.elseBody())) + "\n"
                + inner + "}\n"
                + indent + "}";
    }

    private static String loopBody(ForNode node, BaseCodegen gen, String enteredFlag) {
        return gen.nested(() -> {
            node.variables().forEach(v -> gen.declare(v, false));
            List<String> lines = new ArrayList<>();
            if (enteredFlag != null) lines.add(gen.indent() + enteredFlag + " = true;");
            String body = gen.statements(node.body().statements());
            if (!body.isBlank()) lines.add(body);
            return String.join("\n", lines);
        });
    }

    private static String tryCatch(TryCatchNode node, BaseCodegen gen) {
        StringBuilder out = new StringBuilder();
        out.append(gen.indent()).append("try {\n").append(gen.block(node.tryBody())).append("\n").append(gen.indent()).append("}");
        if (node.catchBody() != null) {
            String param = node.catchParam() == null ? "__err" : node.catchParam();
            String body = gen.nested(() -> {
                gen.declare(param, false);
                return gen.statements(node.catchBody().statements());
            });
            out.append(" catch (").append(param).append(") {\n").append(body).append("\n").append(gen.indent()).append("}");
        }
        if (node.finallyBody() != null) {
            out.append(" finally {\n").append(gen.block(node.finallyBody())).append("\n").append(gen.indent()).append("}");
        }
        return out.toString();
    }

    private static String importStatement(ImportNode node, BaseCodegen gen) {
        List<String> clauses = new ArrayList<>();
        if (node.defaultName() != null) {
            clauses.add(node.defaultName());
            gen.declare(node.defaultName(), false);
        }
        if (!node.names().isEmpty()) {
            clauses.add("{ " + String.join(", ", node.names()) + " }");
            node.names().forEach(n -> gen.declare(n, false));
        }
        return gen.indent() + "import " + String.join(", ", clauses) + " from " + BaseCodegen.quote(node.source()) + ";";
    }
}
