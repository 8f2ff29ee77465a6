package org.tova.compiler.backend.emit.features;

import org.tova.compiler.backend.BaseCodegen;
import org.tova.compiler.backend.emit.IEmissionRule;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.BlockNode;
import org.tova.compiler.frontend.parser.ast.ConditionalBranchNode;
import org.tova.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.tova.compiler.frontend.parser.ast.IfExpressionNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers an if-expression to nested ternaries when every branch is a single expression,
 * otherwise to an immediately invoked arrow function.
 */
public class IfExpressionEmissionRule implements IEmissionRule<IfExpressionNode> {

    @Override
    public String emit(IfExpressionNode node, BaseCodegen gen) {
        List<BlockNode> branches = new ArrayList<>();
        branches.add(node.consequent());
        node.alternates().forEach(alt -> branches.add(alt.body()));
        if (node.elseBranch() != null) branches.add(node.elseBranch());

        if (branches.stream().allMatch(IfExpressionEmissionRule::isSimple)) {
            return ternary(node, gen);
        }
        return iife(node, gen);
    }

    private static boolean isSimple(BlockNode block) {
        return block.statements().size() == 1 && block.statements().get(0) instanceof ExpressionStatementNode;
    }

    private static String value(BlockNode block, BaseCodegen gen) {
        return gen.expression(((ExpressionStatementNode) block.statements().get(0)).expression());
    }

    private String ternary(IfExpressionNode node, BaseCodegen gen) {
        String tail = node.elseBranch() == null ? "undefined" : value(node.elseBranch(), gen);
        for (int i = node.alternates().size() - 1; i >= 0; i--) {
            ConditionalBranchNode alt = node.alternates().get(i);
            tail = "(" + gen.expression(alt.condition()) + " ? " + value(alt.body(), gen) + " : " + tail + ")";
        }
        return "(" + gen.expression(node.condition()) + " ? " + value(node.consequent(), gen) + " : " + tail + ")";
    }

    private String iife(IfExpressionNode node, BaseCodegen gen) {
        List<AstNode> all = node.getChildren();
        boolean async = gen.needsAsync(all);
        String body = gen.nested(() -> {
            StringBuilder out = new StringBuilder();
            out.append(gen.indent()).append("if (").append(gen.expression(node.condition())).append(") {\n")
                    .append(gen.functionBody(node.consequent().statements())).append("\n").append(gen.indent()).append("}");
            for (ConditionalBranchNode alt : node.alternates()) {
                out.append(" else if (").append(gen.expression(alt.condition())).append(") {\n")
                        .append(gen.functionBody(alt.body().statements())).append("\n").append(gen.indent()).append("}");
            }
            if (node.elseBranch() != null) {
                out.append(" else {\n").append(gen.functionBody(node.elseBranch().statements())).append("\n")
                        .append(gen.indent()).append("}");
            }
            return out.toString();
        });
        String call = "(" + (async ? "async " : "") + "() => {\n" + body + "\n" + gen.indent() + "})()";
        return async ? "(await " + call + ")" : call;
    }
}
