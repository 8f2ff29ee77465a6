package org.tova.compiler.backend.emit.features;

import org.tova.compiler.backend.BaseCodegen;
import org.tova.compiler.backend.emit.IEmissionRule;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.BlockNode;
import org.tova.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.tova.compiler.frontend.parser.ast.LambdaNode;
import org.tova.compiler.frontend.parser.ast.ParameterNode;

import java.util.List;

public class LambdaEmissionRule implements IEmissionRule<LambdaNode> {

    @Override
    public String emit(LambdaNode node, BaseCodegen gen) {
        boolean async = node.async() || gen.needsAsync(List.of(node.body()));
        String head = (async ? "async " : "") + "(" + gen.params(node.params()) + ") => ";
        List<String> names = node.params().stream().map(ParameterNode::name).toList();
        AstNode body = node.body();
        boolean propagates = BaseCodegen.containsPropagate(List.of(body));

        List<AstNode> statements;
        if (body instanceof BlockNode block) {
            statements = block.statements();
        } else if (gen.isStatement(body)) {
            statements = List.of(body);
        } else if (!propagates) {
            String value = gen.nested(() -> {
                names.forEach(n -> gen.declare(n, false));
                return gen.expression(body);
            });
            // an object literal body needs parentheses to not read as a block
            return head + (value.startsWith("{") ? "(" + value + ")" : value);
        } else {
            statements = List.of(new ExpressionStatementNode(body, body.loc()));
        }

        String code = gen.functionBody(names, statements);
        if (propagates) code = gen.wrapPropagation(code);
        return head + "{\n" + code + "\n" + gen.indent() + "}";
    }
}
