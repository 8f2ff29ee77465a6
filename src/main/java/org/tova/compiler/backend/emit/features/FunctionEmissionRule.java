package org.tova.compiler.backend.emit.features;

import org.tova.compiler.backend.BaseCodegen;
import org.tova.compiler.backend.emit.IEmissionRule;
import org.tova.compiler.frontend.parser.ast.FunctionDeclarationNode;
import org.tova.compiler.frontend.parser.ast.ParameterNode;

/**
 * Lowers a function declaration. A body that uses {@code ?} is wrapped so the propagated
 * failure becomes the return value.
 */
public class FunctionEmissionRule implements IEmissionRule<FunctionDeclarationNode> {

    @Override
    public String emit(FunctionDeclarationNode node, BaseCodegen gen) {
        gen.declare(node.name(), false);
        return gen.indent() + (isAsync(node, gen) ? "async " : "") + "function " + node.name()
                + "(" + gen.params(node.params()) + ") {\n" + body(node, gen) + "\n" + gen.indent() + "}";
    }

    /**
     * @param node The function.
     * @param gen The backend.
     * @return The indented body, wrapped for propagation when needed.
     */
    public static String body(FunctionDeclarationNode node, BaseCodegen gen) {
        String code = gen.functionBody(node.params().stream().map(ParameterNode::name).toList(), node.body().statements());
        if (BaseCodegen.containsPropagate(node.body().statements())) {
            code = gen.wrapPropagation(code);
        }
        return code;
    }

    /**
     * Targets may force functions async, e.g. when they call the server.
     */
    protected boolean isAsync(FunctionDeclarationNode node, BaseCodegen gen) {
        return node.async() || gen.needsAsync(node.body().statements());
    }
}
