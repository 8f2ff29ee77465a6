package org.tova.compiler.backend.emit;

import org.tova.compiler.backend.BaseCodegen;
import org.tova.compiler.frontend.parser.ast.AstNode;

/**
 * Lowers one AST node type to JavaScript source.
 * <p>
 * Rules are stateless. Indentation, declared names and tree-shaking state live in the
 * {@link BaseCodegen} passed in.
 *
 * @param <T> The concrete AST node type handled by this rule.
 */
@FunctionalInterface
public interface IEmissionRule<T extends AstNode> {

    /**
     * @param node The node to lower.
     * @param gen The emitting backend, used to lower child nodes.
     * @return The emitted JavaScript. Statement rules include the current indentation.
     */
    String emit(T node, BaseCodegen gen);
}
