package org.tova.compiler.frontend.parser.features.client;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.BlockNode;

import java.util.List;

/**
 * An {@code effect { ... }} block re-run whenever a signal it reads changes.
 *
 * @param body The effect body.
 * @param loc The source location.
 */
public record EffectNode(BlockNode body, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(body);
    }
}
