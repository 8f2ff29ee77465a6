package org.tova.compiler.frontend.parser.features.security;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * A {@code security { ... }} block. All security blocks of a program are merged.
 *
 * @param body The declarations.
 * @param loc The source location.
 */
public record SecurityBlockNode(List<AstNode> body, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return body;
    }
}
