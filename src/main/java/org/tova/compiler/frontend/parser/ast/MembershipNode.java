package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code x in xs} or {@code x not in xs}.
 *
 * @param value The searched value.
 * @param collection The searched collection.
 * @param negated True for {@code not in}.
 * @param loc The location of the value.
 */
public record MembershipNode(AstNode value, AstNode collection, boolean negated, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(value, collection);
    }
}
