package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code obj.prop} or {@code obj?.prop}.
 *
 * @param object The accessed object.
 * @param property The property name.
 * @param optional True for optional chaining.
 * @param loc The location of the object.
 */
public record MemberAccessNode(AstNode object, String property, boolean optional, SourceInfo loc) implements AstNode {
    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(object);
    }
}
