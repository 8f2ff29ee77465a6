package org.tova.compiler.frontend.parser.features.jsx;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * One attribute of a start tag. Event handlers use the {@code on:} prefix and actions the
 * {@code use:} prefix.
 *
 * @param name The attribute name including any prefix.
 * @param value The value expression; {@code null} for a bare {@code use:} directive.
 * @param loc The source location.
 */
public record JsxAttributeNode(String name, AstNode value, SourceInfo loc) implements AstNode {

    /** @return true for {@code on:event} attributes. */
    public boolean isEvent() {
        return name.startsWith("on:");
    }

    /** @return true for {@code use:action} directives. */
    public boolean isAction() {
        return name.startsWith("use:");
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(value);
    }
}
