package org.tova.compiler.frontend.parser.features.jsx;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * A JSX element such as {@code <button on:click={inc}>Add</button>}. Tags starting with an
 * upper-case letter refer to components.
 *
 * @param tag The tag name.
 * @param attributes {@link JsxAttributeNode}s and {@link JsxSpreadAttributeNode}s in source order.
 * @param children Text, expression, element and control children.
 * @param selfClosing Whether the element was written as {@code <tag />}.
 * @param loc The source location.
 */
public record JsxElementNode(
        String tag,
        List<AstNode> attributes,
        List<AstNode> children,
        boolean selfClosing,
        SourceInfo loc
) implements AstNode {

    /**
     * @return true if the tag names a component rather than a DOM element.
     */
    public boolean isComponent() {
        return !tag.isEmpty() && Character.isUpperCase(tag.charAt(0));
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(attributes, children);
    }
}
