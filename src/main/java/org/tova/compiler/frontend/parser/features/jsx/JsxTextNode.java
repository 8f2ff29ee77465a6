package org.tova.compiler.frontend.parser.features.jsx;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

/**
 * Literal text between tags.
 *
 * @param text The text, trailing whitespace removed.
 * @param loc The source location.
 */
public record JsxTextNode(String text, SourceInfo loc) implements AstNode {
}
