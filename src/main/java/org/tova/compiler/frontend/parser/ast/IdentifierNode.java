package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

/**
 * A reference to a named binding.
 *
 * @param name The identifier text.
 * @param loc The source location.
 */
public record IdentifierNode(String name, SourceInfo loc) implements AstNode {
}
