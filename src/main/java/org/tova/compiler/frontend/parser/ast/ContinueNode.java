package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

/**
 * {@code continue}.
 *
 * @param loc The location of the keyword.
 */
public record ContinueNode(SourceInfo loc) implements AstNode {
}
