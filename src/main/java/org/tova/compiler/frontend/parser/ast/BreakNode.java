package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

/**
 * {@code break}.
 *
 * @param loc The location of the keyword.
 */
public record BreakNode(SourceInfo loc) implements AstNode {
}
