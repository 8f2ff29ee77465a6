package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

/**
 * The {@code _} pattern.
 *
 * @param loc The source location.
 */
public record WildcardPatternNode(SourceInfo loc) implements AstNode {
}
