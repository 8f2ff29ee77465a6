package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

/**
 * A number, string, boolean or nil pattern compared with strict equality.
 *
 * @param value A {@link Long}, {@link Double}, {@link String}, {@link Boolean} or null for nil.
 * @param loc The source location.
 */
public record LiteralPatternNode(Object value, SourceInfo loc) implements AstNode {
}
