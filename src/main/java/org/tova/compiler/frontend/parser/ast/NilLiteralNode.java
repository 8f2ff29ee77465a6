package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

/**
 * The {@code nil} literal.
 *
 * @param loc The source location.
 */
public record NilLiteralNode(SourceInfo loc) implements AstNode {
}
