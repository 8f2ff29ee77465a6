package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

/**
 * {@code true} or {@code false}.
 *
 * @param value The literal value.
 * @param loc The source location.
 */
public record BooleanLiteralNode(boolean value, SourceInfo loc) implements AstNode {
}
