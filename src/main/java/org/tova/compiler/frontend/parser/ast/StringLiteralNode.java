package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

/**
 * A string literal without interpolation.
 *
 * @param value The unescaped text.
 * @param loc The source location.
 */
public record StringLiteralNode(String value, SourceInfo loc) implements AstNode {
}
