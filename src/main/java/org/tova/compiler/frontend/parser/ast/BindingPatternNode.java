package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

/**
 * A lowercase name that matches anything and binds it.
 *
 * @param name The bound name.
 * @param loc The source location.
 */
public record BindingPatternNode(String name, SourceInfo loc) implements AstNode {
}
