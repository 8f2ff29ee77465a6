package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

/**
 * A named, optionally typed field of a record type or variant.
 *
 * @param name The field name.
 * @param type The annotation, or null.
 * @param loc The location of the name.
 */
public record TypeFieldNode(String name, TypeAnnotationNode type, SourceInfo loc) implements AstNode {
}
