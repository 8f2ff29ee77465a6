package org.tova.compiler.frontend.parser.features.edge;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

/**
 * {@code secret NAME}.
 *
 * @param name The secret name.
 * @param loc The source location.
 */
public record EdgeSecretNode(String name, SourceInfo loc) implements AstNode {
}
