package org.tova.compiler.frontend.parser.features.client;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

/**
 * A raw {@code style { ... }} block, passed through verbatim.
 *
 * @param css The captured body.
 * @param loc The source location.
 */
public record StyleNode(String css, SourceInfo loc) implements AstNode {
}
