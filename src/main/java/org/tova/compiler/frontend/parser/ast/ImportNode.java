package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code import { a, b } from "mod"} or {@code import x from "mod"}.
 *
 * @param names The named imports.
 * @param defaultName The default import, or null.
 * @param source The module specifier.
 * @param loc The location of the keyword.
 */
public record ImportNode(List<String> names, String defaultName, String source, SourceInfo loc) implements AstNode {
}
