package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

/**
 * {@code a..b} or {@code a..=b} with numeric bounds.
 *
 * @param start The lower bound.
 * @param end The upper bound.
 * @param inclusive True for {@code ..=}.
 * @param loc The source location.
 */
public record RangePatternNode(Number start, Number end, boolean inclusive, SourceInfo loc) implements AstNode {
}
