package org.tova.compiler.frontend.parser.block;

import org.tova.compiler.frontend.parser.ParsingContext;
import org.tova.compiler.frontend.parser.ast.AstNode;

/**
 * The base interface for top-level block handlers.
 * Each handler recognizes one region kind (e.g. {@code client { }}) and parses it with its own sub-grammar.
 */
public interface IBlockHandler {

    /**
     * Checks, without consuming tokens, whether the cursor is at the start of this handler's block.
     * @param context The parsing context.
     * @return {@code true} if {@link #parse(ParsingContext)} should be called.
     */
    boolean detect(ParsingContext context);

    /**
     * Parses the block at the cursor.
     * @param context The parsing context.
     * @return The block node.
     */
    AstNode parse(ParsingContext context);
}
