package org.tova.compiler.frontend.parser.features.shared;

import org.tova.compiler.frontend.lexer.Token;
import org.tova.compiler.frontend.lexer.TokenType;
import org.tova.compiler.frontend.parser.ParsingContext;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.block.IBlockHandler;

/**
 * Handler for {@code shared} blocks, which hold ordinary statements only.
 */
public class SharedBlockHandler implements IBlockHandler {

    @Override
    public boolean detect(ParsingContext context) {
        return context.check(TokenType.SHARED)
                && (context.checkNext(TokenType.LEFT_BRACE) || context.checkNext(TokenType.STRING));
    }

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        String name = context.check(TokenType.STRING) ? (String) context.advance().value() : null;
        return new SharedBlockNode(name, context.parseBracedStatements(context::parseStatement), keyword.loc());
    }
}
