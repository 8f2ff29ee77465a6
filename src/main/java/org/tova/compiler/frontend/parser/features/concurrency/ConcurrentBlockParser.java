package org.tova.compiler.frontend.parser.features.concurrency;

import org.tova.compiler.frontend.lexer.Token;
import org.tova.compiler.frontend.lexer.TokenType;
import org.tova.compiler.frontend.parser.ParsingContext;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.Set;

/**
 * Parses {@code concurrent} blocks. {@code concurrent} is a contextual keyword, so detection
 * looks one token ahead.
 */
public final class ConcurrentBlockParser {

    private static final Set<String> MODES = Set.of("all", "cancel_on_error", "first");

    private ConcurrentBlockParser() {
    }

    /**
     * @param context The parsing context.
     * @return true if the cursor is at a concurrent block.
     */
    public static boolean detect(ParsingContext context) {
        if (!context.checkWord("concurrent")) return false;
        Token next = context.peekAt(1);
        return next.type() == TokenType.LEFT_BRACE
                || (next.type() == TokenType.IDENTIFIER && (MODES.contains(next.text()) || next.text().equals("timeout")));
    }

    /**
     * @param context The parsing context positioned at {@code concurrent}.
     * @return The block node.
     */
    public static ConcurrentBlockNode parse(ParsingContext context) {
        Token keyword = context.advance();
        String mode = "all";
        if (context.check(TokenType.IDENTIFIER) && MODES.contains(context.peek().text())) {
            mode = context.advance().text();
        }
        AstNode timeout = null;
        if (context.checkWord("timeout")) {
            context.advance();
            context.consume(TokenType.LEFT_PAREN, "Expected '(' after 'timeout'");
            timeout = context.parseExpression();
            context.consume(TokenType.RIGHT_PAREN, "Expected ')' after timeout");
        }
        return new ConcurrentBlockNode(mode, timeout, context.parseBlock(), keyword.loc());
    }
}
