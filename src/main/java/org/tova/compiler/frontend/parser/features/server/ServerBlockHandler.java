package org.tova.compiler.frontend.parser.features.server;

import org.tova.compiler.frontend.lexer.Token;
import org.tova.compiler.frontend.lexer.TokenType;
import org.tova.compiler.frontend.parser.ParsingContext;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.block.IBlockHandler;

import java.util.List;
import java.util.Set;

/**
 * Handler for {@code server} blocks.
 * Parses routes and middleware; everything else is an ordinary statement.
 */
public class ServerBlockHandler implements IBlockHandler {

    private static final Set<String> METHODS = Set.of("GET", "POST", "PUT", "DELETE", "PATCH", "HEAD", "OPTIONS");

    @Override
    public boolean detect(ParsingContext context) {
        return context.check(TokenType.SERVER)
                && (context.checkNext(TokenType.LEFT_BRACE) || context.checkNext(TokenType.STRING));
    }

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        String name = context.check(TokenType.STRING) ? (String) context.advance().value() : null;
        List<AstNode> body = context.parseBracedStatements(() -> statement(context));
        return new ServerBlockNode(name, body, keyword.loc());
    }

    private AstNode statement(ParsingContext context) {
        AstNode node;
        if (context.check(TokenType.ROUTE)) {
            node = parseRoute(context);
        } else if (isMiddleware(context)) {
            node = parseMiddleware(context);
        } else {
            return context.parseStatement();
        }
        context.endStatement();
        return node;
    }

    /**
     * Parses {@code route METHOD "/path" => handler}. Shared with edge blocks.
     * @param context The context positioned at {@code route}.
     * @return The route node.
     */
    public static RouteNode parseRoute(ParsingContext context) {
        Token keyword = context.consume(TokenType.ROUTE, "Expected 'route'");
        Token method = context.consume(TokenType.IDENTIFIER, "Expected HTTP method after 'route'");
        if (!METHODS.contains(method.text())) {
            throw context.error("Invalid HTTP method '" + method.text() + "'. Expected one of "
                    + String.join(", ", METHODS.stream().sorted().toList()));
        }
        Token path = context.consume(TokenType.STRING, "Expected route path string");
        context.consume(TokenType.FAT_ARROW, "Expected '=>' after route path");
        return new RouteNode(method.text(), (String) path.value(), context.parseExpression(), keyword.loc());
    }

    /**
     * @param context The context.
     * @return true if the cursor is at {@code middleware fn}.
     */
    public static boolean isMiddleware(ParsingContext context) {
        return context.checkWord("middleware") && context.checkNext(TokenType.FN);
    }

    /**
     * Parses {@code middleware fn name(req, next) { }}. Shared with edge blocks.
     * @param context The context positioned at {@code middleware}.
     * @return The middleware node.
     */
    public static MiddlewareNode parseMiddleware(ParsingContext context) {
        Token keyword = context.advance();
        return new MiddlewareNode(context.parseFunctionDeclaration(), keyword.loc());
    }
}
