package org.tova.compiler.frontend.parser.features.client;

import org.tova.compiler.frontend.lexer.Token;
import org.tova.compiler.frontend.lexer.TokenType;
import org.tova.compiler.frontend.parser.ParsingContext;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.ParameterNode;
import org.tova.compiler.frontend.parser.ast.TypeAnnotationNode;
import org.tova.compiler.frontend.parser.block.IBlockHandler;

import java.util.List;

/**
 * Handler for {@code client} blocks.
 * Besides ordinary statements a client block accepts {@code state}, {@code computed}, {@code effect},
 * {@code component}, {@code store} and {@code style}.
 */
public class ClientBlockHandler implements IBlockHandler {

    @Override
    public boolean detect(ParsingContext context) {
        return context.check(TokenType.CLIENT)
                && (context.checkNext(TokenType.LEFT_BRACE) || context.checkNext(TokenType.STRING));
    }

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        String name = context.check(TokenType.STRING) ? (String) context.advance().value() : null;
        List<AstNode> body = context.parseBracedStatements(() -> statement(context));
        return new ClientBlockNode(name, body, keyword.loc());
    }

    private AstNode statement(ParsingContext context) {
        Token token = context.peek();
        AstNode node;
        switch (token.type()) {
            case STATE -> {
                context.advance();
                String name = context.consume(TokenType.IDENTIFIER, "Expected state name").text();
                TypeAnnotationNode type = context.match(TokenType.COLON) ? context.parseTypeAnnotation() : null;
                context.consume(TokenType.EQUAL, "Expected '=' after state name");
                node = new StateNode(name, type, context.parseExpression(), token.loc());
            }
            case COMPUTED -> {
                context.advance();
                String name = context.consume(TokenType.IDENTIFIER, "Expected computed name").text();
                context.consume(TokenType.EQUAL, "Expected '=' after computed name");
                node = new ComputedNode(name, context.parseExpression(), token.loc());
            }
            case EFFECT -> {
                if (!context.checkNext(TokenType.LEFT_BRACE)) return context.parseStatement();
                context.advance();
                node = new EffectNode(context.parseBlock(), token.loc());
            }
            case COMPONENT -> {
                context.advance();
                String name = context.consume(TokenType.IDENTIFIER, "Expected component name").text();
                List<ParameterNode> params = context.check(TokenType.LEFT_PAREN) ? context.parseParameters() : List.of();
                node = new ComponentNode(name, params, context.parseBracedStatements(() -> statement(context)), token.loc());
            }
            case STORE -> {
                context.advance();
                String name = context.consume(TokenType.IDENTIFIER, "Expected store name").text();
                node = new StoreNode(name, context.parseBracedStatements(() -> statement(context)), token.loc());
            }
            case STYLE_BLOCK -> {
                context.advance();
                node = new StyleNode((String) token.value(), token.loc());
            }
            default -> {
                return context.parseStatement();
            }
        }
        context.endStatement();
        return node;
    }
}
