package org.tova.compiler.frontend.parser.features.edge;

import org.tova.compiler.frontend.lexer.Token;
import org.tova.compiler.frontend.lexer.TokenType;
import org.tova.compiler.frontend.parser.ParsingContext;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.BlockNode;
import org.tova.compiler.frontend.parser.ast.ConfigFieldNode;
import org.tova.compiler.frontend.parser.block.IBlockHandler;
import org.tova.compiler.frontend.parser.features.server.ServerBlockHandler;

import java.util.List;
import java.util.Set;

/**
 * Handler for {@code edge} blocks.
 */
public class EdgeBlockHandler implements IBlockHandler {

    private static final Set<String> BINDING_KINDS = Set.of("kv", "sql", "storage", "queue");

    @Override
    public boolean detect(ParsingContext context) {
        return context.checkWord("edge")
                && (context.checkNext(TokenType.LEFT_BRACE) || context.checkNext(TokenType.STRING));
    }

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        String name = context.check(TokenType.STRING) ? (String) context.advance().value() : null;
        List<AstNode> body = context.parseBracedStatements(() -> statement(context));
        return new EdgeBlockNode(name, body, keyword.loc());
    }

    private AstNode statement(ParsingContext context) {
        Token token = context.peek();
        AstNode node;
        if (context.check(TokenType.ROUTE)) {
            node = ServerBlockHandler.parseRoute(context);
        } else if (ServerBlockHandler.isMiddleware(context)) {
            node = ServerBlockHandler.parseMiddleware(context);
        } else if (token.type() != TokenType.IDENTIFIER) {
            return context.parseStatement();
        } else if (BINDING_KINDS.contains(token.text()) && context.checkNext(TokenType.IDENTIFIER)) {
            context.advance();
            String bindingName = context.advance().text();
            List<ConfigFieldNode> config = context.check(TokenType.LEFT_BRACE) ? context.parseConfigBlock() : List.of();
            node = new EdgeBindingNode(token.text(), bindingName, config, token.loc());
        } else if (token.text().equals("env") && context.checkNext(TokenType.IDENTIFIER)) {
            context.advance();
            String variable = context.advance().text();
            AstNode defaultValue = context.match(TokenType.EQUAL) ? context.parseExpression() : null;
            node = new EdgeEnvNode(variable, defaultValue, token.loc());
        } else if (token.text().equals("secret") && context.checkNext(TokenType.IDENTIFIER)) {
            context.advance();
            node = new EdgeSecretNode(context.advance().text(), token.loc());
        } else if (token.text().equals("schedule") && context.checkNext(TokenType.STRING)) {
            context.advance();
            String jobName = (String) context.advance().value();
            if (!context.checkWord("cron")) throw context.error("Expected cron(\"expr\") after schedule name");
            context.advance();
            context.consume(TokenType.LEFT_PAREN, "Expected '(' after 'cron'");
            String cron = (String) context.consume(TokenType.STRING, "Expected cron expression string").value();
            context.consume(TokenType.RIGHT_PAREN, "Expected ')' after cron expression");
            BlockNode body = context.parseBlock();
            node = new EdgeScheduleNode(jobName, cron, body, token.loc());
        } else if (token.text().equals("consume") && context.checkNext(TokenType.IDENTIFIER)) {
            context.advance();
            String queue = context.advance().text();
            node = new EdgeConsumeNode(queue, context.parseExpression(), token.loc());
        } else if (context.checkNext(TokenType.COLON)) {
            context.advance();
            context.advance();
            node = new ConfigFieldNode(token.text(), context.parseExpression(), token.loc());
        } else {
            return context.parseStatement();
        }
        context.endStatement();
        return node;
    }
}
