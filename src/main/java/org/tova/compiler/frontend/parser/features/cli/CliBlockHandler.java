package org.tova.compiler.frontend.parser.features.cli;

import org.tova.compiler.frontend.lexer.Token;
import org.tova.compiler.frontend.lexer.TokenType;
import org.tova.compiler.frontend.parser.ParsingContext;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.BlockNode;
import org.tova.compiler.frontend.parser.ast.ConfigFieldNode;
import org.tova.compiler.frontend.parser.block.IBlockHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Handler for {@code cli} blocks.
 */
public class CliBlockHandler implements IBlockHandler {

    private static final Set<String> CONFIG_KEYS = Set.of("name", "version", "description");

    @Override
    public boolean detect(ParsingContext context) {
        return context.checkWord("cli") && context.checkNext(TokenType.LEFT_BRACE);
    }

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        List<ConfigFieldNode> config = new ArrayList<>();
        List<CliCommandNode> commands = new ArrayList<>();
        context.parseBracedStatements(() -> {
            AstNode member = member(context);
            if (member instanceof CliCommandNode command) commands.add(command);
            else config.add((ConfigFieldNode) member);
            context.endStatement();
            return member;
        });
        return new CliBlockNode(List.copyOf(config), List.copyOf(commands), keyword.loc());
    }

    private AstNode member(ParsingContext context) {
        Token token = context.peek();
        if (token.type() == TokenType.IDENTIFIER && CONFIG_KEYS.contains(token.text()) && context.checkNext(TokenType.COLON)) {
            context.advance();
            context.advance();
            return new ConfigFieldNode(token.text(), context.parseExpression(), token.loc());
        }
        boolean async = context.match(TokenType.ASYNC);
        if (!context.match(TokenType.FN)) {
            throw context.error("Expected config field (name: ...) or command (fn ...) inside cli block");
        }
        String name = context.consume(TokenType.IDENTIFIER, "Expected command name").text();
        List<CliParamNode> params = params(context);
        BlockNode body = context.parseBlock();
        return new CliCommandNode(name, params, body, async, token.loc());
    }

    private List<CliParamNode> params(ParsingContext context) {
        context.consume(TokenType.LEFT_PAREN, "Expected '(' after command name");
        List<CliParamNode> params = new ArrayList<>();
        while (!context.check(TokenType.RIGHT_PAREN)) {
            Token start = context.peek();
            boolean flag = false;
            if (context.match(TokenType.MINUS)) {
                context.consume(TokenType.MINUS, "Expected '--' before flag name");
                flag = true;
            }
            String name = context.consume(TokenType.IDENTIFIER, "Expected parameter name").text();
            String type = "String";
            boolean repeated = false;
            boolean optional = false;
            if (context.match(TokenType.COLON)) {
                if (context.match(TokenType.LEFT_BRACKET)) {
                    type = context.consume(TokenType.IDENTIFIER, "Expected element type").text();
                    context.consume(TokenType.RIGHT_BRACKET, "Expected ']' after element type");
                    repeated = true;
                } else {
                    type = context.consume(TokenType.IDENTIFIER, "Expected parameter type").text();
                }
                optional = context.match(TokenType.QUESTION);
            }
            AstNode defaultValue = context.match(TokenType.EQUAL) ? context.parseExpression() : null;
            if (defaultValue != null || (flag && type.equals("Bool"))) optional = true;
            params.add(new CliParamNode(name, type, defaultValue, flag, optional, repeated, start.loc()));
            if (!context.match(TokenType.COMMA)) break;
        }
        context.consume(TokenType.RIGHT_PAREN, "Expected ')' after parameters");
        return List.copyOf(params);
    }
}
