package org.tova.compiler.frontend.parser.features.deploy;

import org.tova.compiler.frontend.lexer.Token;
import org.tova.compiler.frontend.lexer.TokenType;
import org.tova.compiler.frontend.parser.ParsingContext;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.ConfigFieldNode;
import org.tova.compiler.frontend.parser.block.IBlockHandler;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for {@code deploy} blocks.
 * Expected format: {@code deploy "name" { key: value; env { ... }; db { engine { ... } } }}.
 */
public class DeployBlockHandler implements IBlockHandler {

    @Override
    public boolean detect(ParsingContext context) {
        return context.checkWord("deploy")
                && (context.checkNext(TokenType.LEFT_BRACE) || context.checkNext(TokenType.STRING));
    }

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        if (!context.check(TokenType.STRING)) {
            throw context.error("Deploy block requires a name (e.g., deploy \"prod\" { })");
        }
        String name = (String) context.advance().value();
        List<AstNode> body = context.parseBracedStatements(() -> statement(context));
        return new DeployBlockNode(name, body, keyword.loc());
    }

    private AstNode statement(ParsingContext context) {
        Token token = context.peek();
        AstNode node;
        if (context.checkWord("env") && context.checkNext(TokenType.LEFT_BRACE)) {
            context.advance();
            node = new DeployEnvNode(context.parseConfigBlock(), token.loc());
        } else if (context.checkWord("db") && context.checkNext(TokenType.LEFT_BRACE)) {
            context.advance();
            return databases(context, token);
        } else if (context.checkNext(TokenType.COLON)) {
            String key = context.consumeName("Expected deploy setting name");
            context.advance();
            node = new ConfigFieldNode(key, context.parseExpression(), token.loc());
        } else {
            throw context.error("Expected a setting (key: value), 'env { }' or 'db { }' inside deploy block");
        }
        context.endStatement();
        return node;
    }

    private AstNode databases(ParsingContext context, Token keyword) {
        List<DeployDbNode> engines = new ArrayList<>();
        context.parseBracedStatements(() -> {
            Token engine = context.peek();
            String name = context.consumeName("Expected database engine name");
            List<ConfigFieldNode> fields = context.check(TokenType.LEFT_BRACE) ? context.parseConfigBlock() : List.of();
            context.endStatement();
            DeployDbNode node = new DeployDbNode(name, fields, engine.loc());
            engines.add(node);
            return node;
        });
        context.endStatement();
        return new DeployDatabasesNode(List.copyOf(engines), keyword.loc());
    }
}
