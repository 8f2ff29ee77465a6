package org.tova.compiler.frontend.parser.features.security;

import org.tova.compiler.frontend.lexer.Token;
import org.tova.compiler.frontend.lexer.TokenType;
import org.tova.compiler.frontend.parser.ParsingContext;
import org.tova.compiler.frontend.parser.ast.ArrayLiteralNode;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.ConfigFieldNode;
import org.tova.compiler.frontend.parser.ast.IdentifierNode;
import org.tova.compiler.frontend.parser.ast.StringLiteralNode;
import org.tova.compiler.frontend.parser.block.IBlockHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Handler for {@code security} blocks.
 */
public class SecurityBlockHandler implements IBlockHandler {

    private static final Set<String> POLICIES = Set.of("cors", "csp", "rate_limit", "csrf", "audit", "hsts");

    @Override
    public boolean detect(ParsingContext context) {
        return context.checkWord("security") && context.checkNext(TokenType.LEFT_BRACE);
    }

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        return new SecurityBlockNode(context.parseBracedStatements(() -> statement(context)), keyword.loc());
    }

    private AstNode statement(ParsingContext context) {
        Token token = context.peek();
        String word = token.type() == TokenType.IDENTIFIER ? token.text() : "";
        AstNode node;
        switch (word) {
            case "auth" -> {
                context.advance();
                String authType = context.consumeName("Expected auth type after 'auth'");
                node = new SecurityAuthNode(authType, configOrEmpty(context), token.loc());
            }
            case "role" -> {
                context.advance();
                String name = context.consume(TokenType.IDENTIFIER, "Expected role name").text();
                node = new SecurityRoleNode(name, permissions(context.parseConfigBlock()), token.loc());
            }
            case "protect" -> {
                context.advance();
                String pattern = (String) context.consume(TokenType.STRING, "Expected route pattern string after 'protect'").value();
                node = new SecurityProtectNode(pattern, configOrEmpty(context), token.loc());
            }
            case "sensitive" -> {
                context.advance();
                String typeName = context.consume(TokenType.IDENTIFIER, "Expected type name after 'sensitive'").text();
                context.consume(TokenType.DOT, "Expected '.' between type and field");
                String field = context.consumeName("Expected field name");
                node = new SecuritySensitiveNode(typeName, field, configOrEmpty(context), token.loc());
            }
            case "trust_proxy" -> {
                context.advance();
                node = new SecurityTrustProxyNode(context.parseExpression(), token.loc());
            }
            default -> {
                if (!POLICIES.contains(word)) {
                    throw context.error("Unknown security declaration '" + token.text()
                            + "'. Expected auth, role, protect, sensitive, trust_proxy or a policy ("
                            + String.join(", ", POLICIES.stream().sorted().toList()) + ")");
                }
                context.advance();
                node = new SecurityPolicyNode(word, context.parseConfigBlock(), token.loc());
            }
        }
        context.endStatement();
        return node;
    }

    private static List<ConfigFieldNode> configOrEmpty(ParsingContext context) {
        return context.check(TokenType.LEFT_BRACE) ? context.parseConfigBlock() : List.of();
    }

    private static List<String> permissions(List<ConfigFieldNode> fields) {
        List<String> permissions = new ArrayList<>();
        for (ConfigFieldNode field : fields) {
            if (!field.key().equals("can") || !(field.value() instanceof ArrayLiteralNode array)) continue;
            for (AstNode element : array.elements()) {
                if (element instanceof IdentifierNode id) permissions.add(id.name());
                else if (element instanceof StringLiteralNode str) permissions.add(str.value());
            }
        }
        return List.copyOf(permissions);
    }
}
