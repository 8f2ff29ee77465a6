package org.tova.compiler.frontend.parser;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.diagnostics.ParseError;
import org.tova.compiler.frontend.lexer.Token;
import org.tova.compiler.frontend.lexer.TokenType;
import org.tova.compiler.frontend.parser.ast.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses the left-hand side of a match arm.
 */
class PatternParser {

    private final ParsingContext context;

    PatternParser(ParsingContext context) {
        this.context = context;
    }

    /**
     * Parses one pattern and rejects duplicate binding names inside it.
     * @return The pattern node.
     */
    AstNode parse() {
        AstNode pattern = pattern();
        checkDuplicateBindings(pattern, new HashSet<>());
        return pattern;
    }

    private AstNode pattern() {
        Token token = context.peek();
        switch (token.type()) {
            case MINUS: {
                context.advance();
                Token number = context.consume(TokenType.NUMBER, "Expected a number after '-' in pattern");
                return numberOrRange(negate((Number) number.value()), token);
            }
            case NUMBER:
                context.advance();
                return numberOrRange((Number) token.value(), token);
            case STRING:
                context.advance();
                return new LiteralPatternNode(token.value(), token.loc());
            case TRUE:
            case FALSE:
                context.advance();
                return new LiteralPatternNode(token.type() == TokenType.TRUE, token.loc());
            case NIL:
                context.advance();
                return new LiteralPatternNode(null, token.loc());
            case LEFT_BRACKET:
                context.advance();
                List<AstNode> elements = new ArrayList<>();
                while (!context.check(TokenType.RIGHT_BRACKET)) {
                    elements.add(pattern());
                    if (!context.match(TokenType.COMMA)) break;
                }
                context.consume(TokenType.RIGHT_BRACKET, "Expected ']' after array pattern");
                return new ArrayPatternNode(List.copyOf(elements), token.loc());
            case IDENTIFIER:
                context.advance();
                return named(token);
            default:
                throw context.error("Expected a pattern, found '" + token.text() + "'");
        }
    }

    private AstNode named(Token name) {
        String text = name.text();
        if (text.equals("_")) return new WildcardPatternNode(name.loc());
        if (!Character.isUpperCase(text.charAt(0))) return new BindingPatternNode(text, name.loc());

        List<AstNode> fields = new ArrayList<>();
        if (context.match(TokenType.LEFT_PAREN)) {
            while (!context.check(TokenType.RIGHT_PAREN)) {
                fields.add(pattern());
                if (!context.match(TokenType.COMMA)) break;
            }
            context.consume(TokenType.RIGHT_PAREN, "Expected ')' after variant fields");
        }
        return new VariantPatternNode(text, List.copyOf(fields), name.loc());
    }

    private AstNode numberOrRange(Number start, Token startToken) {
        if (context.match(TokenType.DOT_DOT, TokenType.DOT_DOT_EQUAL)) {
            boolean inclusive = context.previous().type() == TokenType.DOT_DOT_EQUAL;
            boolean negative = context.match(TokenType.MINUS);
            Number end = (Number) context.consume(TokenType.NUMBER, "Expected a number to end the range pattern").value();
            return new RangePatternNode(start, negative ? negate(end) : end, inclusive, startToken.loc());
        }
        return new LiteralPatternNode(start, startToken.loc());
    }

    private static Number negate(Number value) {
        if (value instanceof Long l) return -l;
        return -value.doubleValue();
    }

    private static void checkDuplicateBindings(AstNode pattern, Set<String> seen) {
        if (pattern instanceof BindingPatternNode binding) {
            if (!seen.add(binding.name())) {
                throw new ParseError("Duplicate binding '" + binding.name() + "' in pattern", binding.loc(),
                        CompilerErrorCode.E203, "Use a different name for each binding");
            }
            return;
        }
        for (AstNode child : pattern.getChildren()) {
            checkDuplicateBindings(child, seen);
        }
    }
}
