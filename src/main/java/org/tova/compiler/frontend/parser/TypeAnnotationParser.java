package org.tova.compiler.frontend.parser;

import org.tova.compiler.frontend.lexer.Token;
import org.tova.compiler.frontend.lexer.TokenType;
import org.tova.compiler.frontend.parser.ast.TypeAnnotationNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses type annotations: {@code Int}, {@code [T]}, {@code (A, B)}, {@code fn(A) -> B},
 * {@code Name<Args>} and a trailing {@code ?} for optional types.
 */
class TypeAnnotationParser {

    private final ParsingContext context;

    TypeAnnotationParser(ParsingContext context) {
        this.context = context;
    }

    TypeAnnotationNode parse() {
        TypeAnnotationNode type = base();
        while (context.match(TokenType.QUESTION)) {
            type = new TypeAnnotationNode(TypeAnnotationNode.Kind.OPTIONAL, null, List.of(type), null, type.loc());
        }
        return type;
    }

    private TypeAnnotationNode base() {
        Token token = context.peek();
        if (context.match(TokenType.LEFT_BRACKET)) {
            TypeAnnotationNode element = parse();
            context.consume(TokenType.RIGHT_BRACKET, "Expected ']' after array element type");
            return new TypeAnnotationNode(TypeAnnotationNode.Kind.ARRAY, null, List.of(element), null, token.loc());
        }
        if (context.match(TokenType.LEFT_PAREN)) {
            List<TypeAnnotationNode> members = list(TokenType.RIGHT_PAREN);
            context.consume(TokenType.RIGHT_PAREN, "Expected ')' after tuple type");
            return new TypeAnnotationNode(TypeAnnotationNode.Kind.TUPLE, null, members, null, token.loc());
        }
        if (context.match(TokenType.FN)) {
            context.consume(TokenType.LEFT_PAREN, "Expected '(' in function type");
            List<TypeAnnotationNode> params = list(TokenType.RIGHT_PAREN);
            context.consume(TokenType.RIGHT_PAREN, "Expected ')' in function type");
            TypeAnnotationNode returnType = context.match(TokenType.ARROW)
                    ? parse()
                    : TypeAnnotationNode.named("Nil", token.loc());
            return new TypeAnnotationNode(TypeAnnotationNode.Kind.FUNCTION, null, params, returnType, token.loc());
        }
        if (context.match(TokenType.NIL)) {
            return TypeAnnotationNode.named("Nil", token.loc());
        }
        String name = context.consume(TokenType.IDENTIFIER, "Expected a type").text();
        if (context.match(TokenType.LESS)) {
            List<TypeAnnotationNode> arguments = list(TokenType.GREATER);
            context.consume(TokenType.GREATER, "Expected '>' after type arguments");
            return new TypeAnnotationNode(TypeAnnotationNode.Kind.NAMED, name, arguments, null, token.loc());
        }
        return TypeAnnotationNode.named(name, token.loc());
    }

    private List<TypeAnnotationNode> list(TokenType close) {
        List<TypeAnnotationNode> types = new ArrayList<>();
        while (!context.check(close)) {
            types.add(parse());
            if (!context.match(TokenType.COMMA)) break;
        }
        return List.copyOf(types);
    }
}
