package org.tova.compiler.frontend.parser;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.diagnostics.ParseError;
import org.tova.compiler.frontend.lexer.TemplatePart;
import org.tova.compiler.frontend.lexer.Token;
import org.tova.compiler.frontend.lexer.TokenType;
import org.tova.compiler.frontend.parser.ast.*;
import org.tova.compiler.frontend.parser.features.concurrency.SpawnNode;
import org.tova.compiler.frontend.parser.features.jsx.JsxParser;

import java.util.ArrayList;
import java.util.List;

/**
 * Precedence-climbing expression parser. Each method handles one precedence level and
 * delegates to the next tighter one.
 */
class ExpressionParser {

    private final ParsingContext context;
    private final PatternParser patterns;

    ExpressionParser(ParsingContext context) {
        this.context = context;
        this.patterns = new PatternParser(context);
    }

    AstNode parseExpression() {
        return pipe();
    }

    /**
     * Parses an expression that is followed by {@code =>}. A bare identifier there is an operand,
     * not the parameter of a shorthand lambda.
     */
    AstNode parseOperand() {
        Token token = context.peek();
        if (token.type() == TokenType.IDENTIFIER && context.checkNext(TokenType.FAT_ARROW)) {
            context.advance();
            return new IdentifierNode(token.text(), token.loc());
        }
        return parseExpression();
    }

    private AstNode pipe() {
        AstNode left = coalesce();
        while (true) {
            if (context.check(TokenType.NEWLINE) && context.checkNext(TokenType.PIPE)) {
                context.advance();
            }
            if (!context.check(TokenType.PIPE)) return left;
            Token operator = context.advance();
            context.skipNewlines();
            // x |> .method() calls the method on the piped value
            AstNode right = context.check(TokenType.DOT)
                    ? postfixChain(new IdentifierNode("_", context.peek().loc()))
                    : coalesce();
            left = new PipeNode(left, right, operator.loc());
        }
    }

    private AstNode coalesce() {
        AstNode left = or();
        while (context.match(TokenType.QUESTION_QUESTION)) {
            SourceInfo loc = context.previous().loc();
            context.skipNewlines();
            left = new LogicalExpressionNode(Operator.COALESCE, left, or(), loc);
        }
        return left;
    }

    private AstNode or() {
        AstNode left = and();
        while (context.match(TokenType.OR, TokenType.OR_OR)) {
            SourceInfo loc = context.previous().loc();
            context.skipNewlines();
            left = new LogicalExpressionNode(Operator.OR, left, and(), loc);
        }
        return left;
    }

    private AstNode and() {
        AstNode left = not();
        while (context.match(TokenType.AND, TokenType.AND_AND)) {
            SourceInfo loc = context.previous().loc();
            context.skipNewlines();
            left = new LogicalExpressionNode(Operator.AND, left, not(), loc);
        }
        return left;
    }

    private AstNode not() {
        if (context.check(TokenType.NOT) && !context.checkNext(TokenType.IN)) {
            Token operator = context.advance();
            return new UnaryExpressionNode(Operator.NOT, not(), operator.loc());
        }
        return comparison();
    }

    private AstNode comparison() {
        AstNode left = range();
        SourceInfo loc = left.loc();
        if (context.match(TokenType.IN)) {
            return new MembershipNode(left, range(), false, loc);
        }
        if (context.check(TokenType.NOT) && context.checkNext(TokenType.IN)) {
            context.advance();
            context.advance();
            return new MembershipNode(left, range(), true, loc);
        }
        List<AstNode> operands = new ArrayList<>();
        List<Operator> operators = new ArrayList<>();
        operands.add(left);
        Operator operator;
        while ((operator = comparisonOperator(context.peek().type())) != null) {
            context.advance();
            context.skipNewlines();
            operators.add(operator);
            operands.add(range());
        }
        if (operators.isEmpty()) return left;
        if (operators.size() == 1) {
            return new BinaryExpressionNode(operators.get(0), operands.get(0), operands.get(1), loc);
        }
        return new ChainedComparisonNode(List.copyOf(operands), List.copyOf(operators), loc);
    }

    private static Operator comparisonOperator(TokenType type) {
        return switch (type) {
            case EQUAL_EQUAL -> Operator.EQUAL;
            case BANG_EQUAL -> Operator.NOT_EQUAL;
            case LESS -> Operator.LESS;
            case LESS_EQUAL -> Operator.LESS_EQUAL;
            case GREATER -> Operator.GREATER;
            case GREATER_EQUAL -> Operator.GREATER_EQUAL;
            default -> null;
        };
    }

    private AstNode range() {
        AstNode start = additive();
        if (context.match(TokenType.DOT_DOT, TokenType.DOT_DOT_EQUAL)) {
            boolean inclusive = context.previous().type() == TokenType.DOT_DOT_EQUAL;
            return new RangeNode(start, additive(), inclusive, start.loc());
        }
        return start;
    }

    private AstNode additive() {
        AstNode left = multiplicative();
        while (context.match(TokenType.PLUS, TokenType.MINUS)) {
            Operator operator = context.previous().type() == TokenType.PLUS ? Operator.ADD : Operator.SUBTRACT;
            context.skipNewlines();
            left = new BinaryExpressionNode(operator, left, multiplicative(), left.loc());
        }
        return left;
    }

    private AstNode multiplicative() {
        AstNode left = power();
        while (context.match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Operator operator = switch (context.previous().type()) {
                case STAR -> Operator.MULTIPLY;
                case SLASH -> Operator.DIVIDE;
                default -> Operator.MODULO;
            };
            context.skipNewlines();
            left = new BinaryExpressionNode(operator, left, power(), left.loc());
        }
        return left;
    }

    private AstNode power() {
        AstNode base = unary();
        if (context.match(TokenType.STAR_STAR)) {
            context.skipNewlines();
            return new BinaryExpressionNode(Operator.POWER, base, power(), base.loc());
        }
        return base;
    }

    private AstNode unary() {
        Token token = context.peek();
        if (context.match(TokenType.MINUS)) {
            return new UnaryExpressionNode(Operator.NEGATE, unary(), token.loc());
        }
        if (context.match(TokenType.BANG)) {
            return new UnaryExpressionNode(Operator.NOT, unary(), token.loc());
        }
        if (context.match(TokenType.AWAIT)) {
            return new AwaitNode(unary(), token.loc());
        }
        if (context.checkWord("spawn")) {
            TokenType next = context.peekAt(1).type();
            if (next == TokenType.IDENTIFIER || next == TokenType.FN || next == TokenType.AWAIT
                    || next == TokenType.ASYNC || next == TokenType.LEFT_PAREN) {
                context.advance();
                return new SpawnNode(unary(), token.loc());
            }
        }
        return postfix();
    }

    private AstNode postfix() {
        return postfixChain(primary());
    }

    private AstNode postfixChain(AstNode expr) {
        while (true) {
            Token token = context.peek();
            if (context.match(TokenType.LEFT_PAREN)) {
                expr = new CallNode(expr, arguments(), token.loc());
            } else if (context.match(TokenType.DOT)) {
                expr = new MemberAccessNode(expr, context.consumeName("Expected property name after '.'"), false, token.loc());
            } else if (token.type() == TokenType.NEWLINE && context.checkNext(TokenType.DOT)) {
                context.advance();
            } else if (context.match(TokenType.QUESTION_DOT)) {
                expr = new MemberAccessNode(expr, context.consumeName("Expected property name after '?.'"), true, token.loc());
            } else if (context.match(TokenType.LEFT_BRACKET)) {
                expr = indexOrSlice(expr, token.loc());
            } else if (context.match(TokenType.QUESTION)) {
                expr = new PropagateNode(expr, token.loc());
            } else {
                return expr;
            }
        }
    }

    private List<AstNode> arguments() {
        List<AstNode> args = new ArrayList<>();
        context.skipNewlines();
        while (!context.check(TokenType.RIGHT_PAREN)) {
            Token start = context.peek();
            if (context.match(TokenType.SPREAD)) {
                args.add(new SpreadNode(parseExpression(), start.loc()));
            } else if (start.type() == TokenType.IDENTIFIER && context.checkNext(TokenType.COLON)) {
                context.advance();
                context.advance();
                args.add(new NamedArgumentNode(start.text(), parseExpression(), start.loc()));
            } else {
                args.add(parseExpression());
            }
            context.skipNewlines();
            if (!context.match(TokenType.COMMA)) break;
            context.skipNewlines();
        }
        context.consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments");
        return List.copyOf(args);
    }

    private AstNode indexOrSlice(AstNode object, SourceInfo loc) {
        AstNode start = null;
        AstNode end = null;
        AstNode step = null;
        if (context.match(TokenType.COLON_COLON)) {
            step = context.check(TokenType.RIGHT_BRACKET) ? null : parseExpression();
            context.consume(TokenType.RIGHT_BRACKET, "Expected ']' after slice");
            return new SliceNode(object, null, null, step, loc);
        }
        if (!context.check(TokenType.COLON)) start = parseExpression();
        if (context.match(TokenType.COLON_COLON)) {
            step = context.check(TokenType.RIGHT_BRACKET) ? null : parseExpression();
            context.consume(TokenType.RIGHT_BRACKET, "Expected ']' after slice");
            return new SliceNode(object, start, null, step, loc);
        }
        if (!context.match(TokenType.COLON)) {
            context.consume(TokenType.RIGHT_BRACKET, "Expected ']' after index");
            return new IndexAccessNode(object, start, loc);
        }
        if (!context.check(TokenType.COLON) && !context.check(TokenType.RIGHT_BRACKET)) end = parseExpression();
        if (context.match(TokenType.COLON) && !context.check(TokenType.RIGHT_BRACKET)) step = parseExpression();
        context.consume(TokenType.RIGHT_BRACKET, "Expected ']' after slice");
        return new SliceNode(object, start, end, step, loc);
    }

    private AstNode primary() {
        Token token = context.peek();
        switch (token.type()) {
            case NUMBER:
                context.advance();
                return new NumberLiteralNode((Number) token.value(), token.loc());
            case STRING:
                context.advance();
                return new StringLiteralNode((String) token.value(), token.loc());
            case STRING_TEMPLATE:
                context.advance();
                return template(token);
            case TRUE:
            case FALSE:
                context.advance();
                return new BooleanLiteralNode(token.type() == TokenType.TRUE, token.loc());
            case NIL:
                context.advance();
                return new NilLiteralNode(token.loc());
            case IDENTIFIER:
                context.advance();
                if (context.check(TokenType.FAT_ARROW)) {
                    context.advance();
                    List<ParameterNode> params = List.of(new ParameterNode(token.text(), null, null, token.loc()));
                    return new LambdaNode(params, lambdaBody(), false, token.loc());
                }
                return new IdentifierNode(token.text(), token.loc());
            case SERVER: case CLIENT: case SHARED: case STATE: case COMPUTED:
            case EFFECT: case COMPONENT: case STORE: case ROUTE: case FROM:
                context.advance();
                return new IdentifierNode(token.text(), token.loc());
            case LEFT_PAREN:
                return parenthesized();
            case FN:
                context.advance();
                return functionLiteral(false, token.loc());
            case ASYNC:
                context.advance();
                if (context.match(TokenType.FN)) return functionLiteral(true, token.loc());
                AstNode arrow = arrowLambda(true, token.loc());
                if (arrow == null) throw context.error("Expected 'fn' or a parameter list after 'async'");
                return arrow;
            case LEFT_BRACKET:
                return arrayOrComprehension();
            case LEFT_BRACE:
                return objectLiteral();
            case MATCH:
                return match();
            case IF:
                return ifExpression();
            case JSX_OPEN:
                return new JsxParser(context).parseElement();
            default:
                if (context.isAtEnd()) throw context.error("Unexpected end of input, expected an expression");
                throw context.error("Unexpected token '" + token.text() + "', expected an expression");
        }
    }

    private AstNode template(Token token) {
        @SuppressWarnings("unchecked")
        List<TemplatePart> parts = (List<TemplatePart>) token.value();
        List<TemplateLiteralNode.Segment> segments = new ArrayList<>();
        for (TemplatePart part : parts) {
            if (part.kind() == TemplatePart.Kind.TEXT) {
                segments.add(new TemplateLiteralNode.Segment(part.text(), null));
            } else {
                List<Token> sub = new ArrayList<>(part.tokens());
                Token last = sub.isEmpty() ? token : sub.get(sub.size() - 1);
                sub.add(new Token(TokenType.END_OF_FILE, "", null, last.line(), last.column(), last.fileName()));
                segments.add(new TemplateLiteralNode.Segment(null, new Parser(sub).parseStandaloneExpression()));
            }
        }
        return new TemplateLiteralNode(List.copyOf(segments), token.loc());
    }

    private AstNode parenthesized() {
        Token open = context.peek();
        AstNode lambda = arrowLambda(false, open.loc());
        if (lambda != null) return lambda;

        context.consume(TokenType.LEFT_PAREN, "Expected '('");
        if (context.match(TokenType.RIGHT_PAREN)) {
            return new ArrayLiteralNode(List.of(), open.loc());
        }
        AstNode first = parseExpression();
        if (!context.check(TokenType.COMMA)) {
            context.consume(TokenType.RIGHT_PAREN, "Expected ')' after expression");
            return first;
        }
        List<AstNode> elements = new ArrayList<>();
        elements.add(first);
        while (context.match(TokenType.COMMA)) {
            if (context.check(TokenType.RIGHT_PAREN)) break;
            elements.add(parseExpression());
        }
        context.consume(TokenType.RIGHT_PAREN, "Expected ')' after tuple");
        return new ArrayLiteralNode(List.copyOf(elements), open.loc());
    }

    /**
     * Speculatively parses {@code (params) [-> T] => body}. Restores the cursor and returns null when
     * the tokens do not form an arrow lambda.
     */
    private AstNode arrowLambda(boolean async, SourceInfo loc) {
        if (!context.check(TokenType.LEFT_PAREN)) return null;
        int saved = context.snapshot();
        List<ParameterNode> params;
        try {
            params = context.parseParameters();
            if (context.match(TokenType.ARROW)) context.parseTypeAnnotation();
        } catch (ParseError notAParameterList) {
            context.restore(saved);
            return null;
        }
        if (!context.match(TokenType.FAT_ARROW)) {
            context.restore(saved);
            return null;
        }
        return new LambdaNode(params, lambdaBody(), async, loc);
    }

    private AstNode functionLiteral(boolean async, SourceInfo loc) {
        List<ParameterNode> params = context.parseParameters();
        if (context.match(TokenType.ARROW)) context.parseTypeAnnotation();
        context.match(TokenType.FAT_ARROW);
        return new LambdaNode(params, lambdaBody(), async, loc);
    }

    private AstNode lambdaBody() {
        context.skipNewlines();
        if (context.check(TokenType.LEFT_BRACE)) return context.parseBlock();
        return parseExpression();
    }

    private AstNode arrayOrComprehension() {
        Token open = context.advance();
        List<AstNode> elements = new ArrayList<>();
        context.skipNewlines();
        if (context.match(TokenType.RIGHT_BRACKET)) return new ArrayLiteralNode(List.of(), open.loc());

        AstNode first = element();
        if (context.match(TokenType.FOR)) {
            String variable = context.consume(TokenType.IDENTIFIER, "Expected variable in comprehension").text();
            context.consume(TokenType.IN, "Expected 'in' in comprehension");
            AstNode iterable = parseExpression();
            AstNode condition = context.match(TokenType.IF) ? parseExpression() : null;
            context.consume(TokenType.RIGHT_BRACKET, "Expected ']' after comprehension");
            return new ListComprehensionNode(first, variable, iterable, condition, open.loc());
        }
        elements.add(first);
        context.skipNewlines();
        while (context.match(TokenType.COMMA)) {
            context.skipNewlines();
            if (context.check(TokenType.RIGHT_BRACKET)) break;
            elements.add(element());
            context.skipNewlines();
        }
        context.consume(TokenType.RIGHT_BRACKET, "Expected ']' after array elements");
        return new ArrayLiteralNode(List.copyOf(elements), open.loc());
    }

    private AstNode element() {
        Token start = context.peek();
        if (context.match(TokenType.SPREAD)) return new SpreadNode(parseExpression(), start.loc());
        return parseExpression();
    }

    private AstNode objectLiteral() {
        Token open = context.advance();
        List<AstNode> entries = new ArrayList<>();
        skipEntrySeparators();
        while (!context.check(TokenType.RIGHT_BRACE)) {
            Token key = context.peek();
            if (context.match(TokenType.SPREAD)) {
                entries.add(new SpreadNode(parseExpression(), key.loc()));
            } else {
                String name = context.match(TokenType.STRING)
                        ? (String) key.value()
                        : context.consumeName("Expected property name in object literal");
                if (context.match(TokenType.COLON)) {
                    context.skipNewlines();
                    entries.add(new ObjectPropertyNode(name, parseExpression(), key.loc()));
                } else {
                    entries.add(new ObjectPropertyNode(name, new IdentifierNode(name, key.loc()), key.loc()));
                }
            }
            if (!context.check(TokenType.COMMA) && !context.check(TokenType.NEWLINE) && !context.check(TokenType.RIGHT_BRACE)) {
                throw context.error("Expected ',' or '}' in object literal");
            }
            skipEntrySeparators();
        }
        context.consume(TokenType.RIGHT_BRACE, "Expected '}' after object literal");
        return new ObjectLiteralNode(List.copyOf(entries), open.loc());
    }

    private void skipEntrySeparators() {
        while (context.match(TokenType.COMMA, TokenType.NEWLINE, TokenType.SEMICOLON)) {
            // entry separators
        }
    }

    private AstNode match() {
        Token keyword = context.advance();
        AstNode subject = parseExpression();
        context.consume(TokenType.LEFT_BRACE, "Expected '{' after match subject");
        List<MatchArmNode> arms = new ArrayList<>();
        skipEntrySeparators();
        while (!context.check(TokenType.RIGHT_BRACE)) {
            Token start = context.peek();
            AstNode pattern = patterns.parse();
            AstNode guard = context.match(TokenType.IF) ? parseOperand() : null;
            context.consume(TokenType.FAT_ARROW, "Expected '=>' after match pattern");
            context.skipNewlines();
            AstNode body = context.check(TokenType.LEFT_BRACE) ? context.parseBlock() : parseExpression();
            arms.add(new MatchArmNode(pattern, guard, body, start.loc()));
            skipEntrySeparators();
        }
        context.consume(TokenType.RIGHT_BRACE, "Expected '}' to close match");
        if (arms.isEmpty()) throw new ParseError("A match needs at least one arm", keyword.loc());
        return new MatchNode(subject, List.copyOf(arms), keyword.loc());
    }

    private AstNode ifExpression() {
        Token keyword = context.advance();
        AstNode condition = parseExpression();
        BlockNode consequent = context.parseBlock();
        List<ConditionalBranchNode> alternates = new ArrayList<>();
        BlockNode elseBranch = null;
        while (true) {
            int saved = context.snapshot();
            context.skipNewlines();
            if (context.check(TokenType.ELIF) || (context.check(TokenType.ELSE) && context.checkNext(TokenType.IF))) {
                Token branch = context.advance();
                if (branch.type() == TokenType.ELSE) context.advance();
                AstNode branchCondition = parseExpression();
                alternates.add(new ConditionalBranchNode(branchCondition, context.parseBlock(), branch.loc()));
            } else if (context.match(TokenType.ELSE)) {
                elseBranch = context.parseBlock();
                break;
            } else {
                context.restore(saved);
                break;
            }
        }
        return new IfExpressionNode(condition, consequent, List.copyOf(alternates), elseBranch, keyword.loc());
    }
}
