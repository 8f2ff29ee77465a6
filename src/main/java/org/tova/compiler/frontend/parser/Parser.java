package org.tova.compiler.frontend.parser;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.diagnostics.ParseError;
import org.tova.compiler.frontend.lexer.Token;
import org.tova.compiler.frontend.lexer.TokenType;
import org.tova.compiler.frontend.parser.ast.*;
import org.tova.compiler.frontend.parser.block.BlockHandlerRegistry;
import org.tova.compiler.frontend.parser.block.IBlockHandler;
import org.tova.compiler.frontend.parser.features.concurrency.ConcurrentBlockParser;
import org.tova.compiler.frontend.parser.features.select.SelectParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * The main parser for the Tova language. It consumes a list of tokens
 * from the {@link org.tova.compiler.frontend.lexer.Lexer} and produces an Abstract Syntax Tree (AST).
 * <p>
 * Statements are parsed here; expressions, patterns and type annotations are delegated to
 * {@link ExpressionParser}, {@link PatternParser} and {@link TypeAnnotationParser}. Top-level regions
 * ({@code client}, {@code server}, ...) are dispatched through the {@link BlockHandlerRegistry}.
 * The first syntax error aborts parsing with a {@link ParseError}.
 */
public class Parser implements ParsingContext {

    private final List<Token> tokens;
    private final BlockHandlerRegistry blockRegistry;
    private final ExpressionParser expressions;
    private final TypeAnnotationParser typeAnnotations;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The tokens to parse, terminated by END_OF_FILE.
     */
    public Parser(List<Token> tokens) {
        this.tokens = tokens;
        this.blockRegistry = BlockHandlerRegistry.initialize();
        this.expressions = new ExpressionParser(this);
        this.typeAnnotations = new TypeAnnotationParser(this);
    }

    /**
     * Parses the whole token stream.
     * @return The program root.
     * @throws ParseError on the first syntax error.
     */
    public ProgramNode parse() {
        SourceInfo loc = peek().loc();
        List<AstNode> body = new ArrayList<>();
        skipNewlines();
        while (!isAtEnd()) {
            Optional<IBlockHandler> handler = blockRegistry.find(this);
            if (handler.isPresent()) {
                body.add(handler.get().parse(this));
                endStatement();
            } else {
                body.add(parseStatement());
            }
            skipNewlines();
        }
        return new ProgramNode(body, loc);
    }

    /**
     * Parses the tokens as exactly one expression. Used for interpolated string segments.
     * @return The expression.
     */
    public AstNode parseStandaloneExpression() {
        AstNode expr = parseExpression();
        if (!isAtEnd()) {
            throw error("Unexpected '" + peek().text() + "' in interpolated expression");
        }
        return expr;
    }

    // region Statements

    @Override
    public AstNode parseStatement() {
        AstNode statement = parseStatementBody();
        endStatement();
        return statement;
    }

    private AstNode parseStatementBody() {
        Token token = peek();
        switch (token.type()) {
            case DOCSTRING:
                return docCommented();
            case MUT:
                throw error("'mut' is not supported in Tova. Use 'var' for mutable variables",
                        CompilerErrorCode.E003, "Use 'var' for mutable variables");
            case VAR:
                return varDeclaration();
            case LET:
                return letDestructure();
            case FN:
                if (peekAt(1).type() == TokenType.IDENTIFIER) return parseFunctionDeclaration(null);
                break;
            case ASYNC:
                if (peekAt(1).type() == TokenType.FN && peekAt(2).type() == TokenType.IDENTIFIER) {
                    return parseFunctionDeclaration(null);
                }
                break;
            case TYPE:
                if (peekAt(1).type() == TokenType.IDENTIFIER) return typeDeclaration();
                break;
            case IMPORT:
                return importDeclaration();
            case EXPORT:
                advance();
                return parseStatementBody();
            case RETURN:
                return returnStatement();
            case IF:
                return ifStatement();
            case FOR:
                return forStatement();
            case WHILE:
                return whileStatement();
            case TRY:
                return tryStatement();
            case GUARD:
                return guardStatement();
            case BREAK:
                return new BreakNode(advance().loc());
            case CONTINUE:
                return new ContinueNode(advance().loc());
            case IDENTIFIER:
                if (ConcurrentBlockParser.detect(this)) return ConcurrentBlockParser.parse(this);
                if (SelectParser.detect(this)) return SelectParser.parse(this);
                break;
            default:
                break;
        }
        return expressionStatement();
    }

    private AstNode docCommented() {
        StringBuilder doc = new StringBuilder();
        while (check(TokenType.DOCSTRING)) {
            if (!doc.isEmpty()) doc.append('\n');
            doc.append((String) advance().value());
            skipNewlines();
        }
        if (isAtEnd() || check(TokenType.RIGHT_BRACE)) {
            return new ExpressionStatementNode(new NilLiteralNode(previous().loc()), previous().loc());
        }
        if (check(TokenType.FN) || (check(TokenType.ASYNC) && peekAt(1).type() == TokenType.FN)) {
            return parseFunctionDeclaration(doc.toString());
        }
        return parseStatementBody();
    }

    @Override
    public void endStatement() {
        if (match(TokenType.NEWLINE, TokenType.SEMICOLON)) return;
        if (check(TokenType.RIGHT_BRACE) || isAtEnd()) return;
        throw error("Expected a newline or ';' after statement, found '" + peek().text() + "'");
    }

    private AstNode varDeclaration() {
        Token keyword = advance();
        String name = consume(TokenType.IDENTIFIER, "Expected variable name after 'var'").text();
        TypeAnnotationNode type = null;
        if (match(TokenType.COLON)) type = parseTypeAnnotation();
        consume(TokenType.EQUAL, "Expected '=' after variable name");
        skipNewlines();
        return new VarDeclarationNode(name, type, parseExpression(), keyword.loc());
    }

    private AstNode letDestructure() {
        Token keyword = advance();
        LetDestructureNode.Kind kind;
        TokenType close;
        if (match(TokenType.LEFT_BRACE)) {
            kind = LetDestructureNode.Kind.OBJECT;
            close = TokenType.RIGHT_BRACE;
        } else if (match(TokenType.LEFT_BRACKET)) {
            kind = LetDestructureNode.Kind.ARRAY;
            close = TokenType.RIGHT_BRACKET;
        } else {
            String name = check(TokenType.IDENTIFIER) ? peek().text() : "x";
            throw error("'let' is only used for destructuring in Tova", CompilerErrorCode.E003,
                    "Use 'var " + name + " = ...' for a mutable variable or '" + name + " = ...' for an immutable binding");
        }
        List<String> names = new ArrayList<>();
        skipNewlines();
        while (!check(close)) {
            names.add(consume(TokenType.IDENTIFIER, "Expected a name in destructuring pattern").text());
            skipNewlines();
            if (!match(TokenType.COMMA)) break;
            skipNewlines();
        }
        consume(close, "Expected '" + (close == TokenType.RIGHT_BRACE ? "}" : "]") + "' to close destructuring pattern");
        consume(TokenType.EQUAL, "Expected '=' after destructuring pattern");
        skipNewlines();
        return new LetDestructureNode(kind, List.copyOf(names), parseExpression(), keyword.loc());
    }

    @Override
    public FunctionDeclarationNode parseFunctionDeclaration() {
        return parseFunctionDeclaration(null);
    }

    private FunctionDeclarationNode parseFunctionDeclaration(String doc) {
        boolean async = match(TokenType.ASYNC);
        Token keyword = consume(TokenType.FN, "Expected 'fn'");
        String name = consume(TokenType.IDENTIFIER, "Expected function name").text();
        List<String> typeParams = typeParameters();
        List<ParameterNode> params = parseParameters();
        TypeAnnotationNode returnType = null;
        if (match(TokenType.ARROW)) returnType = parseTypeAnnotation();
        BlockNode body = parseBlock();
        return new FunctionDeclarationNode(name, typeParams, params, returnType, body, async, doc, keyword.loc());
    }

    private List<String> typeParameters() {
        List<String> names = new ArrayList<>();
        if (match(TokenType.LESS)) {
            do {
                names.add(consume(TokenType.IDENTIFIER, "Expected type parameter name").text());
            } while (match(TokenType.COMMA));
            consume(TokenType.GREATER, "Expected '>' after type parameters");
        }
        return List.copyOf(names);
    }

    @Override
    public List<ParameterNode> parseParameters() {
        consume(TokenType.LEFT_PAREN, "Expected '(' before parameters");
        List<ParameterNode> params = new ArrayList<>();
        while (!check(TokenType.RIGHT_PAREN)) {
            Token name = consume(TokenType.IDENTIFIER, "Expected parameter name");
            TypeAnnotationNode type = null;
            AstNode defaultValue = null;
            if (match(TokenType.COLON)) type = parseTypeAnnotation();
            if (match(TokenType.EQUAL)) defaultValue = parseExpression();
            params.add(new ParameterNode(name.text(), type, defaultValue, name.loc()));
            if (!match(TokenType.COMMA)) break;
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after parameters");
        return List.copyOf(params);
    }

    private AstNode typeDeclaration() {
        Token keyword = advance();
        String name = consume(TokenType.IDENTIFIER, "Expected type name").text();
        List<String> typeParams = typeParameters();
        consume(TokenType.LEFT_BRACE, "Expected '{' after type name");
        List<TypeVariantNode> variants = new ArrayList<>();
        List<TypeFieldNode> fields = new ArrayList<>();
        skipSeparators();
        while (!check(TokenType.RIGHT_BRACE)) {
            Token member = consume(TokenType.IDENTIFIER, "Expected a variant or field name in type '" + name + "'");
            if (match(TokenType.COLON)) {
                fields.add(new TypeFieldNode(member.text(), parseTypeAnnotation(), member.loc()));
            } else {
                variants.add(new TypeVariantNode(member.text(), variantFields(), member.loc()));
            }
            skipSeparators();
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}' to close type '" + name + "'");
        List<String> derives = new ArrayList<>();
        if (match(TokenType.DERIVE)) {
            consume(TokenType.LEFT_PAREN, "Expected '(' after 'derive'");
            do {
                derives.add(consume(TokenType.IDENTIFIER, "Expected trait name in derive").text());
            } while (match(TokenType.COMMA));
            consume(TokenType.RIGHT_PAREN, "Expected ')' after derive list");
        }
        return new TypeDeclarationNode(name, typeParams, List.copyOf(variants), List.copyOf(fields),
                List.copyOf(derives), keyword.loc());
    }

    private List<TypeFieldNode> variantFields() {
        List<TypeFieldNode> fields = new ArrayList<>();
        if (!match(TokenType.LEFT_PAREN)) return fields;
        int position = 0;
        while (!check(TokenType.RIGHT_PAREN)) {
            Token start = peek();
            if (check(TokenType.IDENTIFIER) && checkNext(TokenType.COLON)) {
                advance();
                advance();
                fields.add(new TypeFieldNode(start.text(), parseTypeAnnotation(), start.loc()));
            } else {
                fields.add(new TypeFieldNode("_" + position, parseTypeAnnotation(), start.loc()));
            }
            position++;
            if (!match(TokenType.COMMA)) break;
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after variant fields");
        return List.copyOf(fields);
    }

    private void skipSeparators() {
        while (match(TokenType.NEWLINE, TokenType.SEMICOLON, TokenType.COMMA)) {
            // separators between members
        }
    }

    private AstNode importDeclaration() {
        Token keyword = advance();
        List<String> names = new ArrayList<>();
        String defaultName = null;
        if (match(TokenType.LEFT_BRACE)) {
            skipNewlines();
            while (!check(TokenType.RIGHT_BRACE)) {
                names.add(consume(TokenType.IDENTIFIER, "Expected imported name").text());
                skipNewlines();
                if (!match(TokenType.COMMA)) break;
                skipNewlines();
            }
            consume(TokenType.RIGHT_BRACE, "Expected '}' after imported names");
        } else {
            defaultName = consume(TokenType.IDENTIFIER, "Expected imported name or '{'").text();
        }
        consume(TokenType.FROM, "Expected 'from' in import");
        Token source = consume(TokenType.STRING, "Expected module path string");
        return new ImportNode(List.copyOf(names), defaultName, (String) source.value(), keyword.loc());
    }

    private AstNode returnStatement() {
        Token keyword = advance();
        AstNode value = null;
        if (!check(TokenType.NEWLINE) && !check(TokenType.SEMICOLON) && !check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            value = parseExpression();
        }
        return new ReturnNode(value, keyword.loc());
    }

    private AstNode ifStatement() {
        Token keyword = advance();
        AstNode condition = parseExpression();
        BlockNode consequent = parseBlock();
        List<ConditionalBranchNode> alternates = new ArrayList<>();
        BlockNode elseBody = null;
        while (true) {
            int saved = snapshot();
            skipNewlines();
            if (check(TokenType.ELIF) || (check(TokenType.ELSE) && checkNext(TokenType.IF))) {
                Token branch = advance();
                if (branch.type() == TokenType.ELSE) advance();
                AstNode branchCondition = parseExpression();
                alternates.add(new ConditionalBranchNode(branchCondition, parseBlock(), branch.loc()));
            } else if (match(TokenType.ELSE)) {
                elseBody = parseBlock();
                break;
            } else {
                restore(saved);
                break;
            }
        }
        return new IfStatementNode(condition, consequent, List.copyOf(alternates), elseBody, keyword.loc());
    }

    private AstNode forStatement() {
        Token keyword = advance();
        List<String> variables = new ArrayList<>();
        variables.add(consume(TokenType.IDENTIFIER, "Expected loop variable after 'for'").text());
        if (match(TokenType.COMMA)) {
            variables.add(consume(TokenType.IDENTIFIER, "Expected second loop variable").text());
        }
        consume(TokenType.IN, "Expected 'in' after loop variable");
        AstNode iterable = parseExpression();
        BlockNode body = parseBlock();
        BlockNode elseBody = null;
        int saved = snapshot();
        skipNewlines();
        if (match(TokenType.ELSE)) {
            elseBody = parseBlock();
        } else {
            restore(saved);
        }
        return new ForNode(List.copyOf(variables), iterable, body, elseBody, keyword.loc());
    }

    private AstNode whileStatement() {
        Token keyword = advance();
        AstNode condition = parseExpression();
        return new WhileNode(condition, parseBlock(), keyword.loc());
    }

    private AstNode tryStatement() {
        Token keyword = advance();
        BlockNode tryBody = parseBlock();
        String catchParam = null;
        BlockNode catchBody = null;
        BlockNode finallyBody = null;
        int saved = snapshot();
        skipNewlines();
        if (match(TokenType.CATCH)) {
            if (check(TokenType.IDENTIFIER)) catchParam = advance().text();
            catchBody = parseBlock();
            saved = snapshot();
            skipNewlines();
        }
        if (match(TokenType.FINALLY)) {
            finallyBody = parseBlock();
        } else {
            restore(saved);
        }
        if (catchBody == null && finallyBody == null) {
            throw error("Expected 'catch' or 'finally' after 'try' block");
        }
        return new TryCatchNode(tryBody, catchParam, catchBody, finallyBody, keyword.loc());
    }

    private AstNode guardStatement() {
        Token keyword = advance();
        AstNode condition = parseExpression();
        consume(TokenType.ELSE, "Expected 'else' after guard condition");
        return new GuardNode(condition, parseBlock(), keyword.loc());
    }

    private AstNode expressionStatement() {
        Token start = peek();
        AstNode expr = parseExpression();
        if (match(TokenType.EQUAL)) {
            requireAssignable(expr, start);
            skipNewlines();
            return new AssignmentNode(expr, parseExpression(), start.loc());
        }
        if (match(TokenType.PLUS_EQUAL, TokenType.MINUS_EQUAL, TokenType.STAR_EQUAL, TokenType.SLASH_EQUAL)) {
            Operator operator = switch (previous().type()) {
                case PLUS_EQUAL -> Operator.ADD;
                case MINUS_EQUAL -> Operator.SUBTRACT;
                case STAR_EQUAL -> Operator.MULTIPLY;
                default -> Operator.DIVIDE;
            };
            requireAssignable(expr, start);
            skipNewlines();
            return new CompoundAssignmentNode(expr, operator, parseExpression(), start.loc());
        }
        return new ExpressionStatementNode(expr, start.loc());
    }

    private void requireAssignable(AstNode target, Token start) {
        if (!(target instanceof IdentifierNode) && !(target instanceof MemberAccessNode)
                && !(target instanceof IndexAccessNode)) {
            throw new ParseError("Invalid assignment target", start.loc());
        }
    }

    @Override
    public BlockNode parseBlock() {
        SourceInfo loc = peek().loc();
        return new BlockNode(parseBracedStatements(this::parseStatement), loc);
    }

    @Override
    public List<AstNode> parseBracedStatements(Supplier<AstNode> statementParser) {
        consume(TokenType.LEFT_BRACE, "Expected '{'");
        List<AstNode> statements = new ArrayList<>();
        skipNewlines();
        while (!check(TokenType.RIGHT_BRACE)) {
            if (isAtEnd()) throw error("Expected '}' before end of file");
            statements.add(statementParser.get());
            skipNewlines();
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}'");
        return List.copyOf(statements);
    }

    @Override
    public List<ConfigFieldNode> parseConfigBlock() {
        consume(TokenType.LEFT_BRACE, "Expected '{' to open configuration");
        List<ConfigFieldNode> fields = new ArrayList<>();
        skipSeparators();
        while (!check(TokenType.RIGHT_BRACE)) {
            Token key = peek();
            String name = consumeName("Expected configuration key");
            consume(TokenType.COLON, "Expected ':' after '" + name + "'");
            skipNewlines();
            fields.add(new ConfigFieldNode(name, parseExpression(), key.loc()));
            skipSeparators();
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}' to close configuration");
        return List.copyOf(fields);
    }

    // endregion

    @Override
    public AstNode parseExpression() {
        return expressions.parseExpression();
    }

    @Override
    public AstNode parseOperand() {
        return expressions.parseOperand();
    }

    @Override
    public TypeAnnotationNode parseTypeAnnotation() {
        return typeAnnotations.parse();
    }

    // region Cursor

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        if (isAtEnd()) return type == TokenType.END_OF_FILE;
        return peek().type() == type;
    }

    @Override
    public boolean checkNext(TokenType type) {
        return peekAt(1).type() == type;
    }

    @Override
    public boolean checkWord(String word) {
        return check(TokenType.IDENTIFIER) && peek().text().equals(word);
    }

    @Override
    public Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token peekAt(int offset) {
        int index = current + offset;
        return index < tokens.size() ? tokens.get(index) : tokens.get(tokens.size() - 1);
    }

    @Override
    public Token previous() {
        return tokens.get(Math.max(0, current - 1));
    }

    @Override
    public Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw error(errorMessage + (isAtEnd() ? " (found end of file)" : " (found '" + peek().text() + "')"));
    }

    @Override
    public String consumeName(String errorMessage) {
        Token token = peek();
        if (token.type() == TokenType.IDENTIFIER || isWordToken(token)) {
            advance();
            return token.text();
        }
        throw error(errorMessage + " (found '" + token.text() + "')");
    }

    private static boolean isWordToken(Token token) {
        String text = token.text();
        return !text.isEmpty() && Character.isLetter(text.charAt(0)) && text.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '_');
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    @Override
    public int snapshot() {
        return current;
    }

    @Override
    public void restore(int position) {
        current = position;
    }

    @Override
    public void skipNewlines() {
        while (check(TokenType.NEWLINE) || check(TokenType.SEMICOLON)) advance();
    }

    @Override
    public ParseError error(String message) {
        return new ParseError(message, peek().loc());
    }

    @Override
    public ParseError error(String message, CompilerErrorCode code, String hint) {
        return new ParseError(message, peek().loc(), code, hint);
    }

    // endregion
}
