package org.tova.compiler.frontend.parser;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.diagnostics.ParseError;
import org.tova.compiler.frontend.lexer.Token;
import org.tova.compiler.frontend.lexer.TokenType;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.BlockNode;
import org.tova.compiler.frontend.parser.ast.ConfigFieldNode;
import org.tova.compiler.frontend.parser.ast.FunctionDeclarationNode;
import org.tova.compiler.frontend.parser.ast.ParameterNode;
import org.tova.compiler.frontend.parser.ast.TypeAnnotationNode;

import java.util.List;
import java.util.function.Supplier;

/**
 * An interface that encapsulates the contextual state during parsing.
 * It provides block handlers and feature parsers with access to the token stream and to
 * the core grammar without coupling them directly to the {@link Parser} implementation.
 */
public interface ParsingContext {

    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Checks the token after the current one without consuming anything.
     * @param type The token type to check.
     * @return true if the next token is of the given type.
     */
    boolean checkNext(TokenType type);

    /**
     * Checks if the current token is an identifier with the given text.
     * @param word The contextual keyword, e.g. {@code "edge"}.
     * @return true on a match.
     */
    boolean checkWord(String word);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Returns a token ahead of the cursor without consuming anything.
     * @param offset 0 for the current token, 1 for the next one.
     * @return The token, or END_OF_FILE past the end.
     */
    Token peekAt(int offset);

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Consumes the current token if it is of the expected type.
     * @param type The expected token type.
     * @param errorMessage The error message if the token type does not match.
     * @return The consumed token.
     * @throws ParseError if the token type does not match.
     */
    Token consume(TokenType type, String errorMessage);

    /**
     * Consumes an identifier or keyword used as a name (property names, config keys).
     * @param errorMessage The error message if the current token is not word-like.
     * @return The name.
     */
    String consumeName(String errorMessage);

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();

    /**
     * @return The cursor position, for speculative parsing.
     */
    int snapshot();

    /**
     * Resets the cursor to a position returned by {@link #snapshot()}.
     * @param position The saved position.
     */
    void restore(int position);

    /**
     * Skips NEWLINE and SEMICOLON tokens.
     */
    void skipNewlines();

    /**
     * Requires a statement terminator: NEWLINE or ';' (consumed), or '}' or end of input (left in place).
     * @throws ParseError if another token follows on the same line.
     */
    void endStatement();

    /**
     * Creates a parse error at the current token.
     * @param message The message.
     * @return The error, to be thrown by the caller.
     */
    ParseError error(String message);

    /**
     * Creates a parse error with a code and a hint at the current token.
     * @param message The message.
     * @param code The diagnostic code.
     * @param hint A fix suggestion.
     * @return The error, to be thrown by the caller.
     */
    ParseError error(String message, CompilerErrorCode code, String hint);

    /**
     * @return A parsed expression.
     */
    AstNode parseExpression();

    /**
     * Parses an expression that is directly followed by {@code =>}, such as a select channel or
     * a match guard.
     * @return The expression.
     */
    AstNode parseOperand();

    /**
     * @return A parsed statement of the core grammar.
     */
    AstNode parseStatement();

    /**
     * @return A braced block of core statements.
     */
    BlockNode parseBlock();

    /**
     * Parses {@code { stmt* }} with a custom statement parser.
     * @param statementParser Parses one statement at the cursor.
     * @return The statements.
     */
    List<AstNode> parseBracedStatements(Supplier<AstNode> statementParser);

    /**
     * Parses a parenthesized parameter list including the parentheses.
     * @return The parameters.
     */
    List<ParameterNode> parseParameters();

    /**
     * @return A parsed type annotation.
     */
    TypeAnnotationNode parseTypeAnnotation();

    /**
     * Parses {@code [async] fn name(...) [-> T] { }} at the cursor.
     * @return The declaration.
     */
    FunctionDeclarationNode parseFunctionDeclaration();

    /**
     * Parses {@code { key: value, ... }} with word-like keys.
     * @return The entries in source order.
     */
    List<ConfigFieldNode> parseConfigBlock();
}
