package org.tova.compiler.frontend.lexer;

/**
 * Defines all possible token types that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Literals
    NUMBER, STRING, STRING_TEMPLATE, IDENTIFIER, TRUE, FALSE, NIL,

    // Keywords
    VAR, LET, FN, RETURN, IF, ELIF, ELSE, FOR, WHILE, MATCH, TYPE, IMPORT, FROM, EXPORT, AS,
    AND, OR, NOT, IN, BREAK, CONTINUE, TRY, CATCH, FINALLY, ASYNC, AWAIT, GUARD, DERIVE, MUT,
    SERVER, CLIENT, SHARED, STATE, COMPUTED, EFFECT, COMPONENT, STORE, ROUTE,

    // Arithmetic and comparison
    PLUS, MINUS, STAR, SLASH, PERCENT, STAR_STAR,
    EQUAL_EQUAL, BANG_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
    AND_AND, OR_OR, BANG,

    // Assignment
    EQUAL, PLUS_EQUAL, MINUS_EQUAL, STAR_EQUAL, SLASH_EQUAL,

    // Other operators
    PIPE, FAT_ARROW, ARROW, DOT, DOT_DOT, DOT_DOT_EQUAL, SPREAD, COLON, COLON_COLON,
    QUESTION, QUESTION_DOT, QUESTION_QUESTION,

    // Delimiters
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET, COMMA, SEMICOLON,

    // JSX
    JSX_OPEN, JSX_ATTR, JSX_TAG_END, JSX_SELF_CLOSE, JSX_CLOSE, JSX_TEXT,

    // Special
    DOCSTRING, STYLE_BLOCK, NEWLINE, END_OF_FILE
}
