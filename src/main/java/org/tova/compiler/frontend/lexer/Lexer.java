package org.tova.compiler.frontend.lexer;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.diagnostics.LexError;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * The lexer is mode-sensitive: a stack of frames tracks whether it is scanning code,
 * the inside of a JSX tag, JSX children, or an embedded code region inside JSX.
 * Malformed input raises a {@link LexError} immediately.
 */
public class Lexer {

    private enum Mode {
        /** Top-level code, never popped. */
        CODE,
        /** Code inside {@code { }} embedded in JSX; closed by the matching brace. */
        EMBEDDED,
        /** The header of a JSX {@code if/elif/else/for} child, up to its opening brace. */
        CONTROL_HEAD,
        /** Attributes of a JSX start tag. */
        TAG,
        /** Children of a JSX element. */
        ELEMENT,
        /** Children of a JSX control block; closed by a brace. */
        CONTROL_BODY
    }

    private static final class Frame {
        private final Mode mode;
        private final String tag;
        private final Deque<Character> delimiters = new ArrayDeque<>();

        private Frame(Mode mode, String tag) {
            this.mode = mode;
            this.tag = tag;
        }
    }

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("var", TokenType.VAR),
            Map.entry("let", TokenType.LET),
            Map.entry("fn", TokenType.FN),
            Map.entry("return", TokenType.RETURN),
            Map.entry("if", TokenType.IF),
            Map.entry("elif", TokenType.ELIF),
            Map.entry("else", TokenType.ELSE),
            Map.entry("for", TokenType.FOR),
            Map.entry("while", TokenType.WHILE),
            Map.entry("match", TokenType.MATCH),
            Map.entry("type", TokenType.TYPE),
            Map.entry("import", TokenType.IMPORT),
            Map.entry("from", TokenType.FROM),
            Map.entry("export", TokenType.EXPORT),
            Map.entry("as", TokenType.AS),
            Map.entry("and", TokenType.AND),
            Map.entry("or", TokenType.OR),
            Map.entry("not", TokenType.NOT),
            Map.entry("in", TokenType.IN),
            Map.entry("true", TokenType.TRUE),
            Map.entry("false", TokenType.FALSE),
            Map.entry("nil", TokenType.NIL),
            Map.entry("break", TokenType.BREAK),
            Map.entry("continue", TokenType.CONTINUE),
            Map.entry("try", TokenType.TRY),
            Map.entry("catch", TokenType.CATCH),
            Map.entry("finally", TokenType.FINALLY),
            Map.entry("async", TokenType.ASYNC),
            Map.entry("await", TokenType.AWAIT),
            Map.entry("guard", TokenType.GUARD),
            Map.entry("derive", TokenType.DERIVE),
            Map.entry("mut", TokenType.MUT),
            Map.entry("server", TokenType.SERVER),
            Map.entry("client", TokenType.CLIENT),
            Map.entry("shared", TokenType.SHARED),
            Map.entry("state", TokenType.STATE),
            Map.entry("computed", TokenType.COMPUTED),
            Map.entry("effect", TokenType.EFFECT),
            Map.entry("component", TokenType.COMPONENT),
            Map.entry("store", TokenType.STORE),
            Map.entry("route", TokenType.ROUTE)
    );

    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Frame> modes = new ArrayDeque<>();
    private int start = 0;
    private int current = 0;
    private int line;
    private int column;
    private int startLine;
    private int startColumn;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param fileName The name of the file being lexed, for error reporting.
     */
    public Lexer(String source, String fileName) {
        this(source, fileName, 1, 1);
    }

    private Lexer(String source, String fileName, int line, int column) {
        this.source = source;
        this.fileName = fileName;
        this.line = line;
        this.column = column;
        this.modes.push(new Frame(Mode.CODE, null));
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return The recognized tokens, terminated by an END_OF_FILE token.
     * @throws LexError if the source is malformed.
     */
    public List<Token> scanTokens() {
        while (true) {
            Frame frame = modes.peek();
            if (frame.mode == Mode.TAG || frame.mode == Mode.ELEMENT || frame.mode == Mode.CONTROL_BODY) {
                skipWhitespace();
            }
            if (isAtEnd()) break;
            start = current;
            startLine = line;
            startColumn = column;
            switch (frame.mode) {
                case TAG -> scanTagToken(frame);
                case ELEMENT, CONTROL_BODY -> scanContentToken(frame);
                default -> scanCodeToken(frame);
            }
        }
        if (modes.size() > 1) {
            throw new LexError(unclosedDescription(), new SourceInfo(fileName, line, column));
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column, fileName));
        return tokens;
    }

    private void scanCodeToken(Frame frame) {
        char c = advance();
        switch (c) {
            case ' ', '\r', '\t' -> { }
            case '\n' -> newline(frame);
            case '(' -> { frame.delimiters.push('('); addToken(TokenType.LEFT_PAREN); }
            case ')' -> { popDelimiter(frame, '('); addToken(TokenType.RIGHT_PAREN); }
            case '[' -> { frame.delimiters.push('['); addToken(TokenType.LEFT_BRACKET); }
            case ']' -> { popDelimiter(frame, '['); addToken(TokenType.RIGHT_BRACKET); }
            case '{' -> openBrace(frame);
            case '}' -> closeBrace(frame);
            case ',' -> addToken(TokenType.COMMA);
            case ';' -> addToken(TokenType.SEMICOLON);
            case '+' -> addToken(match('=') ? TokenType.PLUS_EQUAL : TokenType.PLUS);
            case '-' -> addToken(match('=') ? TokenType.MINUS_EQUAL : match('>') ? TokenType.ARROW : TokenType.MINUS);
            case '*' -> addToken(match('*') ? TokenType.STAR_STAR : match('=') ? TokenType.STAR_EQUAL : TokenType.STAR);
            case '/' -> slash();
            case '%' -> addToken(TokenType.PERCENT);
            case '=' -> addToken(match('=') ? TokenType.EQUAL_EQUAL : match('>') ? TokenType.FAT_ARROW : TokenType.EQUAL);
            case '!' -> addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG);
            case '<' -> less();
            case '>' -> addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
            case '&' -> {
                if (!match('&')) throw error("Unexpected character '&'. Did you mean '&&' or 'and'?");
                addToken(TokenType.AND_AND);
            }
            case '|' -> {
                if (match('|')) addToken(TokenType.OR_OR);
                else if (match('>')) addToken(TokenType.PIPE);
                else throw error("Unexpected character '|'. Did you mean '||', 'or' or '|>'?");
            }
            case '.' -> dot();
            case ':' -> addToken(match(':') ? TokenType.COLON_COLON : TokenType.COLON);
            case '?' -> addToken(match('.') ? TokenType.QUESTION_DOT : match('?') ? TokenType.QUESTION_QUESTION : TokenType.QUESTION);
            case '"', '\'' -> string(c);
            default -> {
                if (isDigit(c)) {
                    number(c);
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw error("Unexpected character '" + c + "'");
                }
            }
        }
    }

    private void newline(Frame frame) {
        Character top = frame.delimiters.peek();
        if (top != null && top != '{') return;
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() == TokenType.NEWLINE) return;
        addToken(TokenType.NEWLINE);
    }

    private void popDelimiter(Frame frame, char open) {
        if (!frame.delimiters.isEmpty() && frame.delimiters.peek() == open) {
            frame.delimiters.pop();
        }
    }

    private void openBrace(Frame frame) {
        if (frame.mode == Mode.CONTROL_HEAD && frame.delimiters.isEmpty()) {
            addToken(TokenType.LEFT_BRACE);
            modes.pop();
            modes.push(new Frame(Mode.CONTROL_BODY, null));
            return;
        }
        frame.delimiters.push('{');
        addToken(TokenType.LEFT_BRACE);
    }

    private void closeBrace(Frame frame) {
        if (frame.mode == Mode.EMBEDDED && frame.delimiters.isEmpty()) {
            addToken(TokenType.RIGHT_BRACE);
            modes.pop();
            return;
        }
        popDelimiter(frame, '{');
        addToken(TokenType.RIGHT_BRACE);
    }

    private void slash() {
        if (match('/')) {
            if (match('/')) {
                while (peek() != '\n' && !isAtEnd()) advance();
                addToken(TokenType.DOCSTRING, source.substring(start + 3, current).trim());
            } else {
                while (peek() != '\n' && !isAtEnd()) advance();
            }
        } else if (match('*')) {
            blockComment();
        } else {
            addToken(match('=') ? TokenType.SLASH_EQUAL : TokenType.SLASH);
        }
    }

    private void blockComment() {
        int depth = 1;
        while (depth > 0) {
            if (isAtEnd()) throw error("Unterminated block comment");
            char c = advance();
            if (c == '/' && peek() == '*') {
                advance();
                depth++;
            } else if (c == '*' && peek() == '/') {
                advance();
                depth--;
            }
        }
    }

    private void dot() {
        if (match('.')) {
            if (match('.')) addToken(TokenType.SPREAD);
            else if (match('=')) addToken(TokenType.DOT_DOT_EQUAL);
            else addToken(TokenType.DOT_DOT);
        } else {
            addToken(TokenType.DOT);
        }
    }

    private void less() {
        if (match('=')) {
            addToken(TokenType.LESS_EQUAL);
        } else if (isAlpha(peek()) && tagOpenAllowed()) {
            String name = tagName();
            addToken(TokenType.JSX_OPEN, name);
            modes.push(new Frame(Mode.TAG, name));
        } else {
            addToken(TokenType.LESS);
        }
    }

    /**
     * A {@code <} opens a tag unless the previous significant token ends a value.
     */
    private boolean tagOpenAllowed() {
        if (tokens.isEmpty()) return true;
        return switch (tokens.get(tokens.size() - 1).type()) {
            case IDENTIFIER, NUMBER, STRING, STRING_TEMPLATE, TRUE, FALSE, NIL,
                 RIGHT_PAREN, RIGHT_BRACKET, RIGHT_BRACE, JSX_CLOSE, JSX_SELF_CLOSE -> false;
            default -> true;
        };
    }

    private String tagName() {
        int nameStart = current;
        while (isAlphaNumeric(peek()) || peek() == '-' || peek() == '.') advance();
        return source.substring(nameStart, current);
    }

    private void scanTagToken(Frame frame) {
        char c = advance();
        switch (c) {
            case '>' -> {
                addToken(TokenType.JSX_TAG_END);
                modes.pop();
                modes.push(new Frame(Mode.ELEMENT, frame.tag));
            }
            case '/' -> {
                if (!match('>')) throw error("Expected '>' after '/' in tag <" + frame.tag + ">");
                addToken(TokenType.JSX_SELF_CLOSE);
                modes.pop();
            }
            case '=' -> addToken(TokenType.EQUAL);
            case '"', '\'' -> string(c);
            case '{' -> {
                addToken(TokenType.LEFT_BRACE);
                modes.push(new Frame(Mode.EMBEDDED, null));
            }
            default -> {
                if (!isAlpha(c)) throw error("Unexpected character '" + c + "' in tag <" + frame.tag + ">");
                while (isAlphaNumeric(peek()) || peek() == '-' || peek() == ':') advance();
                addToken(TokenType.JSX_ATTR, source.substring(start, current));
            }
        }
    }

    private void scanContentToken(Frame frame) {
        char c = peek();
        if (c == '<' && peekNext() == '/') {
            advance();
            advance();
            String name = tagName();
            skipWhitespace();
            if (!match('>')) throw error("Expected '>' to close </" + name + ">");
            if (frame.mode == Mode.CONTROL_BODY) {
                throw error("Closing tag </" + name + "> inside an unfinished JSX control block");
            }
            addToken(TokenType.JSX_CLOSE, name);
            modes.pop();
        } else if (c == '<' && isAlpha(peekNext())) {
            advance();
            String name = tagName();
            addToken(TokenType.JSX_OPEN, name);
            modes.push(new Frame(Mode.TAG, name));
        } else if (c == '{') {
            advance();
            addToken(TokenType.LEFT_BRACE);
            modes.push(new Frame(Mode.EMBEDDED, null));
        } else if (c == '}') {
            advance();
            if (frame.mode != Mode.CONTROL_BODY) throw error("Unexpected '}' in JSX content");
            addToken(TokenType.RIGHT_BRACE);
            modes.pop();
        } else if (atControlKeyword()) {
            modes.push(new Frame(Mode.CONTROL_HEAD, null));
        } else {
            jsxText();
        }
    }

    // A '<' that opens no tag is part of the text.
    private void jsxText() {
        int lastVisible = current;
        while (!isAtEnd() && !tagStartsAt(current) && peek() != '{' && peek() != '}') {
            char c = advance();
            if (!Character.isWhitespace(c)) lastVisible = current;
        }
        String text = source.substring(start, lastVisible);
        tokens.add(new Token(TokenType.JSX_TEXT, text, text, startLine, startColumn, fileName));
    }

    private boolean atControlKeyword() {
        int end = current;
        while (end < source.length() && isAlpha(source.charAt(end))) end++;
        String word = source.substring(current, end);
        switch (word) {
            case "if", "elif" -> { return braceBeforeLineEnd(end); }
            case "for" -> { return source.indexOf(" in ", end) >= 0 && braceBeforeLineEnd(end); }
            case "else" -> {
                int i = end;
                while (i < source.length() && Character.isWhitespace(source.charAt(i))) i++;
                return i < source.length() && (source.charAt(i) == '{' || source.startsWith("if", i));
            }
            default -> { return false; }
        }
    }

    private boolean braceBeforeLineEnd(int from) {
        for (int i = from; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '{') return true;
            if (c == '\n' || tagStartsAt(i)) return false;
        }
        return false;
    }

    private boolean tagStartsAt(int index) {
        if (index + 1 >= source.length() || source.charAt(index) != '<') return false;
        char next = source.charAt(index + 1);
        return next == '/' || isAlpha(next);
    }

    private void string(char quote) {
        StringBuilder text = new StringBuilder();
        List<TemplatePart> parts = new ArrayList<>();
        boolean interpolated = false;
        while (true) {
            if (isAtEnd()) throw error("Unterminated string");
            char c = advance();
            if (c == quote) break;
            if (c == '\\') {
                if (isAtEnd()) throw error("Unterminated string");
                text.append(escape(advance()));
            } else if (c == '{' && quote == '"') {
                if (!text.isEmpty()) parts.add(TemplatePart.text(text.toString()));
                text.setLength(0);
                parts.add(interpolation());
                interpolated = true;
            } else {
                text.append(c);
            }
        }
        if (!interpolated) {
            addToken(TokenType.STRING, text.toString());
            return;
        }
        if (!text.isEmpty()) parts.add(TemplatePart.text(text.toString()));
        addToken(TokenType.STRING_TEMPLATE, List.copyOf(parts));
    }

    private TemplatePart interpolation() {
        int exprStart = current;
        int exprLine = line;
        int exprColumn = column;
        int depth = 1;
        while (depth > 0) {
            if (isAtEnd()) throw error("Unterminated string interpolation");
            char c = advance();
            if (c == '{') depth++;
            else if (c == '}') depth--;
            else if (c == '"' || c == '\'') skipNestedString(c);
        }
        String expr = source.substring(exprStart, current - 1);
        if (expr.isBlank()) throw error("Empty string interpolation");
        List<Token> sub = new Lexer(expr, fileName, exprLine, exprColumn).scanTokens();
        return TemplatePart.expr(expr, sub.subList(0, sub.size() - 1));
    }

    private void skipNestedString(char quote) {
        while (peek() != quote) {
            if (isAtEnd()) throw error("Unterminated string interpolation");
            if (advance() == '\\' && !isAtEnd()) advance();
        }
        advance();
    }

    private static char escape(char c) {
        return switch (c) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            case '0' -> '\0';
            default -> c;
        };
    }

    private void number(char first) {
        if (first == '0' && peek() != '\0' && "xXoObB".indexOf(peek()) >= 0) {
            char prefix = Character.toLowerCase(advance());
            int radix = prefix == 'x' ? 16 : prefix == 'o' ? 8 : 2;
            while (Character.digit(peek(), radix) >= 0 || peek() == '_') advance();
            String digits = source.substring(start + 2, current).replace("_", "");
            if (digits.isEmpty()) throw error("Malformed number literal '" + source.substring(start, current) + "'");
            addToken(TokenType.NUMBER, parseLong(digits, radix));
            return;
        }
        while (isDigit(peek()) || peek() == '_') advance();
        boolean fractional = false;
        if (peek() == '.' && isDigit(peekNext())) {
            fractional = true;
            advance();
            while (isDigit(peek()) || peek() == '_') advance();
        }
        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext()) || ((peekNext() == '+' || peekNext() == '-') && isDigit(peekAt(2))))) {
            fractional = true;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            while (isDigit(peek())) advance();
        }
        String cleaned = source.substring(start, current).replace("_", "");
        addToken(TokenType.NUMBER, fractional ? (Object) Double.parseDouble(cleaned) : (Object) parseLong(cleaned, 10));
    }

    private long parseLong(String digits, int radix) {
        try {
            return Long.parseLong(digits, radix);
        } catch (NumberFormatException e) {
            throw error("Number literal out of range: " + source.substring(start, current));
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        if ("style".equals(text) && braceFollows()) {
            styleBlock();
            return;
        }
        TokenType type = KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER);
        Object value = switch (type) {
            case TRUE -> Boolean.TRUE;
            case FALSE -> Boolean.FALSE;
            case IDENTIFIER -> text;
            default -> null;
        };
        addToken(type, value);
    }

    private boolean braceFollows() {
        int i = current;
        while (i < source.length() && Character.isWhitespace(source.charAt(i))) i++;
        return i < source.length() && source.charAt(i) == '{';
    }

    private void styleBlock() {
        while (peek() != '{') advance();
        advance();
        int bodyStart = current;
        int depth = 1;
        while (depth > 0) {
            if (isAtEnd()) throw error("Unterminated style block");
            char c = advance();
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            } else if (c == '"' || c == '\'') {
                while (!isAtEnd() && peek() != c) {
                    if (advance() == '\\' && !isAtEnd()) advance();
                }
                if (isAtEnd()) throw error("Unterminated style block");
                advance();
            } else if (c == '/' && peek() == '*') {
                advance();
                while (!(peek() == '*' && peekNext() == '/')) {
                    if (isAtEnd()) throw error("Unterminated style block");
                    advance();
                }
                advance();
                advance();
            }
        }
        addToken(TokenType.STYLE_BLOCK, source.substring(bodyStart, current - 1));
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) advance();
    }

    private String unclosedDescription() {
        for (Frame frame : modes) {
            if (frame.tag != null) return "Unclosed JSX element <" + frame.tag + ">";
        }
        return "Unterminated JSX block";
    }

    private LexError error(String message) {
        return new LexError(message, new SourceInfo(fileName, startLine, startColumn));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        int index = current + offset;
        return index >= source.length() ? '\0' : source.charAt(index);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object value) {
        tokens.add(new Token(type, source.substring(start, current), value, startLine, startColumn, fileName));
    }
}
