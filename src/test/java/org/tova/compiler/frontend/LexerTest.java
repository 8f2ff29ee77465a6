package org.tova.compiler.frontend;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tova.compiler.diagnostics.LexError;
import org.tova.compiler.frontend.lexer.Lexer;
import org.tova.compiler.frontend.lexer.TemplatePart;
import org.tova.compiler.frontend.lexer.Token;
import org.tova.compiler.frontend.lexer.TokenType;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests cover literals, keywords, newline handling, string interpolation and the
 * JSX scanning modes. They do not require external resources.
 */
public class LexerTest {

    private static List<Token> lex(String source) {
        return new Lexer(source, "test.tova").scanTokens();
    }

    private static List<TokenType> types(String source) {
        return lex(source).stream().map(Token::type).toList();
    }

    @Test
    @Tag("unit")
    void testNumbersCarryParsedValues() {
        // Arrange
        String source = "x = 0x1F + 2.5e1 + 1_000";

        // Act
        List<Token> tokens = lex(source);

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.NUMBER, TokenType.PLUS,
                TokenType.NUMBER, TokenType.PLUS, TokenType.NUMBER, TokenType.END_OF_FILE);
        assertThat(tokens.get(2).value()).isEqualTo(31L);
        assertThat(tokens.get(4).value()).isEqualTo(25.0);
        assertThat(tokens.get(6).value()).isEqualTo(1000L);
    }

    @Test
    @Tag("unit")
    void testKeywordsAreDistinguishedFromIdentifiers() {
        // Act
        List<TokenType> types = types("fn matcher match true nil");

        // Assert
        assertThat(types).containsExactly(TokenType.FN, TokenType.IDENTIFIER, TokenType.MATCH,
                TokenType.TRUE, TokenType.NIL, TokenType.END_OF_FILE);
    }

    @Test
    @Tag("unit")
    void testRangeOperators() {
        assertThat(types("1..5")).containsExactly(TokenType.NUMBER, TokenType.DOT_DOT, TokenType.NUMBER, TokenType.END_OF_FILE);
        assertThat(types("1..=5")).containsExactly(TokenType.NUMBER, TokenType.DOT_DOT_EQUAL, TokenType.NUMBER, TokenType.END_OF_FILE);
    }

    @Test
    @Tag("unit")
    void testNewlinesInsideParenthesesAreSuppressed() {
        // Act
        List<TokenType> types = types("f(1,\n2)\nx");

        // Assert
        assertThat(types).containsExactly(TokenType.IDENTIFIER, TokenType.LEFT_PAREN, TokenType.NUMBER,
                TokenType.COMMA, TokenType.NUMBER, TokenType.RIGHT_PAREN, TokenType.NEWLINE,
                TokenType.IDENTIFIER, TokenType.END_OF_FILE);
    }

    @Test
    @Tag("unit")
    void testDoubleQuotedStringWithInterpolationBecomesTemplate() {
        // Act
        Token token = lex("\"Hello {name}!\"").get(0);

        // Assert
        assertThat(token.type()).isEqualTo(TokenType.STRING_TEMPLATE);
        @SuppressWarnings("unchecked")
        List<TemplatePart> parts = (List<TemplatePart>) token.value();
        assertThat(parts).extracting(TemplatePart::kind).containsExactly(
                TemplatePart.Kind.TEXT, TemplatePart.Kind.EXPR, TemplatePart.Kind.TEXT);
        assertThat(parts.get(1).text()).isEqualTo("name");
        assertThat(parts.get(1).tokens()).extracting(Token::type).containsExactly(TokenType.IDENTIFIER);
    }

    @Test
    @Tag("unit")
    void testSingleQuotedStringIsNeverInterpolated() {
        // Act
        Token token = lex("'a{b}\\n'").get(0);

        // Assert
        assertThat(token.type()).isEqualTo(TokenType.STRING);
        assertThat(token.value()).isEqualTo("a{b}\n");
    }

    @Test
    @Tag("unit")
    void testCommentsAndDocstrings() {
        // Act
        List<Token> tokens = lex("/* a /* nested */ b */ /// Adds things\nx // trailing");

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.DOCSTRING, TokenType.NEWLINE, TokenType.IDENTIFIER, TokenType.END_OF_FILE);
        assertThat(tokens.get(0).value()).isEqualTo("Adds things");
    }

    @Test
    @Tag("unit")
    void testTokenPositionsAreOneBased() {
        // Act
        Token y = lex("x\n  y").get(2);

        // Assert
        assertThat(y.text()).isEqualTo("y");
        assertThat(y.line()).isEqualTo(2);
        assertThat(y.column()).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void testLessThanAfterValueIsComparison() {
        assertThat(types("a < b")).containsExactly(TokenType.IDENTIFIER, TokenType.LESS, TokenType.IDENTIFIER, TokenType.END_OF_FILE);
    }

    @Test
    @Tag("unit")
    void testJsxElementWithAttributeAndText() {
        // Act
        List<Token> tokens = lex("<div class=\"box\">hi there</div>");

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.JSX_OPEN, TokenType.JSX_ATTR, TokenType.EQUAL, TokenType.STRING,
                TokenType.JSX_TAG_END, TokenType.JSX_TEXT, TokenType.JSX_CLOSE, TokenType.END_OF_FILE);
        assertThat(tokens.get(0).value()).isEqualTo("div");
        assertThat(tokens.get(5).value()).isEqualTo("hi there");
        assertThat(tokens.get(6).value()).isEqualTo("div");
    }

    @Test
    @Tag("unit")
    void testJsxControlBlockSwitchesBackToCode() {
        // Act
        List<TokenType> types = types("<ul>if show { <li/> }</ul>");

        // Assert
        assertThat(types).containsExactly(
                TokenType.JSX_OPEN, TokenType.JSX_TAG_END, TokenType.IF, TokenType.IDENTIFIER,
                TokenType.LEFT_BRACE, TokenType.JSX_OPEN, TokenType.JSX_SELF_CLOSE, TokenType.RIGHT_BRACE,
                TokenType.JSX_CLOSE, TokenType.END_OF_FILE);
    }

    @Test
    @Tag("unit")
    void testStyleBlockIsCapturedRaw() {
        // Act
        List<Token> tokens = lex("style { .a { color: red; } }");

        // Assert
        assertThat(tokens.get(0).type()).isEqualTo(TokenType.STYLE_BLOCK);
        assertThat((String) tokens.get(0).value()).contains(".a { color: red; }");
    }

    @Test
    @Tag("unit")
    void testUnterminatedStringFails() {
        assertThatThrownBy(() -> lex("x = \"open"))
                .isInstanceOf(LexError.class)
                .hasMessageContaining("Unterminated string");
    }

    @Test
    @Tag("unit")
    void testUnclosedJsxElementFails() {
        assertThatThrownBy(() -> lex("<div>text"))
                .isInstanceOf(LexError.class)
                .hasMessageContaining("Unclosed JSX element <div>");
    }

    @Test
    @Tag("unit")
    void testLoneAmpersandReportsSuggestion() {
        assertThatThrownBy(() -> lex("a & b"))
                .isInstanceOf(LexError.class)
                .hasMessageContaining("Did you mean '&&' or 'and'?");
    }

    @Test
    @Tag("unit")
    void testBareLessThanInJsxTextIsText() {
        // Act
        List<Token> tokens = assertTimeoutPreemptively(Duration.ofSeconds(3), () -> lex("x = <p>1 < 2</p>"));

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.JSX_OPEN, TokenType.JSX_TAG_END,
                TokenType.JSX_TEXT, TokenType.JSX_CLOSE, TokenType.END_OF_FILE);
        assertThat(tokens.get(4).value()).isEqualTo("1 < 2");
    }

    @Test
    @Tag("unit")
    void testControlHeaderMayContainComparison() {
        // Act
        List<TokenType> types = assertTimeoutPreemptively(Duration.ofSeconds(3),
                () -> types("x = <div>\n if count < 0 { <b>neg</b> }\n</div>"));

        // Assert
        assertThat(types).containsExactly(
                TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.JSX_OPEN, TokenType.JSX_TAG_END,
                TokenType.IF, TokenType.IDENTIFIER, TokenType.LESS, TokenType.NUMBER, TokenType.LEFT_BRACE,
                TokenType.JSX_OPEN, TokenType.JSX_TAG_END, TokenType.JSX_TEXT, TokenType.JSX_CLOSE,
                TokenType.RIGHT_BRACE, TokenType.JSX_CLOSE, TokenType.END_OF_FILE);
    }

    @Test
    @Tag("unit")
    void testTrailingLessThanInJsxTextStillMakesProgress() {
        assertThatThrownBy(() -> assertTimeoutPreemptively(Duration.ofSeconds(3), () -> lex("<p>a <")))
                .isInstanceOf(LexError.class)
                .hasMessageContaining("Unclosed JSX element <p>");
    }

    @Test
    @Tag("unit")
    void testUnterminatedBlockCommentFails() {
        assertThatThrownBy(() -> lex("x = 1 /* never closed"))
                .isInstanceOf(LexError.class)
                .hasMessageContaining("Unterminated block comment");
    }

    @Test
    @Tag("unit")
    void testUnterminatedInterpolationFails() {
        assertThatThrownBy(() -> lex("x = \"total {count"))
                .isInstanceOf(LexError.class)
                .hasMessageContaining("Unterminated string interpolation");
    }

    @Test
    @Tag("unit")
    void testEveryTokenRelexesFromItsSourceSlice() {
        // Arrange
        String source = String.join("\n",
                "fn area(w: Float, h: Float) -> Float {",
                "  total = w * h + 0x1F - 2.5e1 % 3",
                "  if total >= 10 and not done { return [1..10, 1..=3] }",
                "  items |> map(square)",
                "  name = \"plain\" + 'single'",
                "  a?.b ?? c",
                "  x += 1",
                "  ok = a < b || a != b && a <= b",
                "}");

        // Act
        List<Token> tokens = lex(source);

        // Assert
        for (Token token : tokens) {
            if (token.type() == TokenType.NEWLINE || token.type() == TokenType.END_OF_FILE) continue;
            List<Token> again = lex(token.text());
            assertThat(again).as("re-lexing '%s'", token.text()).hasSize(2);
            assertThat(again.get(0).type()).as("type of '%s'", token.text()).isEqualTo(token.type());
            assertThat(again.get(0).value()).as("value of '%s'", token.text()).isEqualTo(token.value());
            assertThat(again.get(0).text()).isEqualTo(token.text());
        }
    }
}
