package org.tova.compiler.frontend.parser.features.jsx;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tova.compiler.diagnostics.ParseError;
import org.tova.compiler.frontend.lexer.Lexer;
import org.tova.compiler.frontend.parser.Parser;
import org.tova.compiler.frontend.parser.ast.AssignmentNode;
import org.tova.compiler.frontend.parser.ast.BooleanLiteralNode;
import org.tova.compiler.frontend.parser.ast.IdentifierNode;
import org.tova.compiler.frontend.parser.ast.StringLiteralNode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link JsxParser}.
 */
public class JsxParserTest {

    private static JsxElementNode element(String source) {
        AssignmentNode assign = (AssignmentNode) new Parser(new Lexer(source, "view.tova").scanTokens()).parse().body().get(0);
        return (JsxElementNode) assign.value();
    }

    @Test
    @Tag("unit")
    void testAttributesTextAndExpressions() {
        // Act
        JsxElementNode div = element("view = <div class=\"card\" onclick={go}>Hi {name}</div>");

        // Assert
        assertThat(div.tag()).isEqualTo("div");
        assertThat(div.selfClosing()).isFalse();
        assertThat(div.attributes()).hasSize(2);
        JsxAttributeNode cls = (JsxAttributeNode) div.attributes().get(0);
        JsxAttributeNode click = (JsxAttributeNode) div.attributes().get(1);
        assertThat(cls.name()).isEqualTo("class");
        assertThat(cls.value()).isInstanceOfSatisfying(StringLiteralNode.class, s -> assertThat(s.value()).isEqualTo("card"));
        assertThat(click.value()).isInstanceOfSatisfying(IdentifierNode.class, id -> assertThat(id.name()).isEqualTo("go"));
        assertThat(div.children()).hasSize(2);
        assertThat(div.children().get(0)).isInstanceOfSatisfying(JsxTextNode.class, t -> assertThat(t.text()).isEqualTo("Hi"));
        assertThat(div.children().get(1)).isInstanceOf(JsxExpressionNode.class);
    }

    @Test
    @Tag("unit")
    void testSelfClosingWithSpreadAndBooleanAttribute() {
        // Act
        JsxElementNode input = element("view = <Field {...props} disabled />");

        // Assert
        assertThat(input.selfClosing()).isTrue();
        assertThat(input.attributes().get(0)).isInstanceOf(JsxSpreadAttributeNode.class);
        JsxAttributeNode disabled = (JsxAttributeNode) input.attributes().get(1);
        assertThat(disabled.value()).isInstanceOfSatisfying(BooleanLiteralNode.class, b -> assertThat(b.value()).isTrue());
    }

    @Test
    @Tag("unit")
    void testIfElseChildren() {
        // Act
        JsxElementNode list = element("view = <ul>if show { <li/> } else { <p/> }</ul>");

        // Assert
        assertThat(list.children()).hasSize(1);
        JsxIfNode branch = (JsxIfNode) list.children().get(0);
        assertThat(branch.children()).hasSize(1);
        assertThat(branch.alternates()).isEmpty();
        assertThat(branch.elseChildren()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void testForChildren() {
        // Act
        JsxElementNode list = element("view = <ul>for item in items { <li>{item}</li> }</ul>");

        // Assert
        JsxForNode loop = (JsxForNode) list.children().get(0);
        assertThat(loop.variables()).containsExactly("item");
        assertThat(loop.children()).singleElement().isInstanceOfSatisfying(JsxElementNode.class,
                li -> assertThat(li.tag()).isEqualTo("li"));
    }

    @Test
    @Tag("unit")
    void testMismatchedClosingTagIsReported() {
        assertThatThrownBy(() -> element("view = <div></span>"))
                .isInstanceOf(ParseError.class)
                .hasMessageContaining("Mismatched closing tag: expected </div> but found </span>");
    }
}
