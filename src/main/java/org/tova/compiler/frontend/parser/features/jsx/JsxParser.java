package org.tova.compiler.frontend.parser.features.jsx;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.diagnostics.ParseError;
import org.tova.compiler.frontend.lexer.Token;
import org.tova.compiler.frontend.lexer.TokenType;
import org.tova.compiler.frontend.parser.ParsingContext;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.BooleanLiteralNode;
import org.tova.compiler.frontend.parser.ast.StringLiteralNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses JSX markup from the JSX token kinds produced by the lexer.
 */
public class JsxParser {

    private final ParsingContext context;

    /**
     * @param context The parsing context positioned at a {@code JSX_OPEN} token.
     */
    public JsxParser(ParsingContext context) {
        this.context = context;
    }

    /**
     * Parses one element including its attributes and children.
     * @return The element node.
     */
    public JsxElementNode parseElement() {
        Token open = context.consume(TokenType.JSX_OPEN, "Expected a JSX element");
        String tag = (String) open.value();
        List<AstNode> attributes = attributes();

        if (context.match(TokenType.JSX_SELF_CLOSE)) {
            return new JsxElementNode(tag, attributes, List.of(), true, open.loc());
        }
        context.consume(TokenType.JSX_TAG_END, "Expected '>' or '/>' to end tag <" + tag + ">");
        List<AstNode> children = children(TokenType.JSX_CLOSE);
        Token close = context.peek();
        context.consume(TokenType.JSX_CLOSE, "Expected </" + tag + ">");
        String closeName = (String) close.value();
        if (!tag.equals(closeName)) {
            throw new ParseError(
                    "Mismatched closing tag: expected </" + tag + "> but found </" + closeName + ">",
                    close.loc(), CompilerErrorCode.E008, "Close <" + tag + "> with </" + tag + ">");
        }
        return new JsxElementNode(tag, attributes, children, false, open.loc());
    }

    private List<AstNode> attributes() {
        List<AstNode> attributes = new ArrayList<>();
        while (true) {
            Token token = context.peek();
            if (context.match(TokenType.LEFT_BRACE)) {
                context.consume(TokenType.SPREAD, "Expected '...' in spread attribute");
                AstNode expression = context.parseExpression();
                context.consume(TokenType.RIGHT_BRACE, "Expected '}' after spread attribute");
                attributes.add(new JsxSpreadAttributeNode(expression, token.loc()));
            } else if (context.match(TokenType.JSX_ATTR)) {
                attributes.add(new JsxAttributeNode(token.text(), attributeValue(token), token.loc()));
            } else {
                return List.copyOf(attributes);
            }
        }
    }

    private AstNode attributeValue(Token name) {
        if (!context.match(TokenType.EQUAL)) {
            return name.text().startsWith("use:") ? null : new BooleanLiteralNode(true, name.loc());
        }
        Token value = context.peek();
        if (context.match(TokenType.STRING)) {
            return new StringLiteralNode((String) value.value(), value.loc());
        }
        if (context.check(TokenType.STRING_TEMPLATE)) {
            return context.parseExpression();
        }
        context.consume(TokenType.LEFT_BRACE, "Expected a string or '{' after '" + name.text() + "='");
        context.skipNewlines();
        AstNode expression = context.parseExpression();
        context.skipNewlines();
        context.consume(TokenType.RIGHT_BRACE, "Expected '}' after attribute value");
        return expression;
    }

    private List<AstNode> children(TokenType terminator) {
        List<AstNode> children = new ArrayList<>();
        while (!context.check(terminator)) {
            Token token = context.peek();
            switch (token.type()) {
                case JSX_TEXT -> {
                    context.advance();
                    children.add(new JsxTextNode((String) token.value(), token.loc()));
                }
                case JSX_OPEN -> children.add(parseElement());
                case LEFT_BRACE -> {
                    context.advance();
                    context.skipNewlines();
                    AstNode expression = context.parseExpression();
                    context.skipNewlines();
                    context.consume(TokenType.RIGHT_BRACE, "Expected '}' after JSX expression");
                    children.add(new JsxExpressionNode(expression, token.loc()));
                }
                case IF -> children.add(ifChild());
                case FOR -> children.add(forChild());
                case NEWLINE -> context.advance();
                case END_OF_FILE -> throw context.error("Unexpected end of input inside JSX");
                default -> throw context.error("Unexpected '" + token.text() + "' in JSX content");
            }
        }
        return List.copyOf(children);
    }

    private List<AstNode> controlBody() {
        context.skipNewlines();
        context.consume(TokenType.LEFT_BRACE, "Expected '{' to open JSX block");
        List<AstNode> children = children(TokenType.RIGHT_BRACE);
        context.consume(TokenType.RIGHT_BRACE, "Expected '}' to close JSX block");
        return children;
    }

    private AstNode ifChild() {
        Token keyword = context.advance();
        AstNode condition = context.parseExpression();
        List<AstNode> children = controlBody();
        List<JsxBranchNode> alternates = new ArrayList<>();
        List<AstNode> elseChildren = null;
        while (true) {
            Token next = context.peek();
            if (context.match(TokenType.ELIF)) {
                AstNode branchCondition = context.parseExpression();
                alternates.add(new JsxBranchNode(branchCondition, controlBody(), next.loc()));
            } else if (context.check(TokenType.ELSE) && context.checkNext(TokenType.IF)) {
                context.advance();
                context.advance();
                AstNode branchCondition = context.parseExpression();
                alternates.add(new JsxBranchNode(branchCondition, controlBody(), next.loc()));
            } else if (context.match(TokenType.ELSE)) {
                elseChildren = controlBody();
                break;
            } else {
                break;
            }
        }
        return new JsxIfNode(condition, children, List.copyOf(alternates), elseChildren, keyword.loc());
    }

    private AstNode forChild() {
        Token keyword = context.advance();
        List<String> variables = new ArrayList<>();
        variables.add(context.consume(TokenType.IDENTIFIER, "Expected loop variable in JSX for").text());
        if (context.match(TokenType.COMMA)) {
            variables.add(context.consume(TokenType.IDENTIFIER, "Expected second loop variable").text());
        }
        context.consume(TokenType.IN, "Expected 'in' in JSX for");
        AstNode iterable = context.parseExpression();
        return new JsxForNode(List.copyOf(variables), iterable, controlBody(), keyword.loc());
    }
}
