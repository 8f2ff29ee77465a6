package org.tova.compiler.frontend.parser.features.select;

import org.tova.compiler.diagnostics.ParseError;
import org.tova.compiler.frontend.lexer.Token;
import org.tova.compiler.frontend.lexer.TokenType;
import org.tova.compiler.frontend.parser.ParsingContext;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.CallNode;
import org.tova.compiler.frontend.parser.ast.MemberAccessNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code select} statements.
 * Arms: {@code case v from ch =>}, {@code case ch.send(x) =>}, {@code case timeout(ms) =>}, {@code case _ =>}.
 */
public final class SelectParser {

    private SelectParser() {
    }

    /**
     * @param context The parsing context.
     * @return true if the cursor is at a select statement.
     */
    public static boolean detect(ParsingContext context) {
        return context.checkWord("select") && context.checkNext(TokenType.LEFT_BRACE);
    }

    /**
     * @param context The parsing context positioned at {@code select}.
     * @return The select node.
     */
    public static SelectNode parse(ParsingContext context) {
        Token keyword = context.advance();
        List<SelectCaseNode> cases = new ArrayList<>();
        boolean[] sawDefault = {false};
        context.parseBracedStatements(() -> {
            SelectCaseNode arm = arm(context);
            if (arm.kind() == SelectCaseNode.Kind.DEFAULT) {
                if (sawDefault[0]) {
                    throw new ParseError(
                            "A select can have at most one default arm", arm.loc());
                }
                sawDefault[0] = true;
            }
            cases.add(arm);
            context.endStatement();
            return arm;
        });
        return new SelectNode(List.copyOf(cases), keyword.loc());
    }

    private static SelectCaseNode arm(ParsingContext context) {
        Token start = context.peek();
        if (!context.checkWord("case")) throw context.error("Expected 'case' in select");
        context.advance();

        SelectCaseNode.Kind kind;
        AstNode channel = null;
        String binding = null;
        AstNode value = null;
        if (context.checkWord("_")) {
            context.advance();
            kind = SelectCaseNode.Kind.DEFAULT;
        } else if (context.checkWord("timeout") && context.checkNext(TokenType.LEFT_PAREN)) {
            context.advance();
            context.advance();
            value = context.parseExpression();
            context.consume(TokenType.RIGHT_PAREN, "Expected ')' after timeout");
            kind = SelectCaseNode.Kind.TIMEOUT;
        } else if (context.check(TokenType.IDENTIFIER) && context.checkNext(TokenType.FROM)) {
            binding = context.advance().text();
            context.advance();
            channel = context.parseOperand();
            kind = SelectCaseNode.Kind.RECEIVE;
        } else {
            AstNode expression = context.parseExpression();
            if (!(expression instanceof CallNode call)
                    || !(call.callee() instanceof MemberAccessNode member)
                    || !member.property().equals("send")
                    || call.arguments().size() != 1) {
                throw new ParseError(
                        "Expected 'name from channel', 'channel.send(value)', 'timeout(ms)' or '_' in select case",
                        start.loc());
            }
            channel = member.object();
            value = call.arguments().get(0);
            kind = SelectCaseNode.Kind.SEND;
        }
        context.consume(TokenType.FAT_ARROW, "Expected '=>' after select case");
        context.skipNewlines();
        AstNode body = context.check(TokenType.LEFT_BRACE) ? context.parseBlock() : context.parseExpression();
        return new SelectCaseNode(kind, channel, binding, value, body, start.loc());
    }
}
