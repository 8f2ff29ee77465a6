package org.tova.compiler.frontend.semantics;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.*;
import org.tova.compiler.internal.i18n.Messages;

import java.util.List;

/**
 * Control-flow checks over statement lists: definite return and unreachable code.
 */
public final class ReturnPathAnalyzer {

    private ReturnPathAnalyzer() {}

    /**
     * A statement list returns on every path if some statement in it does. The last statement
     * also counts when it is an expression, which the function returns implicitly.
     * @param statements A function body.
     * @return {@code true} if every path ends in a return.
     */
    public static boolean alwaysReturns(List<AstNode> statements) {
        for (int i = 0; i < statements.size(); i++) {
            AstNode statement = statements.get(i);
            if (returns(statement)) return true;
            if (i == statements.size() - 1 && statement instanceof ExpressionStatementNode expr) {
                return !(expr.expression() instanceof MatchNode match) || matchReturns(match);
            }
        }
        return false;
    }

    private static boolean returns(AstNode statement) {
        if (statement instanceof ReturnNode) return true;
        if (statement instanceof BlockNode block) return alwaysReturns(block.statements());
        if (statement instanceof IfStatementNode ifs) {
            if (ifs.elseBody() == null || !alwaysReturns(ifs.consequent().statements())) return false;
            for (ConditionalBranchNode branch : ifs.alternates()) {
                if (!alwaysReturns(branch.body().statements())) return false;
            }
            return alwaysReturns(ifs.elseBody().statements());
        }
        if (statement instanceof TryCatchNode tc) {
            if (tc.finallyBody() != null && alwaysReturns(tc.finallyBody().statements())) return true;
            return alwaysReturns(tc.tryBody().statements())
                    && (tc.catchBody() == null || alwaysReturns(tc.catchBody().statements()));
        }
        if (statement instanceof ExpressionStatementNode expr && expr.expression() instanceof MatchNode match) {
            return matchReturns(match) && hasExplicitReturnArm(match);
        }
        return false;
    }

    private static boolean matchReturns(MatchNode match) {
        for (MatchArmNode arm : match.arms()) {
            if (arm.body() instanceof BlockNode block && !alwaysReturns(block.statements())) return false;
        }
        return true;
    }

    private static boolean hasExplicitReturnArm(MatchNode match) {
        return match.arms().stream().allMatch(arm -> arm.body() instanceof BlockNode);
    }

    /**
     * Reports the first statement that follows a return, break or continue in the same list.
     * @param statements A statement list.
     * @param diagnostics Receives the W201 warning.
     */
    public static void reportUnreachable(List<AstNode> statements, DiagnosticsEngine diagnostics) {
        for (int i = 0; i < statements.size() - 1; i++) {
            String keyword = terminator(statements.get(i));
            if (keyword != null) {
                diagnostics.reportWarning(Messages.get("flow.unreachable", keyword), statements.get(i + 1).loc(),
                        CompilerErrorCode.W201, null);
                return;
            }
        }
    }

    private static String terminator(AstNode statement) {
        if (statement instanceof ReturnNode) return "return";
        if (statement instanceof BreakNode) return "break";
        if (statement instanceof ContinueNode) return "continue";
        return null;
    }
}
