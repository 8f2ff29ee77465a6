package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.BinaryExpressionNode;
import org.tova.compiler.frontend.parser.ast.Operator;
import org.tova.compiler.frontend.parser.ast.StringLiteralNode;
import org.tova.compiler.frontend.parser.ast.TemplateLiteralNode;
import org.tova.compiler.frontend.parser.ast.UnaryExpressionNode;
import org.tova.compiler.frontend.semantics.AnalysisContext;
import org.tova.compiler.frontend.semantics.SymbolTable;
import org.tova.compiler.frontend.types.PrimitiveType;
import org.tova.compiler.frontend.types.Type;
import org.tova.compiler.internal.i18n.Messages;

/**
 * Checks operand types of arithmetic operators. Handles both binary and unary expressions.
 */
public class OperatorAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public OperatorAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        if (node instanceof BinaryExpressionNode binary) {
            checkBinary(binary, diagnostics);
        } else if (node instanceof UnaryExpressionNode unary && unary.operator() == Operator.NEGATE) {
            Type operand = context.inferrer().infer(unary.operand());
            if (operand.isKnown() && !operand.isNumeric()) {
                context.reportGradual(diagnostics, Messages.get("type.operand", "-", operand.display()), unary.loc(),
                        CompilerErrorCode.E104, null);
            }
        }
    }

    private void checkBinary(BinaryExpressionNode binary, DiagnosticsEngine diagnostics) {
        Operator op = binary.operator();
        if (!op.isArithmetic()) return;
        Type left = context.inferrer().infer(binary.left());
        Type right = context.inferrer().infer(binary.right());
        if (!left.isKnown() || !right.isKnown()) return;
        if (left.isNumeric() && right.isNumeric()) return;
        if (op == Operator.ADD && left == PrimitiveType.STRING && right == PrimitiveType.STRING) return;
        // "ab" * 3 repeats the string
        if (op == Operator.MULTIPLY && isStringLiteral(binary.left()) && right == PrimitiveType.INT) return;
        if (op == Operator.MULTIPLY && isStringLiteral(binary.right()) && left == PrimitiveType.INT) return;
        context.reportGradual(diagnostics, Messages.get("type.operands", op.symbol(), left.display(), right.display()),
                binary.loc(), CompilerErrorCode.E104, null);
    }

    private static boolean isStringLiteral(AstNode node) {
        return node instanceof StringLiteralNode || node instanceof TemplateLiteralNode;
    }
}
