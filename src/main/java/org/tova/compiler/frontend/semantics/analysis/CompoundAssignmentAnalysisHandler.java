package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.CompoundAssignmentNode;
import org.tova.compiler.frontend.parser.ast.IdentifierNode;
import org.tova.compiler.frontend.parser.ast.Operator;
import org.tova.compiler.frontend.semantics.AnalysisContext;
import org.tova.compiler.frontend.semantics.Symbol;
import org.tova.compiler.frontend.semantics.SymbolTable;
import org.tova.compiler.frontend.types.PrimitiveType;
import org.tova.compiler.frontend.types.Type;
import org.tova.compiler.internal.i18n.Messages;

import java.util.Optional;

/**
 * Handles {@code x += value} and friends. The target must be a mutable binding.
 */
public class CompoundAssignmentAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public CompoundAssignmentAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        CompoundAssignmentNode assignment = (CompoundAssignmentNode) node;
        if (!(assignment.target() instanceof IdentifierNode target)) return;
        Optional<Symbol> symbol = symbolTable.lookup(target.name());
        if (symbol.isEmpty()) return;
        if (!symbol.get().mutable()) {
            diagnostics.reportError(Messages.get("binding.immutable", target.name()), assignment.loc(),
                    CompilerErrorCode.E202, Messages.get("binding.immutable.hint", target.name()));
            return;
        }
        Type current = symbol.get().type();
        Type value = context.inferrer().infer(assignment.value());
        if (!current.isKnown() || !value.isKnown()) return;
        boolean ok = assignment.operator() == Operator.ADD && current == PrimitiveType.STRING
                ? value == PrimitiveType.STRING
                : current.isNumeric() && value.isNumeric();
        if (!ok) {
            context.reportGradual(diagnostics,
                    Messages.get("type.operands", assignment.operator().symbol() + "=", current.display(), value.display()),
                    assignment.loc(), CompilerErrorCode.E104, null);
        }
    }
}
