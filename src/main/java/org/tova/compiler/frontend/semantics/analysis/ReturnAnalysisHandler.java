package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.ReturnNode;
import org.tova.compiler.frontend.semantics.AnalysisContext;
import org.tova.compiler.frontend.semantics.ConversionHints;
import org.tova.compiler.frontend.semantics.SymbolTable;
import org.tova.compiler.frontend.types.Type;
import org.tova.compiler.internal.i18n.Messages;

import java.util.Optional;

/**
 * Checks that {@code return} appears inside a function and that its value fits the declared return type.
 */
public class ReturnAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public ReturnAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        ReturnNode ret = (ReturnNode) node;
        Optional<SymbolTable.Scope> function = symbolTable.currentFunction();
        if (function.isEmpty()) {
            diagnostics.reportError(Messages.get("context.return"), ret.loc(), CompilerErrorCode.E301, null);
            return;
        }
        Type expected = function.get().getReturnType();
        if (ret.value() == null || !expected.isKnown()) return;
        Type actual = context.inferrer().infer(ret.value());
        if (actual.isKnown() && !actual.isAssignableTo(expected)) {
            String owner = function.get().getOwner() == null ? "<lambda>" : function.get().getOwner();
            diagnostics.reportError(Messages.get("type.return", owner, expected.display(), actual.display()),
                    ret.loc(), CompilerErrorCode.E101, ConversionHints.hint(expected, actual));
        }
    }
}
