package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.IdentifierNode;
import org.tova.compiler.frontend.semantics.AnalysisContext;
import org.tova.compiler.frontend.semantics.SymbolTable;
import org.tova.compiler.internal.i18n.Messages;

/**
 * Resolves identifier references. Undefined names get a "did you mean" hint.
 */
public class IdentifierAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public IdentifierAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        String name = ((IdentifierNode) node).name();
        if (name.equals("_")) return;
        if (symbolTable.resolve(name).isPresent() || context.globals().contains(name)) return;
        String hint = context.suggest(name, symbolTable)
                .map(s -> Messages.get("binding.undefined.hint", s))
                .orElse(null);
        context.reportGradual(diagnostics, Messages.get("binding.undefined", name), node.loc(), CompilerErrorCode.E200, hint);
    }
}
