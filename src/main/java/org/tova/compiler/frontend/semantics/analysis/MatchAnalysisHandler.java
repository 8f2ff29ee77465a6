package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.MatchNode;
import org.tova.compiler.frontend.semantics.AnalysisContext;
import org.tova.compiler.frontend.semantics.SymbolTable;

/**
 * Runs the exhaustiveness check once the subject and all arms have been analyzed.
 */
public class MatchAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public MatchAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        // Checked after the arms.
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        MatchNode match = (MatchNode) node;
        context.exhaustiveness().check(match, context.inferrer().infer(match.subject()), diagnostics);
    }
}
