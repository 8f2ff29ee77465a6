package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.BlockNode;
import org.tova.compiler.frontend.semantics.AnalysisContext;
import org.tova.compiler.frontend.semantics.ReturnPathAnalyzer;
import org.tova.compiler.frontend.semantics.SymbolTable;

/**
 * Opens a block scope for every braced statement list.
 */
public class BlockAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public BlockAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        BlockNode block = (BlockNode) node;
        symbolTable.enterScope();
        context.declarations().hoist(block.statements(), symbolTable);
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        ReturnPathAnalyzer.reportUnreachable(((BlockNode) node).statements(), diagnostics);
        ScopeSupport.leave(context, symbolTable, diagnostics);
    }
}
