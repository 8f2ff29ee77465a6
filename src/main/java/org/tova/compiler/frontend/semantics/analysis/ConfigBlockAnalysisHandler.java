package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.semantics.SymbolTable;

import java.util.List;

/**
 * Deploy and security blocks hold only declarative configuration; nothing inside them is resolved.
 */
public class ConfigBlockAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        // Nothing to check.
    }

    @Override
    public List<AstNode> children(AstNode node) {
        return List.of();
    }
}
