package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.features.concurrency.ConcurrentBlockNode;
import org.tova.compiler.frontend.semantics.SymbolTable;

import java.util.List;

/**
 * Bindings made by {@code x = spawn f()} inside a concurrent block stay visible after it, so its body
 * is walked in the enclosing scope.
 */
public class ConcurrentAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        // No scope of its own.
    }

    @Override
    public List<AstNode> children(AstNode node) {
        ConcurrentBlockNode block = (ConcurrentBlockNode) node;
        return AstNode.children(block.timeout(), block.body().statements());
    }
}
