package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.semantics.SymbolTable;

import java.util.List;

/**
 * An interface for handlers that perform semantic analysis on a specific type of AST node.
 * The analyzer calls {@link #analyze} before walking the node's children and {@link #afterChildren}
 * once they are done.
 */
@FunctionalInterface
public interface IAnalysisHandler {
    /**
     * Analyzes the given AST node before its children are visited.
     * @param node The AST node to analyze.
     * @param symbolTable The symbol table for resolving symbols.
     * @param diagnostics The diagnostics engine for reporting errors.
     */
    void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics);

    /**
     * Called after all children returned by {@link #children(AstNode)} have been visited.
     * @param node The AST node.
     * @param symbolTable The symbol table.
     * @param diagnostics The diagnostics engine.
     */
    default void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
    }

    /**
     * @param node The AST node.
     * @return The children the analyzer walks for this node; by default all of them.
     */
    default List<AstNode> children(AstNode node) {
        return node.getChildren();
    }
}
