package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.BlockNode;
import org.tova.compiler.frontend.parser.features.select.SelectCaseNode;
import org.tova.compiler.frontend.semantics.AnalysisContext;
import org.tova.compiler.frontend.semantics.Symbol;
import org.tova.compiler.frontend.semantics.SymbolTable;
import org.tova.compiler.frontend.types.UnknownType;

import java.util.List;

/**
 * Opens a scope per select arm. A receive arm binds the received value.
 */
public class SelectCaseAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public SelectCaseAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        SelectCaseNode arm = (SelectCaseNode) node;
        symbolTable.enterScope();
        if (arm.kind() == SelectCaseNode.Kind.RECEIVE && arm.binding() != null && !arm.binding().equals("_")) {
            symbolTable.define(new Symbol(arm.binding(), Symbol.Kind.PARAMETER, UnknownType.INSTANCE, false, List.of(), arm.loc()));
        }
    }

    @Override
    public List<AstNode> children(AstNode node) {
        SelectCaseNode arm = (SelectCaseNode) node;
        Object body = arm.body() instanceof BlockNode block ? block.statements() : arm.body();
        return AstNode.children(arm.channel(), arm.value(), body);
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        ScopeSupport.leave(context, symbolTable, diagnostics);
    }
}
