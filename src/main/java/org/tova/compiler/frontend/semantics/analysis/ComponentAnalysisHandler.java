package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.features.client.ComponentNode;
import org.tova.compiler.frontend.semantics.AnalysisContext;
import org.tova.compiler.frontend.semantics.NamingConventionChecker;
import org.tova.compiler.frontend.semantics.SymbolTable;
import org.tova.compiler.frontend.types.UnknownType;

import java.util.List;
import java.util.Set;

/**
 * Components behave like functions: their props are parameters and their body is a function scope.
 */
public class ComponentAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public ComponentAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        ComponentNode component = (ComponentNode) node;
        context.naming().check(NamingConventionChecker.Subject.COMPONENT, component.name(), component.loc(), diagnostics);
        symbolTable.enterFunctionScope(component.name(), false, UnknownType.INSTANCE);
        ScopeSupport.defineParameters(component.params(), Set.of(), context, symbolTable, diagnostics);
        context.declarations().hoist(component.body(), symbolTable);
    }

    @Override
    public List<AstNode> children(AstNode node) {
        ComponentNode component = (ComponentNode) node;
        return ScopeSupport.parametersThenBody(component.params(), component.body());
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        ScopeSupport.leave(context, symbolTable, diagnostics);
    }
}
