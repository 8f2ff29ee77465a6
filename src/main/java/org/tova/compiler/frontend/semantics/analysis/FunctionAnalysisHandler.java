package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.FunctionDeclarationNode;
import org.tova.compiler.frontend.semantics.AnalysisContext;
import org.tova.compiler.frontend.semantics.NamingConventionChecker;
import org.tova.compiler.frontend.semantics.ReturnPathAnalyzer;
import org.tova.compiler.frontend.semantics.SymbolTable;
import org.tova.compiler.frontend.types.NilType;
import org.tova.compiler.frontend.types.Type;
import org.tova.compiler.internal.i18n.Messages;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Handles function declarations: opens the function scope, binds the parameters and checks
 * that a function with a declared return type returns on every path.
 */
public class FunctionAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public FunctionAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        FunctionDeclarationNode fn = (FunctionDeclarationNode) node;
        context.naming().check(NamingConventionChecker.Subject.FUNCTION, fn.name(), fn.loc(), diagnostics);
        if (symbolTable.resolveLocal(fn.name()).isEmpty()) {
            symbolTable.define(context.declarations().functionSymbol(fn));
        }
        Set<String> typeParams = new HashSet<>(fn.typeParams());
        Type returnType = context.resolveType(fn.returnType(), typeParams);
        symbolTable.enterFunctionScope(fn.name(), fn.async(), returnType);
        ScopeSupport.defineParameters(fn.params(), typeParams, context, symbolTable, diagnostics);
        context.declarations().hoist(fn.body().statements(), symbolTable);
    }

    @Override
    public List<AstNode> children(AstNode node) {
        FunctionDeclarationNode fn = (FunctionDeclarationNode) node;
        return ScopeSupport.parametersThenBody(fn.params(), fn.body().statements());
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        FunctionDeclarationNode fn = (FunctionDeclarationNode) node;
        List<AstNode> body = fn.body().statements();
        ReturnPathAnalyzer.reportUnreachable(body, diagnostics);
        Type returnType = symbolTable.getCurrentScope().getReturnType();
        if (returnType.isKnown() && !(returnType instanceof NilType) && !ReturnPathAnalyzer.alwaysReturns(body)) {
            diagnostics.reportWarning(Messages.get("flow.missing.return", fn.name(), returnType.display()), fn.loc(),
                    CompilerErrorCode.W205, Messages.get("flow.missing.return.hint"));
        }
        ScopeSupport.leave(context, symbolTable, diagnostics);
    }
}
