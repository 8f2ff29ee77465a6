package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.TryCatchNode;
import org.tova.compiler.frontend.semantics.AnalysisContext;
import org.tova.compiler.frontend.semantics.Symbol;
import org.tova.compiler.frontend.semantics.SymbolTable;
import org.tova.compiler.frontend.types.UnknownType;

import java.util.List;

/**
 * Binds the catch parameter in a scope around the try statement.
 */
public class TryCatchAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public TryCatchAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        TryCatchNode tryCatch = (TryCatchNode) node;
        symbolTable.enterScope();
        if (tryCatch.catchParam() != null) {
            symbolTable.define(new Symbol(tryCatch.catchParam(), Symbol.Kind.PARAMETER, UnknownType.INSTANCE, false,
                    List.of(), tryCatch.loc()));
        }
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        ScopeSupport.leave(context, symbolTable, diagnostics);
    }
}
