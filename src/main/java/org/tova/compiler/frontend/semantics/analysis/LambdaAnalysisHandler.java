package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.BlockNode;
import org.tova.compiler.frontend.parser.ast.LambdaNode;
import org.tova.compiler.frontend.semantics.AnalysisContext;
import org.tova.compiler.frontend.semantics.ReturnPathAnalyzer;
import org.tova.compiler.frontend.semantics.SymbolTable;
import org.tova.compiler.frontend.types.UnknownType;

import java.util.List;
import java.util.Set;

/**
 * Handles lambdas. A lambda is its own async context: a plain lambda inside an async function
 * may not use {@code await}.
 */
public class LambdaAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public LambdaAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        LambdaNode lambda = (LambdaNode) node;
        symbolTable.enterFunctionScope(null, lambda.async(), UnknownType.INSTANCE);
        ScopeSupport.defineParameters(lambda.params(), Set.of(), context, symbolTable, diagnostics);
        if (lambda.body() instanceof BlockNode block) {
            context.declarations().hoist(block.statements(), symbolTable);
        }
    }

    @Override
    public List<AstNode> children(AstNode node) {
        LambdaNode lambda = (LambdaNode) node;
        List<AstNode> body = lambda.body() instanceof BlockNode block ? block.statements() : List.of(lambda.body());
        return ScopeSupport.parametersThenBody(lambda.params(), body);
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        if (((LambdaNode) node).body() instanceof BlockNode block) {
            ReturnPathAnalyzer.reportUnreachable(block.statements(), diagnostics);
        }
        ScopeSupport.leave(context, symbolTable, diagnostics);
    }
}
