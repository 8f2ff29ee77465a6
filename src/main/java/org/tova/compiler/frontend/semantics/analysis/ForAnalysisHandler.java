package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.ForNode;
import org.tova.compiler.frontend.parser.features.jsx.JsxForNode;
import org.tova.compiler.frontend.parser.ast.ListComprehensionNode;
import org.tova.compiler.frontend.semantics.AnalysisContext;
import org.tova.compiler.frontend.semantics.NamingConventionChecker;
import org.tova.compiler.frontend.semantics.Symbol;
import org.tova.compiler.frontend.semantics.SymbolTable;
import org.tova.compiler.frontend.types.UnknownType;

import java.util.List;

/**
 * Handles every construct that binds loop variables: {@code for} statements, list comprehensions
 * and JSX {@code for} blocks.
 */
public class ForAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public ForAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        symbolTable.enterScope();
        for (String variable : variables(node)) {
            if (variable.equals("_")) continue;
            context.naming().check(NamingConventionChecker.Subject.VARIABLE, variable, node.loc(), diagnostics);
            symbolTable.define(new Symbol(variable, Symbol.Kind.PARAMETER, UnknownType.INSTANCE, false, List.of(), node.loc()));
        }
        if (node instanceof ForNode loop) {
            context.declarations().hoist(loop.body().statements(), symbolTable);
        }
    }

    @Override
    public List<AstNode> children(AstNode node) {
        if (node instanceof ForNode loop) {
            return AstNode.children(loop.iterable(), loop.body().statements(), loop.elseBody());
        }
        if (node instanceof ListComprehensionNode comprehension) {
            return AstNode.children(comprehension.iterable(), comprehension.condition(), comprehension.expression());
        }
        JsxForNode jsx = (JsxForNode) node;
        return AstNode.children(jsx.iterable(), jsx.children());
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        ScopeSupport.leave(context, symbolTable, diagnostics);
    }

    private static List<String> variables(AstNode node) {
        if (node instanceof ForNode loop) return loop.variables();
        if (node instanceof ListComprehensionNode comprehension) return List.of(comprehension.variable());
        return ((JsxForNode) node).variables();
    }
}
