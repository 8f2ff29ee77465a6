package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.TypeDeclarationNode;
import org.tova.compiler.frontend.parser.ast.TypeVariantNode;
import org.tova.compiler.frontend.semantics.AnalysisContext;
import org.tova.compiler.frontend.semantics.NamingConventionChecker;
import org.tova.compiler.frontend.semantics.SymbolTable;

import java.util.List;

/**
 * Naming checks for type declarations. The types themselves are registered when the scope is hoisted.
 */
public class TypeDeclarationAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public TypeDeclarationAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        TypeDeclarationNode type = (TypeDeclarationNode) node;
        context.naming().check(NamingConventionChecker.Subject.TYPE, type.name(), type.loc(), diagnostics);
        for (TypeVariantNode variant : type.variants()) {
            context.naming().check(NamingConventionChecker.Subject.TYPE, variant.name(), variant.loc(), diagnostics);
        }
    }

    @Override
    public List<AstNode> children(AstNode node) {
        return List.of();
    }
}
