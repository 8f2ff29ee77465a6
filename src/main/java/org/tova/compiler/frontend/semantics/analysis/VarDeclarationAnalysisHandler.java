package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.VarDeclarationNode;
import org.tova.compiler.frontend.semantics.AnalysisContext;
import org.tova.compiler.frontend.semantics.ConversionHints;
import org.tova.compiler.frontend.semantics.NamingConventionChecker;
import org.tova.compiler.frontend.semantics.Symbol;
import org.tova.compiler.frontend.semantics.SymbolTable;
import org.tova.compiler.frontend.types.Type;
import org.tova.compiler.internal.i18n.Messages;

import java.util.List;
import java.util.Set;

/**
 * Handles {@code var x: T = value}. A typed initializer that does not fit the annotation is an error.
 */
public class VarDeclarationAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public VarDeclarationAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        // Defined after the initializer.
    }

    @Override
    public List<AstNode> children(AstNode node) {
        VarDeclarationNode declaration = (VarDeclarationNode) node;
        return declaration.value() == null ? List.of() : List.of(declaration.value());
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        VarDeclarationNode declaration = (VarDeclarationNode) node;
        Type inferred = context.inferrer().infer(declaration.value());
        Type declared = context.resolveType(declaration.type(), Set.of());
        if (declared.isKnown() && !inferred.isAssignableTo(declared)) {
            diagnostics.reportError(Messages.get("type.initializer", declaration.name(), declared.display(), inferred.display()),
                    declaration.loc(), CompilerErrorCode.E100, ConversionHints.hint(declared, inferred));
        }
        context.naming().check(NamingConventionChecker.Subject.VARIABLE, declaration.name(), declaration.loc(), diagnostics);
        symbolTable.define(Symbol.mutableVariable(declaration.name(), declared.isKnown() ? declared : inferred, declaration.loc()));
    }
}
