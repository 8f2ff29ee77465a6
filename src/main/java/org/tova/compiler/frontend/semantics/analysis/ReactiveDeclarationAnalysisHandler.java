package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.features.client.ComputedNode;
import org.tova.compiler.frontend.parser.features.client.StateNode;
import org.tova.compiler.frontend.semantics.AnalysisContext;
import org.tova.compiler.frontend.semantics.NamingConventionChecker;
import org.tova.compiler.frontend.semantics.Symbol;
import org.tova.compiler.frontend.semantics.SymbolTable;
import org.tova.compiler.frontend.types.Type;

import java.util.List;
import java.util.Set;

/**
 * Binds {@code state} and {@code computed} declarations after their initializer. State is writable,
 * computed values are not.
 */
public class ReactiveDeclarationAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public ReactiveDeclarationAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        // Bound after the initializer.
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        if (node instanceof StateNode state) {
            Type declared = context.resolveType(state.type(), Set.of());
            Type type = declared.isKnown() ? declared : context.inferrer().infer(state.value());
            context.naming().check(NamingConventionChecker.Subject.VARIABLE, state.name(), state.loc(), diagnostics);
            symbolTable.define(new Symbol(state.name(), Symbol.Kind.STATE, type, true, List.of(), state.loc()));
        } else if (node instanceof ComputedNode computed) {
            context.naming().check(NamingConventionChecker.Subject.VARIABLE, computed.name(), computed.loc(), diagnostics);
            symbolTable.define(new Symbol(computed.name(), Symbol.Kind.COMPUTED,
                    context.inferrer().infer(computed.value()), false, List.of(), computed.loc()));
        }
    }
}
