package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.ParameterNode;
import org.tova.compiler.frontend.semantics.AnalysisContext;
import org.tova.compiler.frontend.semantics.NamingConventionChecker;
import org.tova.compiler.frontend.semantics.Symbol;
import org.tova.compiler.frontend.semantics.SymbolTable;
import org.tova.compiler.internal.i18n.Messages;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Helpers shared by the handlers that open function and block scopes.
 */
final class ScopeSupport {

    private ScopeSupport() {}

    /**
     * Defines parameters in the current scope. A repeated name is an E203 error.
     */
    static void defineParameters(List<ParameterNode> params, Set<String> typeParams, AnalysisContext context,
                                 SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        Set<String> seen = new HashSet<>();
        for (ParameterNode param : params) {
            if (!seen.add(param.name())) {
                diagnostics.reportError(Messages.get("binding.duplicate.pattern", param.name(), "parameter list"),
                        param.loc(), CompilerErrorCode.E203, null);
                continue;
            }
            context.naming().check(NamingConventionChecker.Subject.PARAMETER, param.name(), param.loc(), diagnostics);
            symbolTable.define(new Symbol(param.name(), Symbol.Kind.PARAMETER,
                    context.resolveType(param.type(), typeParams), false, List.of(), param.loc()));
        }
    }

    /**
     * @return The parameter default values followed by the body statements.
     */
    static List<AstNode> parametersThenBody(List<ParameterNode> params, List<AstNode> body) {
        List<AstNode> children = new ArrayList<>();
        for (ParameterNode param : params) {
            if (param.defaultValue() != null) children.add(param.defaultValue());
        }
        children.addAll(body);
        return children;
    }

    /**
     * Leaves the current scope and reports its unused variables when it belongs to a function.
     */
    static void leave(AnalysisContext context, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        SymbolTable.Scope left = symbolTable.leaveScope();
        if (left.getKind() == SymbolTable.ScopeKind.FUNCTION || symbolTable.isInsideFunction()) {
            context.reportUnused(left, diagnostics);
        }
    }
}
