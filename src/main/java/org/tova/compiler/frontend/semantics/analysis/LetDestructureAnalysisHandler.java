package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.LetDestructureNode;
import org.tova.compiler.frontend.semantics.AnalysisContext;
import org.tova.compiler.frontend.semantics.NamingConventionChecker;
import org.tova.compiler.frontend.semantics.Symbol;
import org.tova.compiler.frontend.semantics.SymbolTable;
import org.tova.compiler.frontend.types.UnknownType;
import org.tova.compiler.internal.i18n.Messages;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Handles {@code let { a, b } = value} and {@code let [a, b] = value}.
 */
public class LetDestructureAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public LetDestructureAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        // Defined after the value.
    }

    @Override
    public List<AstNode> children(AstNode node) {
        return List.of(((LetDestructureNode) node).value());
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        LetDestructureNode let = (LetDestructureNode) node;
        Set<String> seen = new HashSet<>();
        for (String name : let.names()) {
            if (!seen.add(name)) {
                diagnostics.reportError(Messages.get("binding.duplicate.pattern", name, "destructuring pattern"),
                        let.loc(), CompilerErrorCode.E203, null);
                continue;
            }
            if (name.equals("_")) continue;
            context.naming().check(NamingConventionChecker.Subject.VARIABLE, name, let.loc(), diagnostics);
            symbolTable.define(Symbol.variable(name, UnknownType.INSTANCE, let.loc()));
        }
    }
}
