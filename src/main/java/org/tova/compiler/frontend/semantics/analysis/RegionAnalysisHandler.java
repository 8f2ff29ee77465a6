package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.features.client.ClientBlockNode;
import org.tova.compiler.frontend.parser.features.client.StoreNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeBlockNode;
import org.tova.compiler.frontend.parser.features.server.ServerBlockNode;
import org.tova.compiler.frontend.parser.features.shared.SharedBlockNode;
import org.tova.compiler.frontend.semantics.AnalysisContext;
import org.tova.compiler.frontend.semantics.NamingConventionChecker;
import org.tova.compiler.frontend.semantics.SymbolTable;

import java.util.List;

/**
 * Opens a region scope for {@code client}, {@code server}, {@code shared}, {@code edge} and {@code store} blocks.
 * Lookups and assignments do not cross a region boundary.
 */
public class RegionAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public RegionAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        if (node instanceof StoreNode store) {
            context.naming().check(NamingConventionChecker.Subject.STORE, store.name(), store.loc(), diagnostics);
        }
        symbolTable.enterScope(SymbolTable.ScopeKind.REGION, regionName(node));
        context.declarations().hoist(body(node), symbolTable);
    }

    @Override
    public List<AstNode> children(AstNode node) {
        return body(node);
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        ScopeSupport.leave(context, symbolTable, diagnostics);
    }

    private static String regionName(AstNode node) {
        if (node instanceof ClientBlockNode) return "client";
        if (node instanceof ServerBlockNode) return "server";
        if (node instanceof SharedBlockNode) return "shared";
        if (node instanceof EdgeBlockNode) return "edge";
        return ((StoreNode) node).name();
    }

    private static List<AstNode> body(AstNode node) {
        if (node instanceof ClientBlockNode client) return client.body();
        if (node instanceof ServerBlockNode server) return server.body();
        if (node instanceof SharedBlockNode shared) return shared.body();
        if (node instanceof EdgeBlockNode edge) return edge.body();
        return ((StoreNode) node).body();
    }
}
