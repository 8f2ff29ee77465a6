package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeBindingNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeEnvNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeSecretNode;
import org.tova.compiler.frontend.semantics.Symbol;
import org.tova.compiler.frontend.semantics.SymbolTable;
import org.tova.compiler.frontend.types.PrimitiveType;
import org.tova.compiler.frontend.types.UnknownType;

import java.util.List;

/**
 * Binds edge resources, environment variables and secrets as names inside the edge block.
 */
public class EdgeDeclarationAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        if (node instanceof EdgeBindingNode binding) {
            symbolTable.define(new Symbol(binding.name(), Symbol.Kind.IMPORT, UnknownType.INSTANCE, false, List.of(), binding.loc()));
        } else if (node instanceof EdgeEnvNode env) {
            symbolTable.define(new Symbol(env.name(), Symbol.Kind.IMPORT, PrimitiveType.STRING, false, List.of(), env.loc()));
        } else if (node instanceof EdgeSecretNode secret) {
            symbolTable.define(new Symbol(secret.name(), Symbol.Kind.IMPORT, PrimitiveType.STRING, false, List.of(), secret.loc()));
        }
    }

    @Override
    public List<AstNode> children(AstNode node) {
        return node instanceof EdgeEnvNode env ? AstNode.children(env.defaultValue()) : List.of();
    }
}
