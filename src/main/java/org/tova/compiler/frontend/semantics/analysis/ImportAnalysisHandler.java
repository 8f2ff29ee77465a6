package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.ImportNode;
import org.tova.compiler.frontend.semantics.Symbol;
import org.tova.compiler.frontend.semantics.SymbolTable;
import org.tova.compiler.frontend.types.UnknownType;

import java.util.List;

public class ImportAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        ImportNode importNode = (ImportNode) node;
        if (importNode.defaultName() != null) {
            define(importNode.defaultName(), importNode, symbolTable);
        }
        for (String name : importNode.names()) {
            define(name, importNode, symbolTable);
        }
    }

    private static void define(String name, ImportNode node, SymbolTable symbolTable) {
        symbolTable.define(new Symbol(name, Symbol.Kind.IMPORT, UnknownType.INSTANCE, false, List.of(), node.loc()));
    }
}
