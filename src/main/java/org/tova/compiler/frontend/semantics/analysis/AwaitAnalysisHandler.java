package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.semantics.SymbolTable;
import org.tova.compiler.internal.i18n.Messages;

/**
 * Reports {@code await} outside an async function, including at module level.
 */
public class AwaitAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        if (!symbolTable.isInAsyncContext()) {
            diagnostics.reportError(Messages.get("context.await"), node.loc(), CompilerErrorCode.E300,
                    Messages.get("context.await.hint"));
        }
    }
}
