package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.CallNode;
import org.tova.compiler.frontend.parser.ast.IdentifierNode;
import org.tova.compiler.frontend.parser.ast.NamedArgumentNode;
import org.tova.compiler.frontend.parser.ast.SpreadNode;
import org.tova.compiler.frontend.semantics.AnalysisContext;
import org.tova.compiler.frontend.semantics.ConversionHints;
import org.tova.compiler.frontend.semantics.Symbol;
import org.tova.compiler.frontend.semantics.SymbolTable;
import org.tova.compiler.frontend.types.FunctionType;
import org.tova.compiler.frontend.types.Type;
import org.tova.compiler.frontend.types.TypeVariable;
import org.tova.compiler.internal.i18n.Messages;

import java.util.Optional;

/**
 * Checks positional arguments of calls to known functions against the declared parameter types.
 */
public class CallAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public CallAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        CallNode call = (CallNode) node;
        if (!(call.callee() instanceof IdentifierNode callee)) return;
        if (call.arguments().stream().anyMatch(SpreadNode.class::isInstance)) return;
        Optional<Symbol> symbol = symbolTable.lookup(callee.name());
        if (symbol.isEmpty() || !(symbol.get().type() instanceof FunctionType function)) return;

        int position = 0;
        for (AstNode argument : call.arguments()) {
            if (argument instanceof NamedArgumentNode) continue;
            int index = position++;
            if (index >= function.params().size()) break;
            Type expected = function.params().get(index);
            if (expected instanceof TypeVariable || !expected.isKnown()) continue;
            Type actual = context.inferrer().infer(argument);
            if (!actual.isKnown() || actual.isAssignableTo(expected)) continue;
            String paramName = index < symbol.get().params().size() ? symbol.get().params().get(index) : "argument " + (index + 1);
            diagnostics.reportError(Messages.get("type.argument", paramName, expected.display(), actual.display()),
                    argument.loc(), CompilerErrorCode.E100, ConversionHints.hint(expected, actual));
        }
    }
}
