package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AssignmentNode;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.IdentifierNode;
import org.tova.compiler.frontend.semantics.AnalysisContext;
import org.tova.compiler.frontend.semantics.ConversionHints;
import org.tova.compiler.frontend.semantics.NamingConventionChecker;
import org.tova.compiler.frontend.semantics.Symbol;
import org.tova.compiler.frontend.semantics.SymbolTable;
import org.tova.compiler.frontend.types.PrimitiveType;
import org.tova.compiler.frontend.types.Type;
import org.tova.compiler.internal.i18n.Messages;

import java.util.List;
import java.util.Optional;

/**
 * Handles {@code x = value}. Inside the nearest function or region an existing binding is reassigned,
 * which must be mutable; otherwise the assignment declares a new immutable binding.
 */
public class AssignmentAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public AssignmentAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        // Bindings are created after the value has been walked.
    }

    @Override
    public List<AstNode> children(AstNode node) {
        AssignmentNode assignment = (AssignmentNode) node;
        if (assignment.target() instanceof IdentifierNode) return List.of(assignment.value());
        return List.of(assignment.target(), assignment.value());
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        AssignmentNode assignment = (AssignmentNode) node;
        if (!(assignment.target() instanceof IdentifierNode target)) return;
        String name = target.name();
        if (name.equals("_")) return;
        Type valueType = context.inferrer().infer(assignment.value());

        Optional<Symbol> existing = symbolTable.resolveAssignmentTarget(name);
        if (existing.isEmpty()) {
            existing = symbolTable.lookup(name).filter(s -> s.kind() == Symbol.Kind.STATE);
        }
        if (existing.isPresent()) {
            Symbol symbol = existing.get();
            if (!symbol.mutable()) {
                diagnostics.reportError(Messages.get("binding.immutable", name), assignment.loc(),
                        CompilerErrorCode.E202, Messages.get("binding.immutable.hint", name));
                return;
            }
            if (symbol.type() == PrimitiveType.INT && valueType == PrimitiveType.FLOAT) {
                diagnostics.reportWarning(Messages.get("type.reassign", name, "Int", "Float"), assignment.loc(),
                        CompilerErrorCode.W204, Messages.get("hint.float.int"));
            } else if (!valueType.isAssignableTo(symbol.type())) {
                context.reportGradual(diagnostics, Messages.get("type.reassign", name, symbol.type().display(), valueType.display()),
                        assignment.loc(), CompilerErrorCode.E102, ConversionHints.hint(symbol.type(), valueType));
            }
            return;
        }

        if (symbolTable.isBoundBeyondBoundary(name)) {
            diagnostics.reportWarning(Messages.get("binding.shadow", name), assignment.loc(), CompilerErrorCode.W101,
                    Messages.get("binding.shadow.hint", name));
        }
        context.naming().check(NamingConventionChecker.Subject.VARIABLE, name, target.loc(), diagnostics);
        symbolTable.define(Symbol.variable(name, valueType, target.loc()));
    }
}
