package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.ArrayPatternNode;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.BindingPatternNode;
import org.tova.compiler.frontend.parser.ast.BlockNode;
import org.tova.compiler.frontend.parser.ast.MatchArmNode;
import org.tova.compiler.frontend.parser.ast.VariantPatternNode;
import org.tova.compiler.frontend.semantics.AnalysisContext;
import org.tova.compiler.frontend.semantics.Symbol;
import org.tova.compiler.frontend.semantics.SymbolTable;
import org.tova.compiler.frontend.types.UnknownType;
import org.tova.compiler.internal.i18n.Messages;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Opens a scope per match arm holding the names bound by its pattern.
 */
public class MatchArmAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public MatchArmAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        MatchArmNode arm = (MatchArmNode) node;
        symbolTable.enterScope();
        List<BindingPatternNode> bindings = new ArrayList<>();
        collectBindings(arm.pattern(), bindings);
        Set<String> seen = new HashSet<>();
        for (BindingPatternNode binding : bindings) {
            if (binding.name().equals("_")) continue;
            if (!seen.add(binding.name())) {
                diagnostics.reportError(Messages.get("binding.duplicate.pattern", binding.name(), "match pattern"),
                        binding.loc(), CompilerErrorCode.E203, null);
                continue;
            }
            symbolTable.define(new Symbol(binding.name(), Symbol.Kind.PARAMETER, UnknownType.INSTANCE, false,
                    List.of(), binding.loc()));
        }
        if (arm.body() instanceof BlockNode block) {
            context.declarations().hoist(block.statements(), symbolTable);
        }
    }

    @Override
    public List<AstNode> children(AstNode node) {
        MatchArmNode arm = (MatchArmNode) node;
        List<AstNode> body = arm.body() instanceof BlockNode block ? block.statements() : List.of(arm.body());
        return AstNode.children(arm.guard(), body);
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        ScopeSupport.leave(context, symbolTable, diagnostics);
    }

    private static void collectBindings(AstNode pattern, List<BindingPatternNode> out) {
        if (pattern instanceof BindingPatternNode binding) {
            out.add(binding);
        } else if (pattern instanceof VariantPatternNode variant) {
            variant.fields().forEach(field -> collectBindings(field, out));
        } else if (pattern instanceof ArrayPatternNode array) {
            array.elements().forEach(element -> collectBindings(element, out));
        }
    }
}
