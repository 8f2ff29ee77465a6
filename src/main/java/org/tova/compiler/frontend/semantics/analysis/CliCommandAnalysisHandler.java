package org.tova.compiler.frontend.semantics.analysis;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.features.cli.CliBlockNode;
import org.tova.compiler.frontend.parser.features.cli.CliCommandNode;
import org.tova.compiler.frontend.parser.features.cli.CliParamNode;
import org.tova.compiler.frontend.semantics.AnalysisContext;
import org.tova.compiler.frontend.semantics.NamingConventionChecker;
import org.tova.compiler.frontend.semantics.Symbol;
import org.tova.compiler.frontend.semantics.SymbolTable;
import org.tova.compiler.frontend.types.ArrayType;
import org.tova.compiler.frontend.types.PrimitiveType;
import org.tova.compiler.frontend.types.Type;
import org.tova.compiler.frontend.types.UnknownType;
import org.tova.compiler.internal.i18n.Messages;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Handles the {@code cli} block: config fields are skipped, each command is a function scope
 * whose parameters are its arguments and flags.
 */
public class CliCommandAnalysisHandler implements IAnalysisHandler {

    private final AnalysisContext context;

    public CliCommandAnalysisHandler(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        if (!(node instanceof CliCommandNode command)) return;
        context.naming().check(NamingConventionChecker.Subject.FUNCTION, command.name(), command.loc(), diagnostics);
        symbolTable.enterFunctionScope(command.name(), command.async(), UnknownType.INSTANCE);
        Set<String> seen = new HashSet<>();
        for (CliParamNode param : command.params()) {
            if (!seen.add(param.name())) {
                diagnostics.reportError(Messages.get("binding.duplicate.pattern", param.name(), "command parameters"),
                        param.loc(), CompilerErrorCode.E203, null);
                continue;
            }
            symbolTable.define(new Symbol(param.name(), Symbol.Kind.PARAMETER, paramType(param), false, List.of(), param.loc()));
        }
        context.declarations().hoist(command.body().statements(), symbolTable);
    }

    @Override
    public List<AstNode> children(AstNode node) {
        if (node instanceof CliBlockNode block) {
            return List.copyOf(block.commands());
        }
        CliCommandNode command = (CliCommandNode) node;
        List<AstNode> children = new ArrayList<>();
        for (CliParamNode param : command.params()) {
            if (param.defaultValue() != null) children.add(param.defaultValue());
        }
        children.addAll(command.body().statements());
        return children;
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        if (node instanceof CliCommandNode) {
            ScopeSupport.leave(context, symbolTable, diagnostics);
        }
    }

    private static Type paramType(CliParamNode param) {
        Type base = switch (param.type() == null ? "" : param.type()) {
            case "Int" -> PrimitiveType.INT;
            case "Float" -> PrimitiveType.FLOAT;
            case "Bool" -> PrimitiveType.BOOL;
            case "String" -> PrimitiveType.STRING;
            default -> param.flag() ? PrimitiveType.BOOL : UnknownType.INSTANCE;
        };
        return param.repeated() ? new ArrayType(base) : base;
    }
}
