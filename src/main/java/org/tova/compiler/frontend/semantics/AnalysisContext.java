package org.tova.compiler.frontend.semantics;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.api.CompilerOptions;
import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.TypeAnnotationNode;
import org.tova.compiler.frontend.types.Type;
import org.tova.compiler.frontend.types.TypeAnnotations;
import org.tova.compiler.frontend.types.TypeRegistry;
import org.tova.compiler.internal.i18n.Messages;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The collaborators shared by all analysis handlers of one walk.
 */
public class AnalysisContext {

    private final CompilerOptions options;
    private final TypeRegistry types;
    private final TypeInferrer inferrer;
    private final DeclarationCollector declarations;
    private final NamingConventionChecker naming;
    private final ExhaustivenessChecker exhaustiveness;
    private final KnownGlobals globals;

    /**
     * @param options The compiler options.
     * @param symbolTable The symbol table of the walk.
     * @param types The type registry of the walk.
     * @param globals The always-visible names.
     */
    public AnalysisContext(CompilerOptions options, SymbolTable symbolTable, TypeRegistry types, KnownGlobals globals) {
        this.options = options;
        this.types = types;
        this.inferrer = new TypeInferrer(symbolTable, types);
        this.declarations = new DeclarationCollector(types);
        this.naming = new NamingConventionChecker(options.namingLint());
        this.exhaustiveness = new ExhaustivenessChecker(types);
        this.globals = globals;
    }

    public TypeRegistry types() {
        return types;
    }

    public TypeInferrer inferrer() {
        return inferrer;
    }

    public DeclarationCollector declarations() {
        return declarations;
    }

    public NamingConventionChecker naming() {
        return naming;
    }

    public ExhaustivenessChecker exhaustiveness() {
        return exhaustiveness;
    }

    public KnownGlobals globals() {
        return globals;
    }

    /**
     * @param annotation An annotation, may be {@code null}.
     * @param typeParams The type parameters in scope.
     * @return The resolved type.
     */
    public Type resolveType(TypeAnnotationNode annotation, Set<String> typeParams) {
        return TypeAnnotations.resolve(annotation, typeParams, types);
    }

    /**
     * Reports a gradual-typing diagnostic: an error in strict mode, a warning otherwise.
     * @param diagnostics The diagnostics engine.
     * @param message The message.
     * @param loc The location.
     * @param code The code.
     * @param hint The hint, may be {@code null}.
     */
    public void reportGradual(DiagnosticsEngine diagnostics, String message, SourceInfo loc, CompilerErrorCode code, String hint) {
        if (options.strict()) {
            diagnostics.reportError(message, loc, code, hint);
        } else {
            diagnostics.reportWarning(message, loc, code, hint);
        }
    }

    /**
     * @return {@code true} in strict mode.
     */
    public boolean isStrict() {
        return options.strict();
    }

    /**
     * @param name An undefined name.
     * @param symbolTable The symbol table at the reference.
     * @return The closest visible or global name.
     */
    public Optional<String> suggest(String name, SymbolTable symbolTable) {
        Set<String> candidates = new LinkedHashSet<>(symbolTable.visibleNames());
        candidates.addAll(globals.names());
        return EditDistance.closest(name, candidates);
    }

    /**
     * Reports W001 for each variable of the scope that was never read.
     * @param scope A scope the walk just left; only scopes inside functions are checked.
     * @param diagnostics The diagnostics engine.
     */
    public void reportUnused(SymbolTable.Scope scope, DiagnosticsEngine diagnostics) {
        for (Map.Entry<String, Symbol> entry : scope.getSymbols().entrySet()) {
            Symbol symbol = entry.getValue();
            if (symbol.kind() != Symbol.Kind.VARIABLE || entry.getKey().startsWith("_")) continue;
            if (!scope.isUsed(entry.getKey())) {
                diagnostics.reportWarning(Messages.get("binding.unused", entry.getKey()), symbol.loc(),
                        CompilerErrorCode.W001, Messages.get("binding.unused.hint"));
            }
        }
    }
}
