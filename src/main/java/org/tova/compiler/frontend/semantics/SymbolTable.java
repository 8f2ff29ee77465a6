package org.tova.compiler.frontend.semantics;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.types.Type;
import org.tova.compiler.frontend.types.UnknownType;
import org.tova.compiler.internal.i18n.Messages;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Manages the chain of lexical scopes built during one analysis walk.
 * Scopes are created on entry to a function, block, match arm, comprehension, loop or catch clause
 * and are dropped again when the walk leaves that subtree.
 */
public class SymbolTable {

    /**
     * The role of a scope. Module, region and function scopes are assignment boundaries:
     * a plain {@code x = ...} never rebinds a name declared beyond the nearest boundary.
     */
    public enum ScopeKind {
        MODULE,
        REGION,
        FUNCTION,
        BLOCK;

        /**
         * @return {@code true} for module, region and function scopes.
         */
        public boolean isBoundary() {
            return this != BLOCK;
        }
    }

    /**
     * Represents a single lexical scope.
     */
    public static class Scope {
        private final Scope parent;
        private final ScopeKind kind;
        private final String owner;
        private final boolean async;
        private final Type returnType;
        private final Map<String, Symbol> symbols = new LinkedHashMap<>();
        private final Set<String> used = new HashSet<>();

        Scope(Scope parent, ScopeKind kind, String owner, boolean async, Type returnType) {
            this.parent = parent;
            this.kind = kind;
            this.owner = owner;
            this.async = async;
            this.returnType = returnType;
        }

        public Scope getParent() {
            return parent;
        }

        public ScopeKind getKind() {
            return kind;
        }

        /**
         * @return The name of the function or region owning the scope, may be {@code null}.
         */
        public String getOwner() {
            return owner;
        }

        public boolean isAsync() {
            return async;
        }

        /**
         * @return The declared return type of a function scope; Unknown otherwise.
         */
        public Type getReturnType() {
            return returnType;
        }

        /**
         * @return The symbols of this scope in declaration order.
         */
        public Map<String, Symbol> getSymbols() {
            return Collections.unmodifiableMap(symbols);
        }

        /**
         * @param name A name declared in this scope.
         * @return {@code true} once the name has been resolved at least once.
         */
        public boolean isUsed(String name) {
            return used.contains(name);
        }
    }

    private final DiagnosticsEngine diagnostics;
    private final Scope rootScope;
    private Scope currentScope;

    /**
     * @param diagnostics The engine that receives duplicate-definition errors.
     */
    public SymbolTable(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
        this.rootScope = new Scope(null, ScopeKind.MODULE, null, false, UnknownType.INSTANCE);
        this.currentScope = rootScope;
    }

    /**
     * Enters a new block or region scope.
     * @param kind {@link ScopeKind#BLOCK} or {@link ScopeKind#REGION}.
     * @param owner The region name, may be {@code null}.
     * @return The new scope.
     */
    public Scope enterScope(ScopeKind kind, String owner) {
        currentScope = new Scope(currentScope, kind, owner, false, UnknownType.INSTANCE);
        return currentScope;
    }

    /**
     * Enters a new block scope.
     * @return The new scope.
     */
    public Scope enterScope() {
        return enterScope(ScopeKind.BLOCK, null);
    }

    /**
     * Enters the scope of a function, lambda, component or command body.
     * @param owner The function name, may be {@code null} for lambdas.
     * @param async Whether {@code await} is legal directly inside.
     * @param returnType The declared return type, Unknown when not annotated.
     * @return The new scope.
     */
    public Scope enterFunctionScope(String owner, boolean async, Type returnType) {
        currentScope = new Scope(currentScope, ScopeKind.FUNCTION, owner, async, returnType);
        return currentScope;
    }

    /**
     * Leaves the current scope and returns to its parent.
     * @return The scope that was left.
     */
    public Scope leaveScope() {
        Scope left = currentScope;
        if (currentScope.parent != null) {
            currentScope = currentScope.parent;
        }
        return left;
    }

    /**
     * Resets the current scope to the module scope.
     */
    public void resetScope() {
        this.currentScope = rootScope;
    }

    /**
     * Defines a new symbol in the current scope. A name already bound in the same scope is
     * reported as an error and the earlier binding is kept.
     * @param symbol The symbol to define.
     * @return {@code true} if the symbol was added.
     */
    public boolean define(Symbol symbol) {
        if (currentScope.symbols.containsKey(symbol.name())) {
            diagnostics.reportError(Messages.get("binding.duplicate", symbol.name()), symbol.loc(),
                    CompilerErrorCode.E201, null);
            return false;
        }
        currentScope.symbols.put(symbol.name(), symbol);
        return true;
    }

    /**
     * Defines or replaces a symbol in the current scope without reporting duplicates.
     * Used for hoisted declarations that are visited a second time.
     * @param symbol The symbol.
     */
    public void redefine(Symbol symbol) {
        currentScope.symbols.put(symbol.name(), symbol);
    }

    /**
     * Resolves a name through the scope chain and marks it as used.
     * @param name The name to resolve.
     * @return The innermost symbol with that name.
     */
    public Optional<Symbol> resolve(String name) {
        for (Scope scope = currentScope; scope != null; scope = scope.parent) {
            Symbol symbol = scope.symbols.get(name);
            if (symbol != null) {
                scope.used.add(name);
                return Optional.of(symbol);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a name without marking it as used. Type inference uses this to avoid hiding unused bindings.
     * @param name The name to look up.
     * @return The innermost symbol with that name.
     */
    public Optional<Symbol> lookup(String name) {
        for (Scope scope = currentScope; scope != null; scope = scope.parent) {
            Symbol symbol = scope.symbols.get(name);
            if (symbol != null) return Optional.of(symbol);
        }
        return Optional.empty();
    }

    /**
     * @param name The name.
     * @return The symbol if it is declared in the current scope itself.
     */
    public Optional<Symbol> resolveLocal(String name) {
        return Optional.ofNullable(currentScope.symbols.get(name));
    }

    /**
     * Looks up the binding a plain assignment {@code name = ...} refers to. The search stops after the
     * nearest module, region or function scope.
     * @param name The assigned name.
     * @return The existing binding, or empty if the assignment declares a new one.
     */
    public Optional<Symbol> resolveAssignmentTarget(String name) {
        for (Scope scope = currentScope; scope != null; scope = scope.parent) {
            Symbol symbol = scope.symbols.get(name);
            if (symbol != null) {
                scope.used.add(name);
                return Optional.of(symbol);
            }
            if (scope.kind.isBoundary()) break;
        }
        return Optional.empty();
    }

    /**
     * @param name A name about to be bound inside the current boundary.
     * @return {@code true} if a scope beyond the nearest boundary already binds the name.
     */
    public boolean isBoundBeyondBoundary(String name) {
        Scope scope = currentScope;
        while (scope != null && !scope.kind.isBoundary()) scope = scope.parent;
        for (scope = scope == null ? null : scope.parent; scope != null; scope = scope.parent) {
            if (scope.symbols.containsKey(name)) return true;
        }
        return false;
    }

    /**
     * @return The innermost function scope, if the walk is inside a function.
     */
    public Optional<Scope> currentFunction() {
        for (Scope scope = currentScope; scope != null; scope = scope.parent) {
            if (scope.kind == ScopeKind.FUNCTION) return Optional.of(scope);
        }
        return Optional.empty();
    }

    /**
     * @return {@code true} if the innermost enclosing function is async.
     */
    public boolean isInAsyncContext() {
        return currentFunction().map(Scope::isAsync).orElse(false);
    }

    /**
     * @return {@code true} if the current scope is a function scope or nested inside one.
     */
    public boolean isInsideFunction() {
        return currentFunction().isPresent();
    }

    /**
     * @return Every name visible from the current scope, innermost first.
     */
    public Set<String> visibleNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Scope scope = currentScope; scope != null; scope = scope.parent) {
            names.addAll(scope.symbols.keySet());
        }
        return names;
    }

    /**
     * @return The scope the walk is currently in.
     */
    public Scope getCurrentScope() {
        return currentScope;
    }

    /**
     * @return The module scope.
     */
    public Scope getRootScope() {
        return rootScope;
    }

    /**
     * @return The scopes from the current one up to the module scope.
     */
    public List<Scope> chain() {
        List<Scope> chain = new ArrayList<>();
        for (Scope scope = currentScope; scope != null; scope = scope.parent) chain.add(scope);
        return chain;
    }
}
