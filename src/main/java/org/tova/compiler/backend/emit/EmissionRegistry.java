package org.tova.compiler.backend.emit;

import org.tova.compiler.diagnostics.CodegenError;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping AST node classes to emission rules. Target backends start from a copy of the
 * base rules and re-register only the node types they lower differently.
 */
public final class EmissionRegistry {

    private final Map<Class<? extends AstNode>, IEmissionRule<? extends AstNode>> byClass = new HashMap<>();

    /**
     * Registers or replaces the rule for a node class.
     * @param nodeType The concrete AST node class.
     * @param rule The rule handling that class.
     * @param <T> Concrete AST type parameter.
     */
    public <T extends AstNode> void register(Class<T> nodeType, IEmissionRule<T> rule) {
        byClass.put(nodeType, rule);
    }

    /**
     * @param nodeType The AST node class to look up.
     * @return The rule registered for exactly that class, if any.
     */
    public Optional<IEmissionRule<? extends AstNode>> get(Class<? extends AstNode> nodeType) {
        return Optional.ofNullable(byClass.get(nodeType));
    }

    /**
     * @param nodeType The AST node class.
     * @return {@code true} if a rule is registered for the class.
     */
    public boolean has(Class<? extends AstNode> nodeType) {
        return byClass.containsKey(nodeType);
    }

    /**
     * Resolves the rule for a node.
     * @param node The node to emit.
     * @return The registered rule.
     * @throws CodegenError if no rule is registered for the node's class.
     */
    @SuppressWarnings("unchecked")
    public IEmissionRule<AstNode> resolve(AstNode node) {
        IEmissionRule<? extends AstNode> rule = byClass.get(node.getClass());
        if (rule == null) {
            throw new CodegenError("No emission rule for " + node.getClass().getSimpleName(), node.loc());
        }
        return (IEmissionRule<AstNode>) rule;
    }

    /**
     * @return A new registry holding the same rules, for a target to override.
     */
    public EmissionRegistry copy() {
        EmissionRegistry copy = new EmissionRegistry();
        copy.byClass.putAll(byClass);
        return copy;
    }
}
