package org.tova.compiler.backend;

import org.tova.compiler.backend.emit.EmissionContext;
import org.tova.compiler.frontend.parser.ast.AssignmentNode;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.BindingPatternNode;
import org.tova.compiler.frontend.parser.ast.ForNode;
import org.tova.compiler.frontend.parser.ast.FunctionDeclarationNode;
import org.tova.compiler.frontend.parser.ast.IdentifierNode;
import org.tova.compiler.frontend.parser.ast.ImportNode;
import org.tova.compiler.frontend.parser.ast.LetDestructureNode;
import org.tova.compiler.frontend.parser.ast.ParameterNode;
import org.tova.compiler.frontend.parser.ast.TryCatchNode;
import org.tova.compiler.frontend.parser.ast.TypeDeclarationNode;
import org.tova.compiler.frontend.parser.ast.TypeVariantNode;
import org.tova.compiler.frontend.parser.ast.VarDeclarationNode;
import org.tova.compiler.frontend.parser.features.client.ComponentNode;
import org.tova.compiler.frontend.parser.features.client.ComputedNode;
import org.tova.compiler.frontend.parser.features.client.StateNode;
import org.tova.compiler.frontend.parser.features.client.StoreNode;
import org.tova.compiler.stdlib.StdlibRegistry;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pre-pass that marks every builtin function and namespace the program references. A name the
 * program declares itself anywhere is never treated as a builtin.
 */
public final class BuiltinScanner {

    private BuiltinScanner() {}

    /**
     * @param program The top-level nodes.
     * @param context The accumulator to mark names in.
     */
    public static void scan(List<AstNode> program, EmissionContext context) {
        Set<String> declared = new HashSet<>();
        program.forEach(node -> collectDeclared(node, declared));
        StdlibRegistry stdlib = context.stdlib();
        program.forEach(node -> markUsed(node, declared, stdlib, context));
    }

    private static void collectDeclared(AstNode node, Set<String> declared) {
        if (node == null) return;
        if (node instanceof FunctionDeclarationNode fn) declared.add(fn.name());
        else if (node instanceof TypeDeclarationNode type) {
            declared.add(type.name());
            type.variants().stream().map(TypeVariantNode::name).forEach(declared::add);
        } else if (node instanceof AssignmentNode assign && assign.target() instanceof IdentifierNode id) declared.add(id.name());
        else if (node instanceof VarDeclarationNode decl) declared.add(decl.name());
        else if (node instanceof LetDestructureNode destructure) declared.addAll(destructure.names());
        else if (node instanceof ParameterNode param) declared.add(param.name());
        else if (node instanceof ForNode loop) declared.addAll(loop.variables());
        else if (node instanceof ImportNode imp) {
            declared.addAll(imp.names());
            if (imp.defaultName() != null) declared.add(imp.defaultName());
        } else if (node instanceof TryCatchNode tryCatch && tryCatch.catchParam() != null) declared.add(tryCatch.catchParam());
        else if (node instanceof BindingPatternNode binding) declared.add(binding.name());
        else if (node instanceof StateNode state) declared.add(state.name());
        else if (node instanceof ComputedNode computed) declared.add(computed.name());
        else if (node instanceof ComponentNode component) declared.add(component.name());
        else if (node instanceof StoreNode store) declared.add(store.name());
        for (AstNode child : node.getChildren()) collectDeclared(child, declared);
    }

    private static void markUsed(AstNode node, Set<String> declared, StdlibRegistry stdlib, EmissionContext context) {
        if (node == null) return;
        if (node instanceof IdentifierNode id && !declared.contains(id.name())
                && (stdlib.isBuiltin(id.name()) || stdlib.isNamespace(id.name()))) {
            context.use(id.name());
        }
        for (AstNode child : node.getChildren()) markUsed(child, declared, stdlib, context);
    }
}
