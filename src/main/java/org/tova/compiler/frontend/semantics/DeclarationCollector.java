package org.tova.compiler.frontend.semantics;

import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.FunctionDeclarationNode;
import org.tova.compiler.frontend.parser.ast.ParameterNode;
import org.tova.compiler.frontend.parser.ast.TypeDeclarationNode;
import org.tova.compiler.frontend.parser.ast.TypeFieldNode;
import org.tova.compiler.frontend.parser.ast.TypeVariantNode;
import org.tova.compiler.frontend.parser.features.client.ComponentNode;
import org.tova.compiler.frontend.parser.features.client.StoreNode;
import org.tova.compiler.frontend.parser.features.shared.SharedBlockNode;
import org.tova.compiler.frontend.types.AdtType;
import org.tova.compiler.frontend.types.FunctionType;
import org.tova.compiler.frontend.types.RecordType;
import org.tova.compiler.frontend.types.Type;
import org.tova.compiler.frontend.types.TypeAnnotations;
import org.tova.compiler.frontend.types.TypeRegistry;
import org.tova.compiler.frontend.types.UnknownType;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Hoists the declarations of one statement list into the current scope before the list is walked,
 * so functions and types can be used ahead of their declaration.
 */
public class DeclarationCollector {

    private final TypeRegistry types;

    /**
     * @param types Receives every declared ADT and record.
     */
    public DeclarationCollector(TypeRegistry types) {
        this.types = types;
    }

    /**
     * @param statements The statements of a scope.
     * @param symbolTable The symbol table positioned at that scope.
     */
    public void hoist(List<AstNode> statements, SymbolTable symbolTable) {
        // Types first so function signatures can refer to them.
        for (AstNode node : statements) {
            if (node instanceof TypeDeclarationNode type) declareType(type, symbolTable);
            if (node instanceof SharedBlockNode shared) hoistTypes(shared.body(), symbolTable);
        }
        for (AstNode node : statements) {
            if (node instanceof FunctionDeclarationNode fn) {
                symbolTable.define(functionSymbol(fn));
            } else if (node instanceof ComponentNode component) {
                List<String> params = component.params().stream().map(ParameterNode::name).toList();
                symbolTable.define(new Symbol(component.name(), Symbol.Kind.COMPONENT, UnknownType.INSTANCE, false, params, component.loc()));
            } else if (node instanceof StoreNode store) {
                symbolTable.define(new Symbol(store.name(), Symbol.Kind.STORE, UnknownType.INSTANCE, false, List.of(), store.loc()));
            } else if (node instanceof SharedBlockNode shared) {
                for (AstNode inner : shared.body()) {
                    if (inner instanceof FunctionDeclarationNode fn) symbolTable.define(functionSymbol(fn));
                }
            }
        }
    }

    private void hoistTypes(List<AstNode> statements, SymbolTable symbolTable) {
        for (AstNode node : statements) {
            if (node instanceof TypeDeclarationNode type) declareType(type, symbolTable);
        }
    }

    /**
     * @param fn A function declaration.
     * @return Its symbol, typed from the parameter and return annotations.
     */
    public Symbol functionSymbol(FunctionDeclarationNode fn) {
        Set<String> typeParams = new HashSet<>(fn.typeParams());
        List<Type> params = fn.params().stream()
                .map(p -> TypeAnnotations.resolve(p.type(), typeParams, types))
                .toList();
        Type returnType = TypeAnnotations.resolve(fn.returnType(), typeParams, types);
        List<String> names = fn.params().stream().map(ParameterNode::name).toList();
        return new Symbol(fn.name(), Symbol.Kind.FUNCTION, new FunctionType(params, returnType), false, names, fn.loc());
    }

    private void declareType(TypeDeclarationNode node, SymbolTable symbolTable) {
        Set<String> typeParams = new HashSet<>(node.typeParams());
        if (!node.variants().isEmpty() || node.fields().isEmpty()) {
            Map<String, Map<String, Type>> variants = new LinkedHashMap<>();
            for (TypeVariantNode variant : node.variants()) {
                variants.put(variant.name(), fields(variant.fields(), typeParams));
            }
            AdtType adt = new AdtType(node.name(), node.typeParams(), variants);
            types.register(adt);
            symbolTable.define(new Symbol(node.name(), Symbol.Kind.TYPE, adt, false, List.of(), node.loc()));
            for (TypeVariantNode variant : node.variants()) {
                List<String> params = variant.fields().stream().map(TypeFieldNode::name).toList();
                Type type = params.isEmpty() ? adt : TypeInferrer.constructorOf(adt, variant.name());
                symbolTable.define(new Symbol(variant.name(), Symbol.Kind.VARIANT, type, false, params, variant.loc()));
            }
        } else {
            RecordType record = new RecordType(node.name(), fields(node.fields(), typeParams));
            types.register(record);
            List<String> params = node.fields().stream().map(TypeFieldNode::name).toList();
            FunctionType constructor = new FunctionType(List.copyOf(record.fields().values()), record);
            symbolTable.define(new Symbol(node.name(), Symbol.Kind.TYPE, constructor, false, params, node.loc()));
        }
    }

    private Map<String, Type> fields(List<TypeFieldNode> fields, Set<String> typeParams) {
        Map<String, Type> result = new LinkedHashMap<>();
        for (TypeFieldNode field : fields) {
            result.put(field.name(), TypeAnnotations.resolve(field.type(), typeParams, types));
        }
        return result;
    }
}
