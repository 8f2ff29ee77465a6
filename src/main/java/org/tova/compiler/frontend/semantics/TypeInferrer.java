package org.tova.compiler.frontend.semantics;

import org.tova.compiler.frontend.parser.ast.*;
import org.tova.compiler.frontend.types.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Infers static types of expressions from literals, declarations and annotations.
 * Anything it cannot infer is {@link UnknownType}, which silences type diagnostics downstream.
 */
public class TypeInferrer {

    private static final Set<String> INT_BUILTINS = Set.of("len", "count", "sum", "to_int", "toInt", "floor", "ceil", "round", "now");
    private static final Set<String> FLOAT_BUILTINS = Set.of("to_float", "toFloat", "sqrt", "random", "mean", "pow");
    private static final Set<String> STRING_BUILTINS = Set.of("to_string", "toString", "upper", "lower", "trim", "join",
            "repeat", "fmt", "capitalize", "replace", "type_of", "json_stringify", "uuid", "slugify", "pad_start", "pad_end");
    private static final Set<String> BOOL_BUILTINS = Set.of("contains", "starts_with", "ends_with", "any", "all",
            "is_empty", "has_key", "to_bool");

    private final SymbolTable symbolTable;
    private final TypeRegistry types;

    /**
     * @param symbolTable The scope chain identifiers are looked up in.
     * @param types The declared nominal types.
     */
    public TypeInferrer(SymbolTable symbolTable, TypeRegistry types) {
        this.symbolTable = symbolTable;
        this.types = types;
    }

    /**
     * @param node An expression node, may be {@code null}.
     * @return The inferred type.
     */
    public Type infer(AstNode node) {
        if (node == null) return UnknownType.INSTANCE;
        if (node instanceof NumberLiteralNode n) {
            return n.value() instanceof Double || n.value() instanceof Float ? PrimitiveType.FLOAT : PrimitiveType.INT;
        }
        if (node instanceof StringLiteralNode || node instanceof TemplateLiteralNode) return PrimitiveType.STRING;
        if (node instanceof BooleanLiteralNode) return PrimitiveType.BOOL;
        if (node instanceof NilLiteralNode) return NilType.INSTANCE;
        if (node instanceof ArrayLiteralNode a) return arrayOf(a.elements());
        if (node instanceof RangeNode) return new ArrayType(PrimitiveType.INT);
        if (node instanceof ListComprehensionNode) return new ArrayType(UnknownType.INSTANCE);
        if (node instanceof IdentifierNode id) return identifier(id.name());
        if (node instanceof BinaryExpressionNode b) return binary(b.operator(), b.left(), b.right());
        if (node instanceof LogicalExpressionNode l) return logical(l);
        if (node instanceof UnaryExpressionNode u) {
            if (u.operator() == Operator.NOT) return PrimitiveType.BOOL;
            Type operand = infer(u.operand());
            return operand.isNumeric() ? operand : UnknownType.INSTANCE;
        }
        if (node instanceof ChainedComparisonNode || node instanceof MembershipNode) return PrimitiveType.BOOL;
        if (node instanceof CallNode call) return call(call);
        if (node instanceof LambdaNode lambda) {
            return new FunctionType(lambda.params().stream().map(p -> (Type) UnknownType.INSTANCE).toList(), UnknownType.INSTANCE);
        }
        if (node instanceof MemberAccessNode m && infer(m.object()) instanceof RecordType record) {
            return record.fields().getOrDefault(m.property(), UnknownType.INSTANCE);
        }
        if (node instanceof IndexAccessNode index && infer(index.object()) instanceof ArrayType array) {
            return array.element();
        }
        return UnknownType.INSTANCE;
    }

    private Type arrayOf(List<AstNode> elements) {
        Type element = null;
        for (AstNode e : elements) {
            if (e instanceof SpreadNode) return new ArrayType(UnknownType.INSTANCE);
            Type t = infer(e);
            if (!t.isKnown()) return new ArrayType(UnknownType.INSTANCE);
            if (element == null || element.equals(t)) {
                element = t;
            } else if (element.isNumeric() && t.isNumeric()) {
                element = PrimitiveType.FLOAT;
            } else {
                return new ArrayType(UnknownType.INSTANCE);
            }
        }
        return new ArrayType(element == null ? UnknownType.INSTANCE : element);
    }

    private Type identifier(String name) {
        if (name.equals("None")) return new GenericType("Option", List.of());
        return symbolTable.lookup(name).map(symbol -> switch (symbol.kind()) {
            case TYPE -> (Type) UnknownType.INSTANCE;
            case VARIANT -> symbol.params().isEmpty()
                    && symbol.type() instanceof FunctionType f ? f.returnType() : symbol.type();
            default -> symbol.type();
        }).orElse(UnknownType.INSTANCE);
    }

    private Type binary(Operator op, AstNode leftNode, AstNode rightNode) {
        if (op.isComparison()) return PrimitiveType.BOOL;
        Type left = infer(leftNode);
        Type right = infer(rightNode);
        if (op == Operator.MULTIPLY && (left == PrimitiveType.STRING && right == PrimitiveType.INT)) return PrimitiveType.STRING;
        if (op == Operator.ADD && left == PrimitiveType.STRING && right == PrimitiveType.STRING) return PrimitiveType.STRING;
        if (op.isArithmetic() && left.isNumeric() && right.isNumeric()) {
            return left == PrimitiveType.INT && right == PrimitiveType.INT ? PrimitiveType.INT : PrimitiveType.FLOAT;
        }
        return UnknownType.INSTANCE;
    }

    private Type logical(LogicalExpressionNode node) {
        if (node.operator() == Operator.COALESCE) return infer(node.right());
        Type left = infer(node.left());
        Type right = infer(node.right());
        return left == PrimitiveType.BOOL && right == PrimitiveType.BOOL ? PrimitiveType.BOOL : UnknownType.INSTANCE;
    }

    private Type call(CallNode call) {
        if (!(call.callee() instanceof IdentifierNode id)) return UnknownType.INSTANCE;
        String name = id.name();
        switch (name) {
            case "Ok":
            case "Err":
                return new GenericType("Result", List.of());
            case "Some":
                return new GenericType("Option", List.of());
            default:
                break;
        }
        Optional<Symbol> symbol = symbolTable.lookup(name);
        if (symbol.isPresent()) {
            return symbol.get().type() instanceof FunctionType f ? f.returnType() : UnknownType.INSTANCE;
        }
        if (INT_BUILTINS.contains(name)) return PrimitiveType.INT;
        if (FLOAT_BUILTINS.contains(name)) return PrimitiveType.FLOAT;
        if (STRING_BUILTINS.contains(name)) return PrimitiveType.STRING;
        if (BOOL_BUILTINS.contains(name)) return PrimitiveType.BOOL;
        return UnknownType.INSTANCE;
    }

    /**
     * @param adt A declared ADT.
     * @param variant One of its variants.
     * @return The constructor type of the variant.
     */
    public static FunctionType constructorOf(AdtType adt, String variant) {
        Map<String, Type> fields = adt.variants().get(variant);
        return new FunctionType(List.copyOf(fields.values()), adt);
    }
}
