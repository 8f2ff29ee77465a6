package org.tova.compiler.frontend;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tova.compiler.diagnostics.ParseError;
import org.tova.compiler.frontend.lexer.Lexer;
import org.tova.compiler.frontend.parser.Parser;
import org.tova.compiler.frontend.parser.ast.*;
import org.tova.compiler.frontend.parser.features.concurrency.ConcurrentBlockNode;
import org.tova.compiler.frontend.parser.features.concurrency.SpawnNode;
import org.tova.compiler.frontend.parser.features.select.SelectCaseNode;
import org.tova.compiler.frontend.parser.features.select.SelectNode;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains unit tests for the statement and expression grammar of the {@link Parser}.
 */
public class ParserTest {

    private static List<AstNode> parse(String source) {
        return new Parser(new Lexer(source, "test.tova").scanTokens()).parse().body();
    }

    private static AstNode single(String source) {
        List<AstNode> body = parse(source);
        assertThat(body).hasSize(1);
        return body.get(0);
    }

    private static ParseError parseError(String source) {
        return catchThrowableOfType(() -> parse(source), ParseError.class);
    }

    @Test
    @Tag("unit")
    void testAssignmentRespectsOperatorPrecedence() {
        // Act
        AssignmentNode assign = (AssignmentNode) single("x = 1 + 2 * 3");

        // Assert
        assertThat(((IdentifierNode) assign.target()).name()).isEqualTo("x");
        BinaryExpressionNode sum = (BinaryExpressionNode) assign.value();
        assertThat(sum.operator()).isEqualTo(Operator.ADD);
        assertThat(sum.right()).isInstanceOfSatisfying(BinaryExpressionNode.class,
                product -> assertThat(product.operator()).isEqualTo(Operator.MULTIPLY));
    }

    @Test
    @Tag("unit")
    void testVarDeclarationWithTypeAnnotation() {
        // Act
        VarDeclarationNode decl = (VarDeclarationNode) single("var count: Int = 0");

        // Assert
        assertThat(decl.name()).isEqualTo("count");
        assertThat(decl.type()).isNotNull();
        assertThat(decl.value()).isInstanceOf(NumberLiteralNode.class);
    }

    @Test
    @Tag("unit")
    void testMutIsRejectedWithHint() {
        // Act
        ParseError error = parseError("mut x = 1");

        // Assert
        assertThat(error).isNotNull();
        assertThat(error.getMessage()).contains("'mut' is not supported in Tova");
        assertThat(error.getHint()).isEqualTo("Use 'var' for mutable variables");
        assertThat(error.getDiagnostics().get(0).code()).isEqualTo("E003");
    }

    @Test
    @Tag("unit")
    void testLetWithoutDestructuringSuggestsVar() {
        // Act
        ParseError error = parseError("let total = 1");

        // Assert
        assertThat(error).isNotNull();
        assertThat(error.getHint()).contains("var total = ...");
    }

    @Test
    @Tag("unit")
    void testLetDestructuresObjectsAndArrays() {
        // Act
        List<AstNode> body = parse("let { a, b } = point\nlet [first, second] = pair");

        // Assert
        assertThat(body).hasSize(2);
        LetDestructureNode object = (LetDestructureNode) body.get(0);
        LetDestructureNode array = (LetDestructureNode) body.get(1);
        assertThat(object.kind()).isEqualTo(LetDestructureNode.Kind.OBJECT);
        assertThat(object.names()).containsExactly("a", "b");
        assertThat(array.kind()).isEqualTo(LetDestructureNode.Kind.ARRAY);
        assertThat(array.names()).containsExactly("first", "second");
    }

    @Test
    @Tag("unit")
    void testFunctionDeclarationWithTypesAndDoc() {
        // Arrange
        String source = String.join("\n",
                "/// Adds two numbers",
                "fn add(a: Int, b: Int = 1) -> Int {",
                "  a + b",
                "}");

        // Act
        FunctionDeclarationNode fn = (FunctionDeclarationNode) single(source);

        // Assert
        assertThat(fn.name()).isEqualTo("add");
        assertThat(fn.doc()).isEqualTo("Adds two numbers");
        assertThat(fn.params()).extracting(ParameterNode::name).containsExactly("a", "b");
        assertThat(fn.params().get(1).defaultValue()).isNotNull();
        assertThat(fn.returnType()).isNotNull();
        assertThat(fn.async()).isFalse();
        assertThat(fn.body().statements()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void testAsyncFunctionDeclaration() {
        // Act
        FunctionDeclarationNode fn = (FunctionDeclarationNode) single("async fn load() {\n  await fetch(url)\n}");

        // Assert
        assertThat(fn.async()).isTrue();
        ExpressionStatementNode statement = (ExpressionStatementNode) fn.body().statements().get(0);
        assertThat(statement.expression()).isInstanceOf(AwaitNode.class);
    }

    @Test
    @Tag("unit")
    void testTypeDeclarationWithVariants() {
        // Arrange
        String source = String.join("\n",
                "type Shape {",
                "  Circle(radius: Float)",
                "  Rect(width: Float, height: Float)",
                "  Empty",
                "} derive(Eq)");

        // Act
        TypeDeclarationNode type = (TypeDeclarationNode) single(source);

        // Assert
        assertThat(type.name()).isEqualTo("Shape");
        assertThat(type.variants()).extracting(TypeVariantNode::name).containsExactly("Circle", "Rect", "Empty");
        assertThat(type.variants().get(1).fields()).extracting(TypeFieldNode::name).containsExactly("width", "height");
        assertThat(type.variants().get(2).fields()).isEmpty();
        assertThat(type.derives()).containsExactly("Eq");
    }

    @Test
    @Tag("unit")
    void testMatchWithVariantAndWildcardArms() {
        // Arrange
        String source = String.join("\n",
                "y = match color {",
                "  Red => 1",
                "  Rgb(r, g, b) if r > 0 => r",
                "  _ => 0",
                "}");

        // Act
        AssignmentNode assign = (AssignmentNode) single(source);

        // Assert
        MatchNode match = (MatchNode) assign.value();
        assertThat(match.arms()).hasSize(3);
        assertThat(match.arms().get(0).pattern()).isInstanceOf(VariantPatternNode.class);
        VariantPatternNode rgb = (VariantPatternNode) match.arms().get(1).pattern();
        assertThat(rgb.fields()).hasSize(3).allMatch(f -> f instanceof BindingPatternNode);
        assertThat(match.arms().get(1).guard()).isNotNull();
        assertThat(match.arms().get(2).pattern()).isInstanceOf(WildcardPatternNode.class);
    }

    @Test
    @Tag("unit")
    void testDuplicateBindingInPatternIsRejected() {
        // Act
        ParseError error = parseError("y = match pair {\n  [a, a] => a\n}");

        // Assert
        assertThat(error).isNotNull();
        assertThat(error.getMessage()).contains("Duplicate binding 'a'");
    }

    @Test
    @Tag("unit")
    void testRangePatterns() {
        // Act
        AssignmentNode assign = (AssignmentNode) single("grade = match score {\n  90..=100 => \"A\"\n  _ => \"F\"\n}");

        // Assert
        RangePatternNode range = (RangePatternNode) ((MatchNode) assign.value()).arms().get(0).pattern();
        assertThat(range.start()).isEqualTo(90L);
        assertThat(range.end()).isEqualTo(100L);
        assertThat(range.inclusive()).isTrue();
    }

    @Test
    @Tag("unit")
    void testPipelinesAreLeftAssociative() {
        // Act
        AssignmentNode assign = (AssignmentNode) single("total = xs |> map(double) |> sum()");

        // Assert
        PipeNode outer = (PipeNode) assign.value();
        assertThat(outer.left()).isInstanceOf(PipeNode.class);
        assertThat(outer.right()).isInstanceOf(CallNode.class);
    }

    @Test
    @Tag("unit")
    void testChainedComparisonAndMembership() {
        // Act
        List<AstNode> body = parse("ok = 1 < x < 10\nfound = a in xs\nmissing = a not in xs");

        // Assert
        assertThat(((AssignmentNode) body.get(0)).value()).isInstanceOfSatisfying(ChainedComparisonNode.class,
                chain -> assertThat(chain.operands()).hasSize(3));
        assertThat(((AssignmentNode) body.get(1)).value()).isInstanceOfSatisfying(MembershipNode.class,
                m -> assertThat(m.negated()).isFalse());
        assertThat(((AssignmentNode) body.get(2)).value()).isInstanceOfSatisfying(MembershipNode.class,
                m -> assertThat(m.negated()).isTrue());
    }

    @Test
    @Tag("unit")
    void testArrowLambdaAndShorthandLambda() {
        // Act
        List<AstNode> body = parse("add = (a, b) => a + b\ninc = x => x + 1");

        // Assert
        LambdaNode add = (LambdaNode) ((AssignmentNode) body.get(0)).value();
        LambdaNode inc = (LambdaNode) ((AssignmentNode) body.get(1)).value();
        assertThat(add.params()).extracting(ParameterNode::name).containsExactly("a", "b");
        assertThat(add.body()).isInstanceOf(BinaryExpressionNode.class);
        assertThat(inc.params()).extracting(ParameterNode::name).containsExactly("x");
    }

    @Test
    @Tag("unit")
    void testStringInterpolationBecomesTemplateLiteral() {
        // Act
        AssignmentNode assign = (AssignmentNode) single("msg = \"Hi {user.name}!\"");

        // Assert
        TemplateLiteralNode template = (TemplateLiteralNode) assign.value();
        assertThat(template.segments()).hasSize(3);
        assertThat(template.segments().get(1).expression()).isInstanceOf(MemberAccessNode.class);
    }

    @Test
    @Tag("unit")
    void testForWithTwoVariablesAndElse() {
        // Act
        ForNode loop = (ForNode) single("for i, x in items {\n  print(x)\n} else {\n  print(\"empty\")\n}");

        // Assert
        assertThat(loop.variables()).containsExactly("i", "x");
        assertThat(loop.elseBody()).isNotNull();
    }

    @Test
    @Tag("unit")
    void testIfElifElseStatement() {
        // Act
        IfStatementNode stmt = (IfStatementNode) single("if a {\n  x()\n} elif b {\n  y()\n} else {\n  z()\n}");

        // Assert
        assertThat(stmt.alternates()).hasSize(1);
        assertThat(stmt.elseBody()).isNotNull();
    }

    @Test
    @Tag("unit")
    void testSlicesAndPropagation() {
        // Act
        List<AstNode> body = parse("head = xs[1:3]\nvalue = parse(input)?");

        // Assert
        assertThat(((AssignmentNode) body.get(0)).value()).isInstanceOf(SliceNode.class);
        assertThat(((AssignmentNode) body.get(1)).value()).isInstanceOf(PropagateNode.class);
    }

    @Test
    @Tag("unit")
    void testInvalidAssignmentTarget() {
        // Act
        ParseError error = parseError("1 = 2");

        // Assert
        assertThat(error).isNotNull();
        assertThat(error.getMessage()).contains("Invalid assignment target");
    }

    @Test
    @Tag("unit")
    void testTryRequiresCatchOrFinally() {
        // Act
        ParseError error = parseError("try {\n  risky()\n}");

        // Assert
        assertThat(error).isNotNull();
        assertThat(error.getMessage()).contains("Expected 'catch' or 'finally'");
    }

    @Test
    @Tag("unit")
    void testConcurrentBlockWithModeAndTimeout() {
        // Act
        ConcurrentBlockNode block = (ConcurrentBlockNode) single(
                "concurrent cancel_on_error timeout(500) {\n  a = spawn fetch_a()\n  b = spawn fetch_b()\n}");

        // Assert
        assertThat(block.mode()).isEqualTo("cancel_on_error");
        assertThat(block.timeout()).isInstanceOf(NumberLiteralNode.class);
        assertThat(block.body().statements()).hasSize(2);
        assertThat(((AssignmentNode) block.body().statements().get(0)).value()).isInstanceOf(SpawnNode.class);
    }

    @Test
    @Tag("unit")
    void testSelectArms() {
        // Arrange
        String source = String.join("\n",
                "select {",
                "  case msg from inbox => handle(msg)",
                "  case outbox.send(1) => sent()",
                "  case timeout(100) => late()",
                "  case _ => idle()",
                "}");

        // Act
        SelectNode select = (SelectNode) single(source);

        // Assert
        assertThat(select.cases()).extracting(SelectCaseNode::kind).containsExactly(
                SelectCaseNode.Kind.RECEIVE, SelectCaseNode.Kind.SEND,
                SelectCaseNode.Kind.TIMEOUT, SelectCaseNode.Kind.DEFAULT);
        assertThat(select.cases().get(0).binding()).isEqualTo("msg");
    }

    @Test
    @Tag("unit")
    void testSelectAllowsOnlyOneDefaultArm() {
        // Act
        ParseError error = parseError("select {\n  case _ => a()\n  case _ => b()\n}");

        // Assert
        assertThat(error).isNotNull();
        assertThat(error.getMessage()).contains("at most one default arm");
    }
}
