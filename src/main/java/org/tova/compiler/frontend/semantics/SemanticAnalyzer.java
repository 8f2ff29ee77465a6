package org.tova.compiler.frontend.semantics;

import org.tova.compiler.api.CompilerOptions;
import org.tova.compiler.diagnostics.AnalysisError;
import org.tova.compiler.diagnostics.CompilerLogger;
import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.frontend.parser.ast.AssignmentNode;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.AwaitNode;
import org.tova.compiler.frontend.parser.ast.BinaryExpressionNode;
import org.tova.compiler.frontend.parser.ast.BlockNode;
import org.tova.compiler.frontend.parser.ast.CallNode;
import org.tova.compiler.frontend.parser.ast.CompoundAssignmentNode;
import org.tova.compiler.frontend.parser.ast.ForNode;
import org.tova.compiler.frontend.parser.ast.FunctionDeclarationNode;
import org.tova.compiler.frontend.parser.ast.IdentifierNode;
import org.tova.compiler.frontend.parser.ast.ImportNode;
import org.tova.compiler.frontend.parser.ast.LambdaNode;
import org.tova.compiler.frontend.parser.ast.LetDestructureNode;
import org.tova.compiler.frontend.parser.ast.ListComprehensionNode;
import org.tova.compiler.frontend.parser.ast.MatchArmNode;
import org.tova.compiler.frontend.parser.ast.MatchNode;
import org.tova.compiler.frontend.parser.ast.ProgramNode;
import org.tova.compiler.frontend.parser.ast.ReturnNode;
import org.tova.compiler.frontend.parser.ast.TryCatchNode;
import org.tova.compiler.frontend.parser.ast.TypeDeclarationNode;
import org.tova.compiler.frontend.parser.ast.UnaryExpressionNode;
import org.tova.compiler.frontend.parser.ast.VarDeclarationNode;
import org.tova.compiler.frontend.parser.features.cli.CliBlockNode;
import org.tova.compiler.frontend.parser.features.cli.CliCommandNode;
import org.tova.compiler.frontend.parser.features.client.ClientBlockNode;
import org.tova.compiler.frontend.parser.features.client.ComponentNode;
import org.tova.compiler.frontend.parser.features.client.ComputedNode;
import org.tova.compiler.frontend.parser.features.client.StateNode;
import org.tova.compiler.frontend.parser.features.client.StoreNode;
import org.tova.compiler.frontend.parser.features.concurrency.ConcurrentBlockNode;
import org.tova.compiler.frontend.parser.features.deploy.DeployBlockNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeBindingNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeBlockNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeEnvNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeSecretNode;
import org.tova.compiler.frontend.parser.features.jsx.JsxForNode;
import org.tova.compiler.frontend.parser.features.security.SecurityBlockNode;
import org.tova.compiler.frontend.parser.features.select.SelectCaseNode;
import org.tova.compiler.frontend.parser.features.server.ServerBlockNode;
import org.tova.compiler.frontend.parser.features.shared.SharedBlockNode;
import org.tova.compiler.frontend.semantics.analysis.*;
import org.tova.compiler.frontend.types.TypeRegistry;
import org.tova.compiler.stdlib.StdlibRegistry;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Performs semantic analysis on the AST: scope and binding rules, gradual type checks,
 * match exhaustiveness, control-flow and naming lints.
 * It operates by traversing the AST and dispatching nodes to specific handlers.
 */
public class SemanticAnalyzer {

    private static final CompilerLogger log = CompilerLogger.of(SemanticAnalyzer.class);

    private final DiagnosticsEngine diagnostics;
    private final CompilerOptions options;
    private final SymbolTable symbolTable;
    private final TypeRegistry types = new TypeRegistry();
    private final AnalysisContext context;
    private final Map<Class<? extends AstNode>, IAnalysisHandler> handlers = new HashMap<>();

    /**
     * Constructs a new semantic analyzer.
     * @param diagnostics The diagnostics engine for reporting errors.
     * @param options The compiler options; strict mode turns gradual warnings into errors.
     */
    public SemanticAnalyzer(DiagnosticsEngine diagnostics, CompilerOptions options) {
        this.diagnostics = diagnostics;
        this.options = options;
        this.symbolTable = new SymbolTable(diagnostics);
        this.context = new AnalysisContext(options, symbolTable, types, new KnownGlobals(StdlibRegistry.defaultRegistry()));
        registerDefaultHandlers();
    }

    private void registerDefaultHandlers() {
        handlers.put(FunctionDeclarationNode.class, new FunctionAnalysisHandler(context));
        handlers.put(LambdaNode.class, new LambdaAnalysisHandler(context));
        handlers.put(BlockNode.class, new BlockAnalysisHandler(context));
        handlers.put(AssignmentNode.class, new AssignmentAnalysisHandler(context));
        handlers.put(VarDeclarationNode.class, new VarDeclarationAnalysisHandler(context));
        handlers.put(LetDestructureNode.class, new LetDestructureAnalysisHandler(context));
        handlers.put(CompoundAssignmentNode.class, new CompoundAssignmentAnalysisHandler(context));
        handlers.put(IdentifierNode.class, new IdentifierAnalysisHandler(context));
        handlers.put(CallNode.class, new CallAnalysisHandler(context));

        OperatorAnalysisHandler operators = new OperatorAnalysisHandler(context);
        handlers.put(BinaryExpressionNode.class, operators);
        handlers.put(UnaryExpressionNode.class, operators);

        handlers.put(ReturnNode.class, new ReturnAnalysisHandler(context));
        handlers.put(AwaitNode.class, new AwaitAnalysisHandler());
        handlers.put(MatchNode.class, new MatchAnalysisHandler(context));
        handlers.put(MatchArmNode.class, new MatchArmAnalysisHandler(context));

        ForAnalysisHandler loops = new ForAnalysisHandler(context);
        handlers.put(ForNode.class, loops);
        handlers.put(ListComprehensionNode.class, loops);
        handlers.put(JsxForNode.class, loops);

        handlers.put(TryCatchNode.class, new TryCatchAnalysisHandler(context));
        handlers.put(TypeDeclarationNode.class, new TypeDeclarationAnalysisHandler(context));
        handlers.put(ImportNode.class, new ImportAnalysisHandler());

        RegionAnalysisHandler regions = new RegionAnalysisHandler(context);
        handlers.put(ClientBlockNode.class, regions);
        handlers.put(ServerBlockNode.class, regions);
        handlers.put(SharedBlockNode.class, regions);
        handlers.put(EdgeBlockNode.class, regions);
        handlers.put(StoreNode.class, regions);

        ReactiveDeclarationAnalysisHandler reactive = new ReactiveDeclarationAnalysisHandler(context);
        handlers.put(StateNode.class, reactive);
        handlers.put(ComputedNode.class, reactive);
        handlers.put(ComponentNode.class, new ComponentAnalysisHandler(context));

        EdgeDeclarationAnalysisHandler edge = new EdgeDeclarationAnalysisHandler();
        handlers.put(EdgeBindingNode.class, edge);
        handlers.put(EdgeEnvNode.class, edge);
        handlers.put(EdgeSecretNode.class, edge);

        ConfigBlockAnalysisHandler config = new ConfigBlockAnalysisHandler();
        handlers.put(DeployBlockNode.class, config);
        handlers.put(SecurityBlockNode.class, config);

        CliCommandAnalysisHandler cli = new CliCommandAnalysisHandler(context);
        handlers.put(CliBlockNode.class, cli);
        handlers.put(CliCommandNode.class, cli);

        handlers.put(SelectCaseNode.class, new SelectCaseAnalysisHandler(context));
        handlers.put(ConcurrentBlockNode.class, new ConcurrentAnalysisHandler());
    }

    /**
     * Registers or replaces the handler for a node type.
     * @param nodeType The node class.
     * @param handler The handler.
     */
    public void registerHandler(Class<? extends AstNode> nodeType, IAnalysisHandler handler) {
        handlers.put(nodeType, handler);
    }

    /**
     * Analyzes a whole program. This is the main entry point for the semantic analysis phase.
     * Top-level declarations are hoisted first so they may be referenced before their definition.
     * @param program The parsed program.
     * @return The collected warnings and errors together with the declared types.
     * @throws AnalysisError if errors were found and the compiler is not in tolerant mode.
     */
    public AnalysisResult analyze(ProgramNode program) {
        symbolTable.resetScope();
        context.declarations().hoist(program.body(), symbolTable);
        traverseAndAnalyze(program.body());

        AnalysisResult result = new AnalysisResult(diagnostics.getWarnings(), diagnostics.getErrors(), types);
        log.debug("Analysis finished: {} error(s), {} warning(s)", result.errors().size(), result.warnings().size());
        if (result.hasErrors() && !options.tolerant()) {
            throw new AnalysisError(result.errors(), result.warnings());
        }
        return result;
    }

    private void traverseAndAnalyze(List<AstNode> nodes) {
        for (AstNode node : nodes) {
            if (node == null) continue;
            IAnalysisHandler handler = handlers.get(node.getClass());
            if (handler == null) {
                traverseAndAnalyze(node.getChildren());
                continue;
            }
            handler.analyze(node, symbolTable, diagnostics);
            traverseAndAnalyze(handler.children(node));
            handler.afterChildren(node, symbolTable, diagnostics);
        }
    }

    /**
     * @return The symbol table, positioned at the module scope after {@link #analyze}.
     */
    public SymbolTable getSymbolTable() {
        return symbolTable;
    }
}
