package org.tova.compiler.backend;

import org.tova.compiler.api.CompilerOptions;
import org.tova.compiler.backend.emit.EmissionContext;
import org.tova.compiler.backend.targets.CliCodegen;
import org.tova.compiler.backend.targets.ClientCodegen;
import org.tova.compiler.backend.targets.DeployCodegen;
import org.tova.compiler.backend.targets.EdgeCodegen;
import org.tova.compiler.backend.targets.SecurityCodegen;
import org.tova.compiler.backend.targets.ServerCodegen;
import org.tova.compiler.backend.targets.SharedCodegen;
import org.tova.compiler.backend.targets.TargetCode;
import org.tova.compiler.diagnostics.CompilerLogger;
import org.tova.compiler.frontend.parser.ast.AssignmentNode;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.FunctionDeclarationNode;
import org.tova.compiler.frontend.parser.ast.IdentifierNode;
import org.tova.compiler.frontend.parser.ast.ImportNode;
import org.tova.compiler.frontend.parser.ast.LetDestructureNode;
import org.tova.compiler.frontend.parser.ast.ProgramNode;
import org.tova.compiler.frontend.parser.ast.TypeDeclarationNode;
import org.tova.compiler.frontend.parser.ast.TypeFieldNode;
import org.tova.compiler.frontend.parser.ast.TypeVariantNode;
import org.tova.compiler.frontend.parser.ast.VarDeclarationNode;
import org.tova.compiler.frontend.parser.features.cli.CliBlockNode;
import org.tova.compiler.frontend.parser.features.client.ClientBlockNode;
import org.tova.compiler.frontend.parser.features.deploy.DeployBlockNode;
import org.tova.compiler.frontend.parser.features.edge.EdgeBlockNode;
import org.tova.compiler.frontend.parser.features.security.SecurityBlockNode;
import org.tova.compiler.frontend.parser.features.server.ServerBlockNode;
import org.tova.compiler.frontend.parser.features.shared.SharedBlockNode;
import org.tova.compiler.stdlib.StdlibRegistry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Splits a program into its targets and emits JavaScript for each.
 * <p>
 * Top-level statements and {@code shared} blocks form the shared code, which is inlined into every
 * target file together with the tree-shaken runtime prelude. The prelude is rendered last, after
 * every target has reported the helpers it needs. Blocks of the same kind and name are merged.
 */
public class CodeGenerator {

    private static final CompilerLogger log = CompilerLogger.of(CodeGenerator.class);

    /** Result key of the shared code. */
    public static final String SHARED = "shared";
    /** Result key of the default client file. */
    public static final String CLIENT = "client";
    /** Result key of the default server file. */
    public static final String SERVER = "server";
    /** Result key of the default edge file. */
    public static final String EDGE = "edge";
    /** Result key of the named edge files. */
    public static final String EDGES = "edges";
    /** Result key of the named server files. */
    public static final String SERVERS = "servers";
    /** Result key of the named client files. */
    public static final String CLIENTS = "clients";
    /** Result key of the deploy manifests. */
    public static final String DEPLOY = "deploy";
    /** Result key of the CLI executable. */
    public static final String CLI = "cli";
    /** Result key of the shared source map. */
    public static final String SOURCE_MAP = "sourceMap";

    private final ProgramNode program;
    private final String fileName;
    private final CompilerOptions options;
    private final StdlibRegistry stdlib;

    public CodeGenerator(ProgramNode program, String fileName, CompilerOptions options) {
        this(program, fileName, options, StdlibRegistry.defaultRegistry());
    }

    public CodeGenerator(ProgramNode program, String fileName, CompilerOptions options, StdlibRegistry stdlib) {
        this.program = program;
        this.fileName = fileName;
        this.options = options;
        this.stdlib = stdlib;
    }

    /**
     * Emits every target of the program.
     * @return The outputs keyed by the constants of this class.
     * @throws org.tova.compiler.diagnostics.CodegenError if a node has no emission rule.
     */
    public Map<String, Object> generate() {
        long start = System.nanoTime();
        EmissionContext context = new EmissionContext(stdlib);
        BuiltinScanner.scan(program.body(), context);

        List<AstNode> sharedNodes = new ArrayList<>();
        Map<String, List<ServerBlockNode>> servers = new LinkedHashMap<>();
        Map<String, List<ClientBlockNode>> clients = new LinkedHashMap<>();
        Map<String, List<EdgeBlockNode>> edges = new LinkedHashMap<>();
        List<DeployBlockNode> deploys = new ArrayList<>();
        List<SecurityBlockNode> security = new ArrayList<>();
        List<CliBlockNode> cli = new ArrayList<>();
        for (AstNode node : program.body()) {
            if (node instanceof SharedBlockNode shared) sharedNodes.addAll(shared.body());
            else if (node instanceof ServerBlockNode server) servers.computeIfAbsent(key(server.name()), k -> new ArrayList<>()).add(server);
            else if (node instanceof ClientBlockNode client) clients.computeIfAbsent(key(client.name()), k -> new ArrayList<>()).add(client);
            else if (node instanceof EdgeBlockNode edge) edges.computeIfAbsent(key(edge.name()), k -> new ArrayList<>()).add(edge);
            else if (node instanceof DeployBlockNode deploy) deploys.add(deploy);
            else if (node instanceof SecurityBlockNode sec) security.add(sec);
            else if (node instanceof CliBlockNode c) cli.add(c);
            else sharedNodes.add(node);
        }

        SharedCodegen sharedGen = prepare(new SharedCodegen(context), List.of());
        String sharedBody = sharedGen.generate(sharedNodes);
        Map<String, Object> result = new LinkedHashMap<>();

        if (!cli.isEmpty()) {
            TargetCode code = prepare(new CliCodegen(context), sharedNodes).generate(CliCodegen.merge(cli));
            String prelude = context.renderPrelude();
            String shared = withPrelude(prelude, sharedBody);
            result.put(SHARED, shared);
            result.put(CLI, code.assemble(shared));
            addSourceMap(result, prelude, sharedBody, sharedGen);
            log.debug("Code generation (cli) finished in {} ms", (System.nanoTime() - start) / 1_000_000);
            return result;
        }

        SecurityCodegen.SecurityConfig securityConfig = SecurityCodegen.merge(security);
        Map<String, TargetCode> serverCode = emitGroups(servers,
                blocks -> prepare(new ServerCodegen(context), sharedNodes).generate(blocks, securityConfig));
        Map<String, TargetCode> clientCode = emitGroups(clients, blocks -> {
            TargetCode code = prepare(new ClientCodegen(context), sharedNodes).generate(blocks);
            List<String> browser = new SecurityCodegen(context).browserSections(securityConfig);
            if (browser.isEmpty()) return code;
            return new TargetCode(code.header(), code.body() + "\n\n" + String.join("\n\n", browser));
        });
        Map<String, TargetCode> edgeCode = emitGroups(edges,
                blocks -> prepare(new EdgeCodegen(context), sharedNodes).generate(EdgeCodegen.merge(blocks)));
        Map<String, Map<String, Object>> deployConfig = new DeployCodegen(context).generate(deploys);

        // every target has reported its helpers by now
        String prelude = context.renderPrelude();
        String shared = withPrelude(prelude, sharedBody);
        result.put(SHARED, shared);
        result.put(SERVER, assembleDefault(serverCode, shared));
        result.put(CLIENT, assembleDefault(clientCode, shared));
        result.put(EDGE, assembleDefault(edgeCode, shared));
        result.put(SERVERS, assembleNamed(serverCode, shared));
        result.put(CLIENTS, assembleNamed(clientCode, shared));
        result.put(EDGES, assembleNamed(edgeCode, shared));
        result.put(DEPLOY, deployConfig);
        addSourceMap(result, prelude, sharedBody, sharedGen);
        log.debug("Code generation finished in {} ms: {} server, {} client, {} edge, {} deploy target(s)",
                (System.nanoTime() - start) / 1_000_000, serverCode.size(), clientCode.size(), edgeCode.size(),
                deployConfig.size());
        return result;
    }

    // The default unnamed group of each kind is stored under the empty key.
    private static String key(String name) {
        return name == null ? "" : name;
    }

    private static <B> Map<String, TargetCode> emitGroups(Map<String, List<B>> groups, Function<List<B>, TargetCode> emitter) {
        Map<String, TargetCode> out = new LinkedHashMap<>();
        groups.forEach((name, blocks) -> out.put(name, emitter.apply(blocks)));
        return out;
    }

    private static String assembleDefault(Map<String, TargetCode> code, String shared) {
        TargetCode target = code.get("");
        return target == null ? "" : target.assemble(shared);
    }

    private static Map<String, String> assembleNamed(Map<String, TargetCode> code, String shared) {
        Map<String, String> out = new LinkedHashMap<>();
        code.forEach((name, target) -> {
            if (!name.isEmpty()) out.put(name, target.assemble(shared));
        });
        return out;
    }

    private static String withPrelude(String prelude, String sharedBody) {
        if (prelude.isBlank()) return sharedBody;
        if (sharedBody.isBlank()) return prelude;
        return prelude + "\n\n" + sharedBody;
    }

    private void addSourceMap(Map<String, Object> result, String prelude, String sharedBody, SharedCodegen sharedGen) {
        if (!options.sourceMaps()) return;
        int offset = prelude.isBlank() || sharedBody.isBlank() ? 0 : (int) prelude.lines().count() + 1;
        result.put(SOURCE_MAP, new SourceMapBuilder(fileName)
                .addAll(sharedGen.getSourceMappings(), offset)
                .build(outputName(fileName)));
    }

    private static String outputName(String fileName) {
        String base = fileName.replace('\\', '/');
        base = base.substring(base.lastIndexOf('/') + 1);
        if (base.endsWith(".tova")) base = base.substring(0, base.length() - ".tova".length());
        return base + ".shared.js";
    }

    /**
     * Registers every variant of the program, so patterns resolve field names declared anywhere, and
     * binds the names the shared code declares at module level.
     */
    private <G extends BaseCodegen> G prepare(G gen, List<AstNode> sharedNodes) {
        registerVariants(program.body(), gen);
        for (AstNode node : sharedNodes) {
            if (node instanceof FunctionDeclarationNode fn) gen.declare(fn.name(), false);
            else if (node instanceof VarDeclarationNode decl) gen.declare(decl.name(), true);
            else if (node instanceof AssignmentNode assign && assign.target() instanceof IdentifierNode id) gen.declare(id.name(), false);
            else if (node instanceof LetDestructureNode destructure) destructure.names().forEach(n -> gen.declare(n, false));
            else if (node instanceof ImportNode imp) {
                imp.names().forEach(n -> gen.declare(n, false));
                if (imp.defaultName() != null) gen.declare(imp.defaultName(), false);
            } else if (node instanceof TypeDeclarationNode type) {
                gen.declare(type.name(), false);
                type.variants().forEach(v -> gen.declare(v.name(), false));
            }
        }
        return gen;
    }

    private static void registerVariants(List<AstNode> nodes, BaseCodegen gen) {
        for (AstNode node : nodes) {
            if (node == null) continue;
            if (node instanceof TypeDeclarationNode type) {
                for (TypeVariantNode variant : type.variants()) {
                    gen.registerVariant(variant.name(), variant.fields().stream().map(TypeFieldNode::name).toList());
                }
            }
            registerVariants(node.getChildren(), gen);
        }
    }
}
