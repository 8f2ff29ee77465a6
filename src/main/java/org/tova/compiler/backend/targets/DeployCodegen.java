package org.tova.compiler.backend.targets;

import org.tova.compiler.backend.BaseCodegen;
import org.tova.compiler.backend.emit.EmissionContext;
import org.tova.compiler.frontend.parser.ast.ArrayLiteralNode;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.BooleanLiteralNode;
import org.tova.compiler.frontend.parser.ast.ConfigFieldNode;
import org.tova.compiler.frontend.parser.ast.IdentifierNode;
import org.tova.compiler.frontend.parser.ast.NilLiteralNode;
import org.tova.compiler.frontend.parser.ast.NumberLiteralNode;
import org.tova.compiler.frontend.parser.ast.ObjectLiteralNode;
import org.tova.compiler.frontend.parser.ast.ObjectPropertyNode;
import org.tova.compiler.frontend.parser.ast.Operator;
import org.tova.compiler.frontend.parser.ast.StringLiteralNode;
import org.tova.compiler.frontend.parser.ast.UnaryExpressionNode;
import org.tova.compiler.frontend.parser.features.deploy.DeployBlockNode;
import org.tova.compiler.frontend.parser.features.deploy.DeployDatabasesNode;
import org.tova.compiler.frontend.parser.features.deploy.DeployDbNode;
import org.tova.compiler.frontend.parser.features.deploy.DeployEnvNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns {@code deploy} blocks into configuration manifests. Blocks with the same name merge in
 * source order; later settings win.
 */
public class DeployCodegen extends BaseCodegen {

    /** Settings every manifest starts from. */
    public static final Map<String, Object> DEFAULTS = defaults();

    public DeployCodegen(EmissionContext context) {
        super(context);
    }

    private static Map<String, Object> defaults() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("instances", 1);
        defaults.put("memory", "512mb");
        defaults.put("branch", "main");
        defaults.put("health", "/healthz");
        defaults.put("health_interval", 30);
        defaults.put("health_timeout", 5);
        defaults.put("restart_on_failure", true);
        defaults.put("keep_releases", 5);
        return Collections.unmodifiableMap(defaults);
    }

    /**
     * @param blocks All deploy blocks of the program.
     * @return Manifest per deploy name, in order of first appearance.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Map<String, Object>> generate(List<DeployBlockNode> blocks) {
        Map<String, Map<String, Object>> manifests = new LinkedHashMap<>();
        for (DeployBlockNode block : blocks) {
            Map<String, Object> config = manifests.computeIfAbsent(block.name(), this::base);
            for (AstNode stmt : block.body()) {
                if (stmt instanceof ConfigFieldNode field) {
                    config.put(field.key(), value(field.value()));
                } else if (stmt instanceof DeployEnvNode env) {
                    Map<String, Object> vars = (Map<String, Object>) config.get("env");
                    env.entries().forEach(e -> vars.put(e.key(), value(e.value())));
                } else if (stmt instanceof DeployDatabasesNode databases) {
                    List<Object> list = (List<Object>) config.get("databases");
                    for (DeployDbNode db : databases.engines()) {
                        Map<String, Object> dbConfig = new LinkedHashMap<>();
                        db.fields().forEach(f -> dbConfig.put(f.key(), value(f.value())));
                        Map<String, Object> entry = new LinkedHashMap<>();
                        entry.put("engine", db.engine());
                        entry.put("config", dbConfig);
                        list.add(entry);
                    }
                }
            }
        }
        return manifests;
    }

    private Map<String, Object> base(String name) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("name", name);
        config.putAll(DEFAULTS);
        config.put("env", new LinkedHashMap<String, Object>());
        config.put("databases", new ArrayList<Object>());
        return config;
    }

    /**
     * Literal values become plain Java values; anything else is kept as its JavaScript source.
     */
    Object value(AstNode node) {
        if (node instanceof StringLiteralNode s) return s.value();
        if (node instanceof NumberLiteralNode n) return n.value();
        if (node instanceof BooleanLiteralNode b) return b.value();
        if (node instanceof NilLiteralNode) return null;
        if (node instanceof UnaryExpressionNode u && u.operator() == Operator.NEGATE
                && u.operand() instanceof NumberLiteralNode n) {
            return n.value() instanceof Double d ? (Object) (-d) : (Object) (-n.value().longValue());
        }
        if (node instanceof ArrayLiteralNode array) {
            List<Object> list = new ArrayList<>();
            array.elements().forEach(e -> list.add(value(e)));
            return list;
        }
        if (node instanceof ObjectLiteralNode object) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (AstNode entry : object.entries()) {
                if (entry instanceof ObjectPropertyNode p) map.put(p.key(), value(p.value()));
            }
            return map;
        }
        if (node instanceof IdentifierNode id) return id.name();
        return expression(node);
    }
}
