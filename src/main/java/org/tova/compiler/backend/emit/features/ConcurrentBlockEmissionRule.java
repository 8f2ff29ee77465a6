package org.tova.compiler.backend.emit.features;

import org.tova.compiler.backend.BaseCodegen;
import org.tova.compiler.backend.emit.IEmissionRule;
import org.tova.compiler.diagnostics.CompilerLogger;
import org.tova.compiler.frontend.parser.ast.AssignmentNode;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.tova.compiler.frontend.parser.ast.IdentifierNode;
import org.tova.compiler.frontend.parser.ast.VarDeclarationNode;
import org.tova.compiler.frontend.parser.features.concurrency.ConcurrentBlockNode;
import org.tova.compiler.frontend.parser.features.concurrency.SpawnNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers a {@code concurrent} block. Ordinary statements run first, then every {@code spawn} becomes
 * an async task whose outcome is wrapped as {@code Ok(value)} or {@code Err(error)}. All tasks are
 * gathered by a single {@code Promise.all} (or {@code Promise.race} in {@code first} mode) and the
 * assigned names are bound positionally from the gathered array.
 */
public class ConcurrentBlockEmissionRule implements IEmissionRule<ConcurrentBlockNode> {

    private static final CompilerLogger log = CompilerLogger.of(ConcurrentBlockEmissionRule.class);

    private record Spawn(String name, AstNode expression) {}

    @Override
    public String emit(ConcurrentBlockNode node, BaseCodegen gen) {
        String indent = gen.indent();
        int id = gen.uid();
        String result = "__c" + id;
        String failed = "__failed" + id;
        boolean cancelOnError = node.mode().equals("cancel_on_error");

        List<AstNode> statements = node.body().statements();
        int lastSpawn = -1;
        for (int i = 0; i < statements.size(); i++) {
            if (spawnOf(statements.get(i)) != null) lastSpawn = i;
        }

        // Statements up to the last spawn run before the tasks are gathered, the rest after the bindings.
        List<String> lines = new ArrayList<>();
        List<Spawn> spawns = new ArrayList<>();
        List<AstNode> trailing = statements.subList(lastSpawn + 1, statements.size());
        for (AstNode stmt : statements.subList(0, lastSpawn + 1)) {
            Spawn spawn = spawnOf(stmt);
            if (spawn == null) {
                lines.add(gen.statement(stmt));
            } else {
                spawns.add(spawn);
            }
        }
        log.debug("Lowering concurrent block ({}) with {} task(s)", node.mode(), spawns.size());
        if (spawns.isEmpty()) {
            trailing.forEach(stmt -> lines.add(gen.statement(stmt)));
            return String.join("\n", lines);
        }

        gen.context().use("Ok");
        gen.context().use("Err");
        if (cancelOnError) lines.add(indent + "let " + failed + " = false;");

        String inner = gen.nested(gen::indent);
        List<String> tasks = new ArrayList<>();
        for (Spawn spawn : spawns) {
            tasks.add(inner + task(gen.expression(spawn.expression()), cancelOnError ? failed : null));
        }
        String taskList = "[\n" + String.join(",\n", tasks) + "\n" + indent + "]";

        if (node.mode().equals("first")) {
            gen.context().use("None");
            lines.addAll(first(node, gen, indent, result, id, taskList));
            for (int i = 0; i < spawns.size(); i++) {
                bind(spawns.get(i).name(), result + "[0] === " + i + " ? " + result + "[1] : None", gen, lines);
            }
            trailing.forEach(stmt -> lines.add(gen.statement(stmt)));
            return String.join("\n", lines);
        }

        if (node.timeout() == null) {
            lines.add(indent + "const " + result + " = await Promise.all(" + taskList + ");");
        } else {
            lines.addAll(allWithTimeout(node, gen, indent, result, id, spawns.size(), taskList));
        }
        for (int i = 0; i < spawns.size(); i++) {
            bind(spawns.get(i).name(), result + "[" + i + "]", gen, lines);
        }
        trailing.forEach(stmt -> lines.add(gen.statement(stmt)));
        return String.join("\n", lines);
    }

    private static Spawn spawnOf(AstNode stmt) {
        if (stmt instanceof AssignmentNode assign && assign.value() instanceof SpawnNode spawn
                && assign.target() instanceof IdentifierNode target) {
            return new Spawn(target.name(), spawn.expression());
        }
        if (stmt instanceof VarDeclarationNode decl && decl.value() instanceof SpawnNode spawn) {
            return new Spawn(decl.name(), spawn.expression());
        }
        if (stmt instanceof ExpressionStatementNode expr && expr.expression() instanceof SpawnNode spawn) {
            return new Spawn(null, spawn.expression());
        }
        return null;
    }

    private static void bind(String name, String value, BaseCodegen gen, List<String> lines) {
        if (name == null || name.equals("_")) return;
        gen.declare(name, false);
        lines.add(gen.indent() + "const " + name + " = " + value + ";");
    }

    // Once one task failed, every later outcome is reported as cancelled.
    private static String task(String expression, String failedFlag) {
        if (failedFlag == null) {
            return "(async () => { try { return Ok(await (" + expression + ")); } catch (__e) { return Err(__e); } })()";
        }
        return "(async () => { try { const __v = await (" + expression + "); return " + failedFlag
                + " ? Err(\"cancelled\") : Ok(__v); } catch (__e) { if (" + failedFlag + ") return Err(\"cancelled\"); "
                + failedFlag + " = true; return Err(__e); } })()";
    }

    private static List<String> first(ConcurrentBlockNode node, BaseCodegen gen, String indent, String result, int id, String taskList) {
        List<String> lines = new ArrayList<>();
        String race = taskList + ".map((p, i) => p.then((r) => [i, r]))";
        if (node.timeout() == null) {
            lines.add(indent + "const " + result + " = await Promise.race(" + race + ");");
            return lines;
        }
        String timer = "__timer" + id;
        lines.add(indent + "let " + timer + ";");
        lines.add(indent + "const " + result + " = await Promise.race([...(" + race + "), new Promise((resolve) => { "
                + timer + " = setTimeout(() => resolve([-1, Err(\"timeout\")]), " + gen.expression(node.timeout()) + "); })]);");
        lines.add(indent + "clearTimeout(" + timer + ");");
        return lines;
    }

    // Slots still empty when the timer fires resolve to Err("timeout").
    private static List<String> allWithTimeout(ConcurrentBlockNode node, BaseCodegen gen, String indent, String result,
                                               int id, int count, String taskList) {
        List<String> lines = new ArrayList<>();
        String slots = "__slots" + id;
        String timer = "__timer" + id;
        lines.add(indent + "const " + slots + " = new Array(" + count + ").fill(undefined);");
        lines.add(indent + "let " + timer + ";");
        lines.add(indent + "const " + result + " = await Promise.race([Promise.all(" + taskList
                + ".map((p, i) => p.then((r) => (" + slots + "[i] = r)))), new Promise((resolve) => { " + timer
                + " = setTimeout(() => resolve(" + slots + ".map((r) => r === undefined ? Err(\"timeout\") : r)), "
                + gen.expression(node.timeout()) + "); })]);");
        lines.add(indent + "clearTimeout(" + timer + ");");
        return lines;
    }
}
