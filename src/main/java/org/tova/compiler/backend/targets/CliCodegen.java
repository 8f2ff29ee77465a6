package org.tova.compiler.backend.targets;

import org.tova.compiler.backend.BaseCodegen;
import org.tova.compiler.backend.emit.EmissionContext;
import org.tova.compiler.diagnostics.CompilerLogger;
import org.tova.compiler.frontend.parser.ast.ConfigFieldNode;
import org.tova.compiler.frontend.parser.ast.StringLiteralNode;
import org.tova.compiler.frontend.parser.features.cli.CliBlockNode;
import org.tova.compiler.frontend.parser.features.cli.CliCommandNode;
import org.tova.compiler.frontend.parser.features.cli.CliParamNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits a standalone command-line executable from {@code cli} blocks.
 * <p>
 * Each command becomes {@code __cmd_<name>} plus an argv dispatcher that parses its flags and
 * positionals, coerces them to the declared types and prints usage on {@code --help}. With a
 * single command the executable has no subcommand; with several it routes on the first argument.
 */
public class CliCodegen extends BaseCodegen {

    private static final CompilerLogger log = CompilerLogger.of(CliCodegen.class);

    /**
     * The merged cli blocks. Settings keep the last value; commands accumulate.
     */
    public record CliConfig(String name, String version, String description, List<CliCommandNode> commands) {}

    public CliCodegen(EmissionContext context) {
        super(context);
    }

    /**
     * @param blocks The cli blocks in source order.
     * @return The merged configuration.
     */
    public static CliConfig merge(List<CliBlockNode> blocks) {
        String name = null;
        String version = null;
        String description = null;
        List<CliCommandNode> commands = new ArrayList<>();
        for (CliBlockNode block : blocks) {
            for (ConfigFieldNode field : block.config()) {
                if (!(field.value() instanceof StringLiteralNode s)) continue;
                switch (field.key()) {
                    case "name" -> name = s.value();
                    case "version" -> version = s.value();
                    case "description" -> description = s.value();
                    default -> { }
                }
            }
            commands.addAll(block.commands());
        }
        return new CliConfig(name, version, description, List.copyOf(commands));
    }

    /**
     * @param config The merged configuration.
     * @return The executable without the shared code.
     */
    public TargetCode generate(CliConfig config) {
        log.debug("CLI target: {} command(s)", config.commands().size());
        boolean single = config.commands().size() == 1;
        List<String> sections = new ArrayList<>();
        sections.add(coercionHelper());
        for (CliCommandNode command : config.commands()) sections.add(commandFunction(command));
        sections.add(mainHelp(config));
        for (CliCommandNode command : config.commands()) sections.add(commandHelp(command, config));
        for (CliCommandNode command : config.commands()) sections.add(dispatcher(command));
        sections.add(main(config, single));
        sections.add("__cli_main(process.argv.slice(2)).catch((err) => {\n"
                + "  console.error(\"Error: \" + (err && err.message ? err.message : err));\n"
                + "  process.exit(1);\n"
                + "});");
        return new TargetCode("#!/usr/bin/env node", String.join("\n\n", sections));
    }

    private static String coercionHelper() {
        return "function __cli_coerce(value, type, name) {\n"
                + "  if (type === \"Int\") {\n"
                + "    const n = Number(value);\n"
                + "    if (!Number.isInteger(n)) { console.error(\"Error: \" + name + \" must be an integer, got \\\"\" + value + \"\\\"\"); process.exit(1); }\n"
                + "    return n;\n"
                + "  }\n"
                + "  if (type === \"Float\") {\n"
                + "    const n = parseFloat(value);\n"
                + "    if (isNaN(n)) { console.error(\"Error: \" + name + \" must be a number, got \\\"\" + value + \"\\\"\"); process.exit(1); }\n"
                + "    return n;\n"
                + "  }\n"
                + "  if (type === \"Bool\") return value === \"true\" || value === \"1\" || value === \"yes\";\n"
                + "  return value;\n"
                + "}";
    }

    private String commandFunction(CliCommandNode command) {
        List<String> names = command.params().stream().map(CliParamNode::name).toList();
        boolean async = command.async() || needsAsync(command.body().statements());
        String body = nested(() -> {
            names.forEach(n -> declare(n, false));
            String code = statements(command.body().statements());
            return containsPropagate(command.body().statements()) ? wrapPropagation(code) : code;
        });
        return (async ? "async " : "") + "function __cmd_" + command.name() + "(" + String.join(", ", names) + ") {\n"
                + body + "\n}";
    }

    private static String mainHelp(CliConfig config) {
        List<String> lines = new ArrayList<>();
        lines.add("function __cli_help() {");
        lines.add("  const lines = [];");
        if (config.name() != null) {
            String title = config.description() == null ? config.name() : config.name() + " - " + config.description();
            lines.add("  lines.push(" + quote(title) + ");");
        }
        if (config.version() != null) lines.add("  lines.push(" + quote("Version: " + config.version()) + ");");
        lines.add("  lines.push(\"\");");
        lines.add("  lines.push(\"USAGE:\");");
        if (config.commands().size() == 1) {
            lines.add("  lines.push(" + quote("  " + usage(config.commands().get(0), config, true)) + ");");
        } else {
            lines.add("  lines.push(" + quote("  " + programName(config) + " <command> [options]") + ");");
            lines.add("  lines.push(\"\");");
            lines.add("  lines.push(\"COMMANDS:\");");
            for (CliCommandNode command : config.commands()) {
                lines.add("  lines.push(" + quote("  " + command.name()) + ");");
            }
        }
        lines.add("  lines.push(\"\");");
        lines.add("  lines.push(\"OPTIONS:\");");
        lines.add("  lines.push(\"  --help, -h     Show help\");");
        if (config.version() != null) lines.add("  lines.push(\"  --version, -v  Show version\");");
        lines.add("  console.log(lines.join(\"\\n\"));");
        lines.add("}");
        return String.join("\n", lines);
    }

    private String commandHelp(CliCommandNode command, CliConfig config) {
        List<String> lines = new ArrayList<>();
        lines.add("function __cli_command_help_" + command.name() + "() {");
        lines.add("  const lines = [];");
        lines.add("  lines.push(\"USAGE:\");");
        lines.add("  lines.push(" + quote("  " + usage(command, config, config.commands().size() == 1)) + ");");
        List<CliParamNode> positionals = command.params().stream().filter(p -> !p.flag()).toList();
        List<CliParamNode> flags = command.params().stream().filter(CliParamNode::flag).toList();
        if (!positionals.isEmpty()) {
            lines.add("  lines.push(\"\");");
            lines.add("  lines.push(\"ARGUMENTS:\");");
            for (CliParamNode p : positionals) {
                String detail = " <" + p.type() + ">" + (p.optional() ? " (optional)" : "") + defaultSuffix(p);
                lines.add("  lines.push(" + quote("  " + pad(p.name(), 16) + detail) + ");");
            }
        }
        lines.add("  lines.push(\"\");");
        lines.add("  lines.push(\"OPTIONS:\");");
        for (CliParamNode f : flags) {
            String detail = (f.type().equals("Bool") ? "" : " <" + f.type() + ">") + (f.repeated() ? " (repeatable)" : "") + defaultSuffix(f);
            lines.add("  lines.push(" + quote("  --" + pad(f.name(), 14) + detail) + ");");
        }
        lines.add("  lines.push(\"  --help, -h        Show help\");");
        lines.add("  console.log(lines.join(\"\\n\"));");
        lines.add("}");
        return String.join("\n", lines);
    }

    private String defaultSuffix(CliParamNode p) {
        return p.defaultValue() == null ? "" : " (default: " + expression(p.defaultValue()) + ")";
    }

    private static String usage(CliCommandNode command, CliConfig config, boolean single) {
        StringBuilder out = new StringBuilder(programName(config));
        if (!single) out.append(' ').append(command.name());
        for (CliParamNode p : command.params()) {
            if (p.flag()) {
                String flag = "--" + p.name() + (p.type().equals("Bool") ? "" : " <" + p.type() + ">");
                out.append(p.optional() ? " [" + flag + "]" : " " + flag);
            } else {
                out.append(p.optional() ? " [" + p.name() + "]" : " <" + p.name() + ">");
            }
        }
        return out.toString();
    }

    private static String programName(CliConfig config) {
        return config.name() == null ? "cli" : config.name();
    }

    private static String pad(String text, int width) {
        return text.length() >= width ? text + " " : text + " ".repeat(width - text.length());
    }

    private String dispatcher(CliCommandNode command) {
        String name = command.name();
        List<CliParamNode> positionals = command.params().stream().filter(p -> !p.flag()).toList();
        List<CliParamNode> flags = command.params().stream().filter(CliParamNode::flag).toList();
        List<String> lines = new ArrayList<>();
        lines.add("async function __cli_dispatch_" + name + "(argv) {");
        for (CliParamNode f : flags) {
            String init;
            if (f.type().equals("Bool")) init = f.defaultValue() == null ? "false" : expression(f.defaultValue());
            else if (f.repeated()) init = "[]";
            else if (f.defaultValue() != null) init = expression(f.defaultValue());
            else init = "undefined";
            lines.add("  let __flag_" + f.name() + " = " + init + ";");
        }
        lines.add("  const __positionals = [];");
        lines.add("  for (let __i = 0; __i < argv.length; __i++) {");
        lines.add("    const __arg = argv[__i];");
        lines.add("    if (__arg === \"--help\" || __arg === \"-h\") { __cli_command_help_" + name + "(); return; }");
        for (CliParamNode f : flags) {
            String var = "__flag_" + f.name();
            String flag = "--" + f.name();
            String type = quote(f.type());
            if (f.type().equals("Bool")) {
                lines.add("    if (__arg === " + quote(flag) + ") { " + var + " = true; continue; }");
                lines.add("    if (__arg === " + quote("--no-" + f.name()) + ") { " + var + " = false; continue; }");
                continue;
            }
            String assign = f.repeated() ? var + ".push(__cli_coerce(%s, " + type + ", " + quote(flag) + "));"
                    : var + " = __cli_coerce(%s, " + type + ", " + quote(flag) + ");";
            lines.add("    if (__arg === " + quote(flag) + ") {");
            lines.add("      if (__i + 1 >= argv.length) { console.error(" + quote("Error: " + flag + " requires a value") + "); process.exit(1); }");
            lines.add("      " + String.format(assign, "argv[++__i]"));
            lines.add("      continue;");
            lines.add("    }");
            lines.add("    if (__arg.startsWith(" + quote(flag + "=") + ")) {");
            lines.add("      " + String.format(assign, "__arg.slice(" + (flag.length() + 1) + ")"));
            lines.add("      continue;");
            lines.add("    }");
        }
        lines.add("    if (__arg.startsWith(\"--\")) { console.error(\"Error: Unknown flag \" + __arg); process.exit(1); }");
        lines.add("    __positionals.push(__arg);");
        lines.add("  }");
        for (CliParamNode f : flags) {
            if (!f.optional() && !f.repeated() && f.defaultValue() == null) {
                lines.add("  if (__flag_" + f.name() + " === undefined) {");
                lines.add("    console.error(" + quote("Error: Missing required flag --" + f.name()) + ");");
                lines.add("    process.exit(1);");
                lines.add("  }");
            }
        }
        for (int i = 0; i < positionals.size(); i++) {
            CliParamNode p = positionals.get(i);
            if (p.optional()) continue;
            lines.add("  if (__positionals.length <= " + i + ") {");
            lines.add("    console.error(" + quote("Error: Missing required argument <" + p.name() + ">") + ");");
            lines.add("    __cli_command_help_" + name + "();");
            lines.add("    process.exit(1);");
            lines.add("  }");
        }
        List<String> args = new ArrayList<>();
        for (CliParamNode p : command.params()) {
            if (p.flag()) {
                args.add("__flag_" + p.name());
                continue;
            }
            int index = positionals.indexOf(p);
            String coerced = "__cli_coerce(__positionals[" + index + "], " + quote(p.type()) + ", " + quote(p.name()) + ")";
            if (p.optional()) {
                String fallback = p.defaultValue() == null ? "undefined" : expression(p.defaultValue());
                args.add("__positionals.length > " + index + " ? " + coerced + " : " + fallback);
            } else {
                args.add(coerced);
            }
        }
        lines.add("  await __cmd_" + name + "(" + String.join(", ", args) + ");");
        lines.add("}");
        return String.join("\n", lines);
    }

    private static String main(CliConfig config, boolean single) {
        List<String> lines = new ArrayList<>();
        lines.add("async function __cli_main(argv) {");
        if (single) {
            String only = config.commands().get(0).name();
            lines.add("  if (argv.includes(\"--help\") || argv.includes(\"-h\")) { __cli_help(); return; }");
            if (config.version() != null) {
                lines.add("  if (argv.includes(\"--version\") || argv.includes(\"-v\")) { console.log(" + quote(config.version()) + "); return; }");
            }
            lines.add("  await __cli_dispatch_" + only + "(argv);");
        } else {
            lines.add("  if (argv.length === 0 || argv[0] === \"--help\" || argv[0] === \"-h\") { __cli_help(); return; }");
            if (config.version() != null) {
                lines.add("  if (argv[0] === \"--version\" || argv[0] === \"-v\") { console.log(" + quote(config.version()) + "); return; }");
            }
            lines.add("  switch (argv[0]) {");
            for (CliCommandNode command : config.commands()) {
                lines.add("    case " + quote(command.name()) + ": await __cli_dispatch_" + command.name() + "(argv.slice(1)); break;");
            }
            lines.add("    default:");
            lines.add("      console.error(\"Error: Unknown command \\\"\" + argv[0] + \"\\\"\");");
            lines.add("      __cli_help();");
            lines.add("      process.exit(1);");
            lines.add("  }");
        }
        lines.add("}");
        return String.join("\n", lines);
    }
}
