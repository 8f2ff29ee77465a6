package org.tova.compiler.backend.emit.features;

import org.tova.compiler.backend.BaseCodegen;
import org.tova.compiler.backend.emit.IEmissionRule;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.BlockNode;
import org.tova.compiler.frontend.parser.features.select.SelectCaseNode;
import org.tova.compiler.frontend.parser.features.select.SelectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers {@code select} to one awaited {@code __select} call over the channel arms, followed by a
 * switch on the index of the arm that fired. The default arm has index {@code -1}.
 */
public class SelectEmissionRule implements IEmissionRule<SelectNode> {

    @Override
    public String emit(SelectNode node, BaseCodegen gen) {
        gen.context().use("__select");
        String indent = gen.indent();
        int id = gen.uid();
        String index = "__sel" + id;
        String value = "__selv" + id;

        List<String> arms = new ArrayList<>();
        List<SelectCaseNode> armCases = new ArrayList<>();
        SelectCaseNode fallback = null;
        for (SelectCaseNode c : node.cases()) {
            switch (c.kind()) {
                case RECEIVE -> arms.add("{ kind: \"receive\", channel: " + gen.expression(c.channel()) + " }");
                case SEND -> arms.add("{ kind: \"send\", channel: " + gen.expression(c.channel())
                        + ", value: " + gen.expression(c.value()) + " }");
                case TIMEOUT -> arms.add("{ kind: \"timeout\", ms: " + gen.expression(c.value()) + " }");
                case DEFAULT -> fallback = c;
            }
            if (c.kind() != SelectCaseNode.Kind.DEFAULT) armCases.add(c);
        }

        StringBuilder out = new StringBuilder();
        out.append(indent).append("const [").append(index).append(", ").append(value).append("] = await __select([")
                .append(String.join(", ", arms)).append("], ").append(fallback != null).append(");\n");
        out.append(indent).append("switch (").append(index).append(") {\n");
        String caseIndent = gen.nested(gen::indent);
        for (int i = 0; i < armCases.size(); i++) {
            out.append(caseIndent).append("case ").append(i).append(": {\n")
                    .append(caseBody(armCases.get(i), value, gen)).append("\n")
                    .append(caseIndent).append("}\n");
        }
        if (fallback != null) {
            out.append(caseIndent).append("default: {\n").append(caseBody(fallback, value, gen)).append("\n")
                    .append(caseIndent).append("}\n");
        }
        return out.append(indent).append("}").toString();
    }

    private String caseBody(SelectCaseNode c, String value, BaseCodegen gen) {
        return gen.nested(() -> gen.nested(() -> {
            List<String> lines = new ArrayList<>();
            if (c.kind() == SelectCaseNode.Kind.RECEIVE && c.binding() != null && !c.binding().equals("_")) {
                gen.declare(c.binding(), false);
                lines.add(gen.indent() + "const " + c.binding() + " = " + value + ";");
            }
            AstNode body = c.body();
            String code = body instanceof BlockNode block ? gen.statements(block.statements()) : gen.statement(body);
            if (!code.isBlank()) lines.add(code);
            lines.add(gen.indent() + "break;");
            return String.join("\n", lines);
        }));
    }
}
