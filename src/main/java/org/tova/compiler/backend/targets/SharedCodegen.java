package org.tova.compiler.backend.targets;

import org.tova.compiler.backend.BaseCodegen;
import org.tova.compiler.backend.SourceMapBuilder;
import org.tova.compiler.backend.emit.EmissionContext;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Emits code that runs on every target: shared blocks and top-level statements. Records where each
 * top-level statement starts for the source map.
 */
public class SharedCodegen extends BaseCodegen {

    private final List<SourceMapBuilder.Mapping> mappings = new ArrayList<>();
    private int emittedLines;

    public SharedCodegen(EmissionContext context) {
        super(context);
    }

    /**
     * Emits top-level statements, appending to what this emitter produced before.
     * @param nodes The statements.
     * @return The emitted code.
     */
    public String generate(List<AstNode> nodes) {
        List<String> chunks = new ArrayList<>();
        for (AstNode node : nodes) {
            String code = statement(node);
            if (code.isBlank()) continue;
            if (node.loc() != null) {
                mappings.add(new SourceMapBuilder.Mapping(emittedLines, node.loc().lineNumber(), node.loc().columnNumber()));
            }
            chunks.add(code);
            emittedLines += (int) code.lines().count();
        }
        return String.join("\n", chunks);
    }

    /**
     * @return Mappings relative to the first line this emitter produced.
     */
    public List<SourceMapBuilder.Mapping> getSourceMappings() {
        return Collections.unmodifiableList(mappings);
    }
}
