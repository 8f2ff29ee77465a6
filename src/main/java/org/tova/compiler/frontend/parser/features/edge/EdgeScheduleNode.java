package org.tova.compiler.frontend.parser.features.edge;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.BlockNode;

import java.util.List;

/**
 * {@code schedule "name" cron("expr") { ... }}.
 *
 * @param name The job name.
 * @param cron The cron expression.
 * @param body The job body.
 * @param loc The source location.
 */
public record EdgeScheduleNode(String name, String cron, BlockNode body, SourceInfo loc) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(body);
    }
}
