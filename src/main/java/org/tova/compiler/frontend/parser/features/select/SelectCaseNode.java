package org.tova.compiler.frontend.parser.features.select;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * One arm of a {@link SelectNode}.
 *
 * @param kind The arm kind.
 * @param channel The channel for RECEIVE and SEND, otherwise null.
 * @param binding The receiving variable for RECEIVE, otherwise null.
 * @param value The sent value for SEND, the milliseconds for TIMEOUT, otherwise null.
 * @param body The arm body, an expression or a block.
 * @param loc The source location.
 */
public record SelectCaseNode(Kind kind, AstNode channel, String binding, AstNode value, AstNode body, SourceInfo loc)
        implements AstNode {

    /** Arm kinds. */
    public enum Kind { RECEIVE, SEND, TIMEOUT, DEFAULT }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(channel, value, body);
    }
}
