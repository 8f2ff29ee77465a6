package org.tova.compiler.frontend.parser.ast;

import org.tova.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 */
public interface AstNode {

    /**
     * @return The source location where this node starts.
     */
    SourceInfo loc();

    /**
     * Returns a list of the direct child nodes.
     * This allows a generic TreeWalker to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Collects child nodes in order. Accepts single nodes and collections of nodes; {@code null}s are skipped.
     *
     * @param parts Nodes or collections of nodes.
     * @return The flattened, null-free list.
     */
    static List<AstNode> children(Object... parts) {
        List<AstNode> result = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof AstNode node) {
                result.add(node);
            } else if (part instanceof Collection<?> collection) {
                for (Object element : collection) {
                    if (element instanceof AstNode node) result.add(node);
                }
            }
        }
        return result;
    }
}
