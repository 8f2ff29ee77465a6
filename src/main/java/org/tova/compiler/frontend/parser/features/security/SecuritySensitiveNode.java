package org.tova.compiler.frontend.parser.features.security;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;
import org.tova.compiler.frontend.parser.ast.ConfigFieldNode;

import java.util.List;

/**
 * {@code sensitive User.password { hash: "bcrypt", never_expose: true }}.
 *
 * @param typeName The record type.
 * @param field The field.
 * @param config Handling rules.
 * @param loc The source location.
 */
public record SecuritySensitiveNode(String typeName, String field, List<ConfigFieldNode> config, SourceInfo loc)
        implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(config);
    }
}
