package org.tova.compiler.frontend.parser.features.security;

import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * {@code role Admin { can: [manage_users, view_analytics] }}.
 *
 * @param name The role name.
 * @param permissions The granted permissions.
 * @param loc The source location.
 */
public record SecurityRoleNode(String name, List<String> permissions, SourceInfo loc) implements AstNode {
}
