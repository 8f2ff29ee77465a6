package org.tova.compiler.frontend.semantics;

import org.tova.compiler.api.CompilerErrorCode;
import org.tova.compiler.api.SourceInfo;
import org.tova.compiler.diagnostics.DiagnosticsEngine;
import org.tova.compiler.internal.i18n.Messages;

import java.util.regex.Pattern;

/**
 * Reports names that break the snake_case / PascalCase conventions.
 * Single-character, {@code _}-prefixed and ALL_CAPS names are exempt.
 */
public class NamingConventionChecker {

    private static final Pattern SNAKE = Pattern.compile("[a-z][a-z0-9]*(_[a-z0-9]+)*_?");
    private static final Pattern PASCAL = Pattern.compile("[A-Z][a-zA-Z0-9]*");
    private static final Pattern ALL_CAPS = Pattern.compile("[A-Z][A-Z0-9_]*");

    /** What is being named; decides the expected convention and the label in the message. */
    public enum Subject {
        FUNCTION("Function", false),
        VARIABLE("Variable", false),
        PARAMETER("Parameter", false),
        TYPE("Type", true),
        COMPONENT("Component", true),
        STORE("Store", true);

        private final String label;
        private final boolean pascal;

        Subject(String label, boolean pascal) {
            this.label = label;
            this.pascal = pascal;
        }
    }

    private final boolean enabled;

    /**
     * @param enabled If false, {@link #check} never reports.
     */
    public NamingConventionChecker(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * @param subject What the name denotes.
     * @param name The name.
     * @param loc The declaration site.
     * @param diagnostics Receives the W100 warning.
     */
    public void check(Subject subject, String name, SourceInfo loc, DiagnosticsEngine diagnostics) {
        if (!enabled || isExempt(name)) return;
        if (subject.pascal && !PASCAL.matcher(name).matches()) {
            diagnostics.reportWarning(Messages.get("naming.pascal", subject.label, name), loc, CompilerErrorCode.W100,
                    Messages.get("naming.hint", name, toPascalCase(name)));
        } else if (!subject.pascal && !SNAKE.matcher(name).matches()) {
            diagnostics.reportWarning(Messages.get("naming.snake", subject.label, name), loc, CompilerErrorCode.W100,
                    Messages.get("naming.hint", name, toSnakeCase(name)));
        }
    }

    /**
     * @param name A name.
     * @return {@code true} for single-character, {@code _}-prefixed and ALL_CAPS names.
     */
    public static boolean isExempt(String name) {
        return name.length() <= 1 || name.startsWith("_") || ALL_CAPS.matcher(name).matches();
    }

    /**
     * @param name A camelCase or PascalCase name.
     * @return The snake_case spelling, e.g. {@code fooBar} becomes {@code foo_bar}.
     */
    public static String toSnakeCase(String name) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && name.charAt(i - 1) != '_' && !Character.isUpperCase(name.charAt(i - 1))) sb.append('_');
                sb.append(Character.toLowerCase(c));
            } else if (c == '-') {
                sb.append('_');
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * @param name A snake_case or camelCase name.
     * @return The PascalCase spelling, e.g. {@code my_type} becomes {@code MyType}.
     */
    public static String toPascalCase(String name) {
        StringBuilder sb = new StringBuilder();
        boolean upper = true;
        for (char c : name.toCharArray()) {
            if (c == '_' || c == '-') {
                upper = true;
            } else if (upper) {
                sb.append(Character.toUpperCase(c));
                upper = false;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
