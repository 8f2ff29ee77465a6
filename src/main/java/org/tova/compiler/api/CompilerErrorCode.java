package org.tova.compiler.api;

/**
 * Stable codes attached to compiler diagnostics.
 * Codes starting with {@code E} are errors, codes starting with {@code W} are warnings.
 */
public enum CompilerErrorCode {

    // region Syntax
    E001("Unexpected token"),
    E002("Unterminated literal"),
    E003("Unsupported keyword"),
    E008("Mismatched JSX tag"),
    E009("Invalid operator"),
    // endregion

    // region Types
    E100("Type mismatch"),
    E101("Return type mismatch"),
    E102("Cannot assign to type"),
    E104("Incompatible operand types"),
    // endregion

    // region Scopes
    E200("Undefined variable"),
    E201("Duplicate definition"),
    E202("Cannot reassign immutable"),
    E203("Duplicate binding"),
    // endregion

    // region Context
    E300("Invalid context: await"),
    E301("Invalid context: return"),
    // endregion

    // region Warnings
    W001("Unused variable"),
    W100("Naming convention violation"),
    W101("Variable shadows outer"),
    W200("Non-exhaustive match"),
    W201("Unreachable code"),
    W204("Potential data loss"),
    W205("Missing return on some paths"),
    W207("Unreachable match arm");
    // endregion

    private final String title;

    CompilerErrorCode(String title) {
        this.title = title;
    }

    /**
     * @return A short human-readable title for the code.
     */
    public String title() {
        return title;
    }

    /**
     * @return {@code true} if diagnostics with this code are errors.
     */
    public boolean isError() {
        return name().startsWith("E");
    }
}
