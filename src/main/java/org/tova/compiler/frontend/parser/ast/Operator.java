package org.tova.compiler.frontend.parser.ast;

/**
 * Operator tags shared by binary, logical, unary and compound-assignment nodes.
 * Symbolic and keyword spellings ({@code &&}/{@code and}) map to the same tag.
 */
public enum Operator {
    ADD("+", "+"),
    SUBTRACT("-", "-"),
    MULTIPLY("*", "*"),
    DIVIDE("/", "/"),
    MODULO("%", "%"),
    POWER("**", "**"),
    EQUAL("==", "==="),
    NOT_EQUAL("!=", "!=="),
    LESS("<", "<"),
    LESS_EQUAL("<=", "<="),
    GREATER(">", ">"),
    GREATER_EQUAL(">=", ">="),
    AND("and", "&&"),
    OR("or", "||"),
    NOT("not", "!"),
    NEGATE("-", "-"),
    COALESCE("??", "??");

    private final String symbol;
    private final String js;

    Operator(String symbol, String js) {
        this.symbol = symbol;
        this.js = js;
    }

    /**
     * @return The Tova spelling of the operator.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * @return The JavaScript spelling of the operator.
     */
    public String js() {
        return js;
    }

    /**
     * @return {@code true} for {@code + - * / % **}.
     */
    public boolean isArithmetic() {
        return this == ADD || this == SUBTRACT || this == MULTIPLY || this == DIVIDE || this == MODULO || this == POWER;
    }

    /**
     * @return {@code true} for the ordering and equality comparisons.
     */
    public boolean isComparison() {
        return this == EQUAL || this == NOT_EQUAL || this == LESS || this == LESS_EQUAL
                || this == GREATER || this == GREATER_EQUAL;
    }
}
