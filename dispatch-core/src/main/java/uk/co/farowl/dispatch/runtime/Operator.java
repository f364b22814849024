// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime;

/**
 * The operators a {@link Operation.BinaryOp} or
 * {@link Operation.UnaryOp} may apply. A host class declares its own
 * implementation of an operator with a static method annotated
 * {@link Exposed.OperatorMethod}. Values of primitive shape have
 * built-in implementations following Java binary numeric promotion.
 */
public enum Operator {

    /** {@code v + w} (and string concatenation) */
    ADD("+", true),
    /** {@code v - w} */
    SUBTRACT("-", true),
    /** {@code v * w} */
    MULTIPLY("*", true),
    /** {@code v / w} */
    DIVIDE("/", true),
    /** {@code v % w} */
    MODULO("%", true),
    /** {@code v & w} */
    AND("&", true),
    /** {@code v | w} */
    OR("|", true),
    /** {@code v ^ w} */
    XOR("^", true),
    /** {@code v << w} */
    LEFT_SHIFT("<<", true),
    /** {@code v >> w} */
    RIGHT_SHIFT(">>", true),
    /** {@code v == w} (null tolerant) */
    EQUAL("==", true),
    /** {@code v != w} (null tolerant) */
    NOT_EQUAL("!=", true),
    /** {@code v < w} */
    LESS_THAN("<", true),
    /** {@code v <= w} */
    LESS_EQUAL("<=", true),
    /** {@code v > w} */
    GREATER_THAN(">", true),
    /** {@code v >= w} */
    GREATER_EQUAL(">=", true),
    /** {@code v ?? w}: {@code v} unless it is null, then {@code w}. */
    COALESCE("??", true),

    /** {@code -v} */
    NEGATE("-", false),
    /** {@code +v} */
    PLUS("+", false),
    /** {@code !v} */
    NOT("!", false),
    /** {@code ~v} */
    COMPLEMENT("~", false);

    /** Symbol used in messages. */
    public final String symbol;
    private final boolean binary;

    Operator(String symbol, boolean binary) {
        this.symbol = symbol;
        this.binary = binary;
    }

    /** @return whether this is a binary (two operand) operator. */
    public boolean isBinary() { return binary; }

    /**
     * Whether a null operand is acceptable to this operator. Only
     * equality and the null-coalescing operator bind when an operand
     * is null: every other operator fails to bind with
     * {@link DispatchError.Kind#NULL_RECEIVER}.
     *
     * @return whether null operands are tolerated
     */
    public boolean isNullTolerant() {
        return this == EQUAL || this == NOT_EQUAL || this == COALESCE;
    }

    /** @return whether this is a comparison yielding a boolean. */
    public boolean isComparison() {
        switch (this) {
            case EQUAL:
            case NOT_EQUAL:
            case LESS_THAN:
            case LESS_EQUAL:
            case GREATER_THAN:
            case GREATER_EQUAL:
                return true;
            default:
                return false;
        }
    }

    @Override
    public String toString() { return "operator " + symbol; }
}
