package com.darboux.expression;

/**
 * Expression representing a numeric constant.
 *
 * <p>Examples in postfix input:
 * <pre>
 *   5          -- integer literal
 *   3.14       -- decimal literal
 *   1e-3       -- scientific notation
 * </pre>
 */
public final class NumberLiteral implements Expression {

    private final double value;

    /**
     * Creates a numeric literal.
     *
     * @param value the literal value
     */
    public NumberLiteral(double value) {
        this.value = value;
    }

    /**
     * Returns the literal value.
     *
     * @return the value
     */
    public double value() {
        return value;
    }

    @Override
    public int nodeCount() {
        return 1;
    }

    @Override
    public String toPostfix() {
        boolean negativeZero = Double.doubleToRawLongBits(value) == Double.doubleToRawLongBits(-0.0);
        if (!negativeZero && value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    @Override
    public String toString() {
        return toPostfix();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof NumberLiteral)) return false;
        NumberLiteral that = (NumberLiteral) obj;
        return Double.compare(value, that.value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    // ==================== Factory Methods ====================

    /**
     * Creates a numeric literal.
     *
     * @param value the value
     * @return the literal expression
     */
    public static NumberLiteral of(double value) {
        return new NumberLiteral(value);
    }
}
