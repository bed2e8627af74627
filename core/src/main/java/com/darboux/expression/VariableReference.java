package com.darboux.expression;

/**
 * Expression representing the integration variable.
 *
 * <p>Only a single variable, {@code x}, is recognized. Evaluating this node
 * yields the sample point supplied by the caller.
 */
public final class VariableReference implements Expression {

    /** The only recognized variable identifier. */
    public static final String NAME = "x";

    /**
     * Creates a variable reference node.
     */
    public VariableReference() {
    }

    /**
     * Returns the variable name.
     *
     * @return {@code "x"}
     */
    public String name() {
        return NAME;
    }

    @Override
    public int nodeCount() {
        return 1;
    }

    @Override
    public String toPostfix() {
        return NAME;
    }

    @Override
    public String toString() {
        return NAME;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        return obj instanceof VariableReference;
    }

    @Override
    public int hashCode() {
        return NAME.hashCode();
    }

    // ==================== Factory Methods ====================

    /**
     * Creates a new variable reference node.
     *
     * @return a node owned by the caller
     */
    public static VariableReference create() {
        return new VariableReference();
    }
}
