package com.darboux.expression;

import com.darboux.functions.MathFunction;
import java.util.Objects;

/**
 * Expression representing a unary function applied to a single argument.
 *
 * <p>Examples:
 * <pre>
 *   x sin          -- sin(x)
 *   x 2 * ln       -- ln(x * 2)
 *   x cos exp      -- exp(cos(x))
 * </pre>
 *
 * @see MathFunction
 */
public final class FunctionCall implements Expression {

    private final MathFunction function;
    private final Expression argument;

    /**
     * Creates a function call.
     *
     * @param function the function to apply
     * @param argument the argument expression
     */
    public FunctionCall(MathFunction function, Expression argument) {
        this.function = Objects.requireNonNull(function, "function must not be null");
        this.argument = Objects.requireNonNull(argument, "argument must not be null");
    }

    /**
     * Returns the applied function.
     *
     * @return the function
     */
    public MathFunction function() {
        return function;
    }

    /**
     * Returns the function name as written in the input.
     *
     * @return the function name
     */
    public String functionName() {
        return function.functionName();
    }

    /**
     * Returns the argument.
     *
     * @return the argument expression
     */
    public Expression argument() {
        return argument;
    }

    @Override
    public int nodeCount() {
        return 1 + argument.nodeCount();
    }

    @Override
    public String toPostfix() {
        return argument.toPostfix() + " " + function.functionName();
    }

    @Override
    public String toString() {
        return function.functionName() + "(" + argument + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) obj;
        return function == that.function &&
               Objects.equals(argument, that.argument);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, argument);
    }

    // ==================== Factory Methods ====================

    public static FunctionCall of(MathFunction function, Expression argument) {
        return new FunctionCall(function, argument);
    }

    public static FunctionCall sin(Expression argument) {
        return new FunctionCall(MathFunction.SIN, argument);
    }

    public static FunctionCall cos(Expression argument) {
        return new FunctionCall(MathFunction.COS, argument);
    }

    public static FunctionCall ln(Expression argument) {
        return new FunctionCall(MathFunction.LN, argument);
    }

    public static FunctionCall exp(Expression argument) {
        return new FunctionCall(MathFunction.EXP, argument);
    }
}
