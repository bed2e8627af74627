package com.darboux.functions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.DoubleUnaryOperator;

/**
 * The fixed set of unary real functions an integrand may use.
 *
 * <p>Function names are resolved once, while the tree is built, through
 * {@link #fromName(String)}. Names are case-sensitive and follow the
 * notation of the input keypad: {@code tg} and {@code ctg} for tangent and
 * cotangent, {@code ln} for the natural logarithm.
 *
 * <p>No domain checking is done. {@code ln} of a non-positive number or
 * {@code tg} at a pole yields NaN or an infinity, exactly as {@link Math} does.
 */
public enum MathFunction {
    SIN("sin", "sine", Math::sin),
    COS("cos", "cosine", Math::cos),
    TAN("tg", "tangent", Math::tan),
    COT("ctg", "cotangent", v -> 1.0 / Math.tan(v)),
    LN("ln", "natural logarithm", Math::log),
    EXP("exp", "exponential", Math::exp);

    /** Longest accepted function name, in characters. */
    public static final int MAX_NAME_LENGTH = 10;

    private static final Map<String, MathFunction> BY_NAME;

    static {
        Map<String, MathFunction> byName = new LinkedHashMap<>();
        for (MathFunction function : values()) {
            byName.put(function.functionName, function);
        }
        BY_NAME = Collections.unmodifiableMap(byName);
    }

    private final String functionName;
    private final String description;
    private final DoubleUnaryOperator operation;

    MathFunction(String functionName, String description, DoubleUnaryOperator operation) {
        this.functionName = functionName;
        this.description = description;
        this.operation = operation;
    }

    public String functionName() {
        return functionName;
    }

    public String description() {
        return description;
    }

    /**
     * Applies the function to a value.
     *
     * @param value the argument
     * @return the function value, possibly NaN or infinite
     */
    public double apply(double value) {
        return operation.applyAsDouble(value);
    }

    /**
     * Looks up a function by its token.
     *
     * @param name the token, e.g. {@code "ctg"}
     * @return the function, or empty if the token is not a function name
     */
    public static Optional<MathFunction> fromName(String name) {
        if (name == null || name.isEmpty() || name.length() > MAX_NAME_LENGTH) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name));
    }

    /**
     * Returns all accepted function names in declaration order.
     *
     * @return the names, unmodifiable
     */
    public static Set<String> names() {
        return BY_NAME.keySet();
    }
}
