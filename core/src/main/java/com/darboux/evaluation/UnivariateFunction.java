package com.darboux.evaluation;

/**
 * Represents a single-variable real function f(x).
 */
@FunctionalInterface
public interface UnivariateFunction {
    double evaluate(double x);
}
