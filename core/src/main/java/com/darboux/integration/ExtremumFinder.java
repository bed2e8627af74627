package com.darboux.integration;

import com.darboux.evaluation.ExpressionEvaluator;
import com.darboux.evaluation.UnivariateFunction;
import com.darboux.expression.Expression;
import com.darboux.runtime.DarbouxConfig;

import java.util.Objects;

/**
 * Approximates the minimum or maximum of an expression over a closed
 * interval by sampling it on a fixed grid.
 *
 * <p>The scan starts at {@code lo} and advances by {@code step} while the
 * sample point is {@code <= hi}. Peaks narrower than the step can be missed,
 * so the result is a lower bound of the true supremum (or an upper bound of
 * the true infimum), not the exact value.
 */
public final class ExtremumFinder {

    private final double defaultStep;

    /**
     * Creates a finder with the default sampling step.
     */
    public ExtremumFinder() {
        this(DarbouxConfig.DEFAULT_EXTREMUM_STEP);
    }

    /**
     * Creates a finder with the provided sampling step.
     *
     * @param defaultStep step used when none is specified for a call
     */
    public ExtremumFinder(double defaultStep) {
        validateStep(defaultStep);
        this.defaultStep = defaultStep;
    }

    public double defaultStep() {
        return defaultStep;
    }

    public double minimum(Expression tree, double lo, double hi) {
        return extremum(tree, lo, hi, defaultStep, Extremum.MIN);
    }

    public double maximum(Expression tree, double lo, double hi) {
        return extremum(tree, lo, hi, defaultStep, Extremum.MAX);
    }

    public double extremum(Expression tree, double lo, double hi, Extremum kind) {
        return extremum(tree, lo, hi, defaultStep, kind);
    }

    /**
     * Scans {@code [lo, hi]} with the given step.
     *
     * @param tree the expression to sample
     * @param lo the first sample point
     * @param hi the last admissible sample point
     * @param step the distance between samples
     * @param kind whether to look for the minimum or the maximum
     * @return the best sample found; the value at {@code lo} if no later sample beats it
     * @throws NullPointerException if {@code tree} is null
     * @throws IllegalArgumentException if the step is not positive or too small to advance from {@code lo}
     */
    public double extremum(Expression tree, double lo, double hi, double step, Extremum kind) {
        Objects.requireNonNull(tree, "Expression tree must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        validateStep(step);
        if (lo + step == lo || (hi >= lo && hi + step == hi)) {
            throw new IllegalArgumentException("Step " + step + " is too small to scan [" + lo + " ; " + hi + "]");
        }

        UnivariateFunction f = ExpressionEvaluator.asFunction(tree);
        double x = lo;
        double result = f.evaluate(x);

        while (x <= hi) {
            double value = f.evaluate(x);
            if (kind.improves(value, result)) {
                result = value;
            }
            x += step;
        }

        return result;
    }

    private static void validateStep(double step) {
        if (!(step > 0.0) || Double.isInfinite(step)) {
            throw new IllegalArgumentException("Step size must be positive");
        }
    }
}
