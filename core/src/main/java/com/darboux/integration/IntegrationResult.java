package com.darboux.integration;

import com.darboux.expression.Expression;

import java.util.Objects;

/**
 * Outcome of one integration: the three sign-corrected sums and the values
 * derived from them.
 *
 * <p>When the interval was entered in descending order every sum is negated,
 * so the "lower" sum is then the larger of the two Darboux sums. Derived
 * values follow the same convention:
 * <ul>
 *   <li>{@link #darbouxDifference()} is {@code |upper - lower|} and never negative</li>
 *   <li>{@link #darbouxAverage()} is {@code (upper + lower) / 2} of the corrected sums</li>
 *   <li>{@link #riemannDeviation()} is {@code |average - riemann|}</li>
 * </ul>
 *
 * <p>NaN and infinite sums are kept as they are; see {@link #isFinite()}.
 */
public final class IntegrationResult {

    private final Expression integrand;
    private final Interval interval;
    private final int refinement;
    private final double subintervalWidth;
    private final double riemannSum;
    private final double lowerDarbouxSum;
    private final double upperDarbouxSum;
    private final SummationTimingStats timing;

    /**
     * Creates a result from raw sums, applying the sign correction.
     *
     * @param integrand the parsed integrand
     * @param interval the interval as entered
     * @param refinement the number of subintervals
     * @param sums the raw sums over the ascending interval
     * @return the corrected result
     */
    public static IntegrationResult of(Expression integrand, Interval interval, int refinement,
                                       PartitionSums sums) {
        double sign = interval.isReversed() ? -1.0 : 1.0;
        return new IntegrationResult(integrand, interval, refinement,
            interval.subintervalWidth(refinement),
            sign * sums.riemannSum(),
            sign * sums.lowerDarbouxSum(),
            sign * sums.upperDarbouxSum(),
            sums.timing());
    }

    private IntegrationResult(Expression integrand, Interval interval, int refinement,
                              double subintervalWidth, double riemannSum,
                              double lowerDarbouxSum, double upperDarbouxSum,
                              SummationTimingStats timing) {
        this.integrand = Objects.requireNonNull(integrand, "integrand must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        this.refinement = refinement;
        this.subintervalWidth = subintervalWidth;
        this.riemannSum = riemannSum;
        this.lowerDarbouxSum = lowerDarbouxSum;
        this.upperDarbouxSum = upperDarbouxSum;
        this.timing = Objects.requireNonNull(timing, "timing must not be null");
    }

    public Expression integrand() {
        return integrand;
    }

    public Interval interval() {
        return interval;
    }

    public int refinement() {
        return refinement;
    }

    public double subintervalWidth() {
        return subintervalWidth;
    }

    public boolean negated() {
        return interval.isReversed();
    }

    public double riemannSum() {
        return riemannSum;
    }

    public double lowerDarbouxSum() {
        return lowerDarbouxSum;
    }

    public double upperDarbouxSum() {
        return upperDarbouxSum;
    }

    public double get(SummationPass pass) {
        switch (pass) {
            case RIEMANN:
                return riemannSum;
            case LOWER_DARBOUX:
                return lowerDarbouxSum;
            case UPPER_DARBOUX:
                return upperDarbouxSum;
            default:
                throw new IllegalArgumentException("Unknown pass: " + pass);
        }
    }

    public double darbouxDifference() {
        return Math.abs(upperDarbouxSum - lowerDarbouxSum);
    }

    public double darbouxAverage() {
        return (upperDarbouxSum + lowerDarbouxSum) / 2;
    }

    public double riemannDeviation() {
        return Math.abs(darbouxAverage() - riemannSum);
    }

    /**
     * Returns whether all three sums are finite numbers.
     *
     * @return false if any sum is NaN or infinite
     */
    public boolean isFinite() {
        return Double.isFinite(riemannSum) &&
               Double.isFinite(lowerDarbouxSum) &&
               Double.isFinite(upperDarbouxSum);
    }

    public SummationTimingStats timing() {
        return timing;
    }

    @Override
    public String toString() {
        return "IntegrationResult{" +
               "integrand=" + integrand.toPostfix() +
               ", interval=" + interval +
               ", refinement=" + refinement +
               ", riemann=" + riemannSum +
               ", lower=" + lowerDarbouxSum +
               ", upper=" + upperDarbouxSum +
               '}';
    }
}
