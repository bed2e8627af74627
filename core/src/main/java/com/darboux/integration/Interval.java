package com.darboux.integration;

import java.util.Locale;

/**
 * An integration interval as entered, possibly with {@code start > end}.
 *
 * <p>Integrating over a reversed interval is defined as the negated integral
 * over the ascending one, so {@link #normalized()} and {@link #isReversed()}
 * are all the summation code needs.
 *
 * @param start the first bound as entered
 * @param end the second bound as entered
 */
public record Interval(double start, double end) {

    /**
     * Returns whether the bounds are entered in descending order.
     *
     * @return true if {@code start > end}
     */
    public boolean isReversed() {
        return start > end;
    }

    /**
     * Returns whether both bounds are equal.
     *
     * @return true for a {@code [c ; c]} interval
     */
    public boolean isDegenerate() {
        return start == end;
    }

    /**
     * Returns the same interval with ascending bounds.
     *
     * @return this interval, or a swapped copy if it is reversed
     */
    public Interval normalized() {
        return isReversed() ? new Interval(end, start) : this;
    }

    /**
     * Returns the length of the interval.
     *
     * @return {@code |end - start|}
     */
    public double width() {
        return Math.abs(end - start);
    }

    /**
     * Returns the width of one subinterval of a uniform partition.
     *
     * @param refinement the number of subintervals
     * @return the subinterval width
     */
    public double subintervalWidth(int refinement) {
        if (refinement <= 0) {
            throw new IllegalArgumentException("refinement must be positive");
        }
        return width() / refinement;
    }

    /**
     * Renders the interval in the {@code [a ; b]} input format.
     *
     * @return the formatted interval
     */
    @Override
    public String toString() {
        return String.format(Locale.ROOT, "[%s ; %s]", format(start), format(end));
    }

    private static String format(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
