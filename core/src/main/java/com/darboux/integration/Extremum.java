package com.darboux.integration;

/**
 * Which extremum a scan looks for.
 */
public enum Extremum {
    MIN,
    MAX;

    /**
     * Tells whether a sample replaces the running extremum.
     *
     * <p>Comparisons are strict, so NaN samples never replace a value.
     *
     * @param candidate the new sample
     * @param current the running extremum
     * @return true if {@code candidate} is strictly better
     */
    public boolean improves(double candidate, double current) {
        return this == MIN ? candidate < current : candidate > current;
    }
}
