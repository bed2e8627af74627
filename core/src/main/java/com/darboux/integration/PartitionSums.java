package com.darboux.integration;

/**
 * The three raw sums over one ascending partition, before sign correction.
 *
 * @param riemannSum left-endpoint Riemann sum
 * @param lowerDarbouxSum sum of subinterval minima times width
 * @param upperDarbouxSum sum of subinterval maxima times width
 * @param timing per-pass timings
 */
public record PartitionSums(double riemannSum, double lowerDarbouxSum, double upperDarbouxSum,
                            SummationTimingStats timing) {
}
