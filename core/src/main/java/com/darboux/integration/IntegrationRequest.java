package com.darboux.integration;

import java.util.Objects;

/**
 * The three inputs of one integration: the postfix integrand, the interval
 * text and the partition count.
 *
 * @param integrand space-separated postfix tokens
 * @param interval interval text in the {@code [start ; end]} format
 * @param refinement number of subintervals
 */
public record IntegrationRequest(String integrand, String interval, int refinement) {

    public IntegrationRequest {
        Objects.requireNonNull(integrand, "integrand must not be null");
        Objects.requireNonNull(interval, "interval must not be null");
    }
}
