package com.darboux.history;

import com.darboux.integration.IntegrationRequest;

import java.util.Objects;

/**
 * One saved integrand with the interval it was integrated over.
 *
 * @param integrand the postfix integrand line
 * @param interval the interval line, {@code [start ; end]}
 */
public record HistoryEntry(String integrand, String interval) {

    public HistoryEntry {
        Objects.requireNonNull(integrand, "integrand must not be null");
        Objects.requireNonNull(interval, "interval must not be null");
    }

    /**
     * Builds a request for this entry.
     *
     * @param refinement the number of subintervals
     * @return the request
     */
    public IntegrationRequest toRequest(int refinement) {
        return new IntegrationRequest(integrand, interval, refinement);
    }
}
