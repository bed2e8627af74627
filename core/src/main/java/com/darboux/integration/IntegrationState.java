package com.darboux.integration;

/**
 * Stages of one integration request.
 *
 * <pre>
 *   VALIDATING -&gt; PARSING -&gt; PARTITIONING -&gt; SUMMING -&gt; REPORTING
 *        \            \            \              \
 *         +------------+------------+--------------+--&gt; FAILED
 * </pre>
 */
public enum IntegrationState {
    VALIDATING,
    PARSING,
    PARTITIONING,
    SUMMING,
    REPORTING,
    FAILED;

    public boolean isFailure() {
        return this == FAILED;
    }
}
