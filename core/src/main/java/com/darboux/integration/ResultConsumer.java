package com.darboux.integration;

/**
 * Receives the result of a successful integration, e.g. to print it.
 */
@FunctionalInterface
public interface ResultConsumer {
    void accept(IntegrationResult result);
}
