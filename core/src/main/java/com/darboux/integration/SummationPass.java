package com.darboux.integration;

/**
 * The three independent accumulation passes over a partition.
 */
public enum SummationPass {
    RIEMANN("Riemann-sum"),
    LOWER_DARBOUX("Lower Darboux-sum"),
    UPPER_DARBOUX("Upper Darboux-sum");

    private final String label;

    SummationPass(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
