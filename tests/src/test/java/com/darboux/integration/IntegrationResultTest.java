package com.darboux.integration;

import com.darboux.expression.VariableReference;
import com.darboux.test.TestBase;
import com.darboux.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the sign correction and derived values of {@link IntegrationResult}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("IntegrationResult Tests")
public class IntegrationResultTest extends TestBase {

    private static PartitionSums sums(double riemann, double lower, double upper) {
        return new PartitionSums(riemann, lower, upper, new SummationTimingStats());
    }

    @Test
    @DisplayName("Ascending interval keeps the raw sums")
    void testAscending() {
        IntegrationResult result = IntegrationResult.of(
            VariableReference.create(), new Interval(0, 2), 4, sums(1.0, 0.5, 2.0));

        assertThat(result.negated()).isFalse();
        assertThat(result.riemannSum()).isEqualTo(1.0);
        assertThat(result.get(SummationPass.LOWER_DARBOUX)).isEqualTo(0.5);
        assertThat(result.get(SummationPass.UPPER_DARBOUX)).isEqualTo(2.0);
        assertThat(result.subintervalWidth()).isEqualTo(0.5);
        assertThat(result.darbouxDifference()).isEqualTo(1.5);
        assertThat(result.darbouxAverage()).isEqualTo(1.25);
        assertThat(result.riemannDeviation()).isEqualTo(0.25);
    }

    @Test
    @DisplayName("Descending interval negates every sum")
    void testDescending() {
        IntegrationResult result = IntegrationResult.of(
            VariableReference.create(), new Interval(2, 0), 4, sums(1.0, 0.5, 2.0));

        assertThat(result.negated()).isTrue();
        assertThat(result.riemannSum()).isEqualTo(-1.0);
        assertThat(result.lowerDarbouxSum()).isEqualTo(-0.5);
        assertThat(result.upperDarbouxSum()).isEqualTo(-2.0);
        assertThat(result.darbouxDifference()).isEqualTo(1.5);
        assertThat(result.darbouxAverage()).isEqualTo(-1.25);
        assertThat(result.riemannDeviation()).isEqualTo(0.25);
    }

    @Test
    @DisplayName("Non-finite sums are kept and flagged")
    void testNonFinite() {
        IntegrationResult result = IntegrationResult.of(
            VariableReference.create(), new Interval(0, 1), 1, sums(Double.NaN, 0.0, Double.POSITIVE_INFINITY));

        assertThat(result.isFinite()).isFalse();
        assertThat(result.riemannSum()).isNaN();
        assertThat(result.upperDarbouxSum()).isInfinite();
    }
}
