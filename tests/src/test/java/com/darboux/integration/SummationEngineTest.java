package com.darboux.integration;

import com.darboux.exception.IntegrationCancelledException;
import com.darboux.expression.Expression;
import com.darboux.parser.PostfixParser;
import com.darboux.test.TestBase;
import com.darboux.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SummationEngine}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Numerics
@DisplayName("SummationEngine Tests")
public class SummationEngineTest extends TestBase {

    private final PostfixParser parser = new PostfixParser();

    // ==================== Single Pass Tests ====================

    @Nested
    @DisplayName("Single Pass Tests")
    class SinglePassTests {

        private final SummationEngine engine = new SummationEngine(new ExtremumFinder(1e-3));

        @Test
        @DisplayName("Constant integrand sums to constant times width")
        void testConstant() {
            Expression three = parser.parse("3");

            assertThat(engine.riemannSum(three, 0, 1, 0.25)).isEqualTo(3.0);
            assertThat(engine.lowerDarbouxSum(three, 0, 1, 0.25)).isEqualTo(3.0);
            assertThat(engine.upperDarbouxSum(three, 0, 1, 0.25)).isEqualTo(3.0);
        }

        @Test
        @DisplayName("Riemann sum samples the left endpoints")
        void testLeftEndpoints() {
            // 0.5 * (0 + 0.5) for x over [0 ; 1)
            assertThat(engine.riemannSum(parser.parse("x"), 0, 1, 0.5)).isEqualTo(0.25);
        }

        @Test
        @DisplayName("Accumulated rounding can add one subinterval")
        void testAccumulatedStep() {
            // ten additions of 0.1 stay below 1.0, so an eleventh sample is taken
            assertThat(engine.riemannSum(parser.parse("3"), 0, 1, 0.1)).isCloseTo(3.3, within(1e-9));
        }

        @Test
        @DisplayName("Darboux sums bracket the Riemann sum")
        void testBracketing() {
            Expression tree = parser.parse("x sin x 2 ^ +");
            double dx = 0.01;

            double riemann = engine.riemannSum(tree, 0, 2, dx);
            double lower = engine.lowerDarbouxSum(tree, 0, 2, dx);
            double upper = engine.upperDarbouxSum(tree, 0, 2, dx);
            logData("Sums", lower + " <= " + riemann + " <= " + upper);

            assertThat(lower).isLessThanOrEqualTo(riemann);
            assertThat(riemann).isLessThanOrEqualTo(upper);
        }

        @Test
        @DisplayName("Invalid partitions are rejected")
        void testInvalidPartition() {
            Expression x = parser.parse("x");

            assertThatThrownBy(() -> engine.riemannSum(x, 1, 1, 0.1))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> engine.riemannSum(x, 2, 1, 0.1))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> engine.riemannSum(x, 0, 1, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> engine.riemannSum(x, 1e20, 2e20, 1.0))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> engine.riemannSum(null, 0, 1, 0.1))
                .isInstanceOf(NullPointerException.class);
        }

        @Test
        @DisplayName("Cancelled token stops a pass")
        void testCancelledPass() {
            CancellationToken token = CancellationToken.create();
            token.cancel();

            assertThatThrownBy(() -> engine.upperDarbouxSum(parser.parse("x"), 0, 1, 0.1, token))
                .isInstanceOf(IntegrationCancelledException.class)
                .hasMessage("cancelled on request");
        }
    }

    // ==================== All Passes Tests ====================

    @Nested
    @DisplayName("All Passes Tests")
    class AllPassesTests {

        @Test
        @DisplayName("Parallel and sequential passes give identical sums")
        void testParallelMatchesSequential() {
            Expression tree = parser.parse("x exp x cos *");
            PartitionSums sequential;
            PartitionSums parallel;

            try (SummationEngine engine = new SummationEngine(new ExtremumFinder(1e-3), false)) {
                assertThat(engine.isParallel()).isFalse();
                sequential = engine.sumAll(tree, -1, 1, 0.02, CancellationToken.create());
            }
            try (SummationEngine engine = new SummationEngine(new ExtremumFinder(1e-3), true)) {
                assertThat(engine.isParallel()).isTrue();
                parallel = engine.sumAll(tree, -1, 1, 0.02, CancellationToken.create());
            }

            assertThat(parallel.riemannSum()).isEqualTo(sequential.riemannSum());
            assertThat(parallel.lowerDarbouxSum()).isEqualTo(sequential.lowerDarbouxSum());
            assertThat(parallel.upperDarbouxSum()).isEqualTo(sequential.upperDarbouxSum());
        }

        @Test
        @DisplayName("Every pass is timed")
        void testTiming() {
            try (SummationEngine engine = new SummationEngine(new ExtremumFinder(1e-3), true)) {
                PartitionSums sums = engine.sumAll(parser.parse("x"), 0, 1, 0.01, CancellationToken.create());
                SummationTimingStats timing = sums.timing();
                logData("Timing", timing.toLogString());

                for (SummationPass pass : SummationPass.values()) {
                    assertThat(timing.getPassNanos(pass)).isGreaterThanOrEqualTo(0L);
                }
                assertThat(timing.getTotalNanos()).isPositive();
                assertThat(timing.toLogString()).startsWith("riemann=").contains("total=");
            }
        }

        @Test
        @DisplayName("Cancellation surfaces from worker threads")
        void testParallelCancellation() {
            CancellationToken token = CancellationToken.create();
            token.cancel();

            try (SummationEngine engine = new SummationEngine(new ExtremumFinder(1e-3), true)) {
                assertThatThrownBy(() -> engine.sumAll(parser.parse("x"), 0, 1, 0.01, token))
                    .isInstanceOf(IntegrationCancelledException.class);
            }
        }
    }
}
