package com.darboux.integration;

import com.darboux.exception.IntegrationCancelledException;
import com.darboux.exception.ValidationException;
import com.darboux.parser.PostfixParseException;
import com.darboux.runtime.DarbouxConfig;
import com.darboux.test.TestBase;
import com.darboux.test.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests for {@link Integrator}, from raw text to sign-corrected sums.
 */
@TestCategories.Tier1
@TestCategories.Integration
@TestCategories.Numerics
@DisplayName("Integrator Tests")
public class IntegratorTest extends TestBase {

    private Integrator integrator;

    @BeforeEach
    void setUp() {
        integrator = new Integrator(DarbouxConfig.defaults());
    }

    @AfterEach
    void tearDown() {
        integrator.close();
    }

    // ==================== Numeric Results ====================

    @Nested
    @DisplayName("Numeric Result Tests")
    class NumericResultTests {

        @Test
        @DisplayName("Identity over [0 ; 2] is close to 2")
        void testIdentity() {
            logStep("Integrate x over [0 ; 2] with 1000 subintervals");
            IntegrationResult result = integrator.integrate("x", "[0 ; 2]", 1000);
            logData("Result", result);

            assertThat(result.riemannSum()).isCloseTo(2.0, within(0.01));
            assertThat(result.lowerDarbouxSum()).isCloseTo(2.0, within(0.01));
            assertThat(result.upperDarbouxSum()).isCloseTo(2.0, within(0.01));
            assertThat(result.lowerDarbouxSum()).isLessThanOrEqualTo(result.upperDarbouxSum());
            assertThat(result.darbouxDifference()).isLessThan(0.01);
            assertThat(integrator.lastState()).isEqualTo(IntegrationState.REPORTING);
        }

        @Test
        @DisplayName("Reversed interval negates the sums")
        void testReversed() {
            IntegrationResult forward = integrator.integrate("x 2 ^", "[0 ; 1]", 100);
            IntegrationResult backward = integrator.integrate("x 2 ^", "[1 ; 0]", 100);

            assertThat(backward.negated()).isTrue();
            assertThat(backward.riemannSum()).isEqualTo(-forward.riemannSum());
            assertThat(backward.lowerDarbouxSum()).isEqualTo(-forward.lowerDarbouxSum());
            assertThat(backward.upperDarbouxSum()).isEqualTo(-forward.upperDarbouxSum());
            assertThat(backward.riemannSum()).isCloseTo(-1.0 / 3, within(0.01));
        }

        @Test
        @DisplayName("Sine over a half period is close to 2")
        void testSine() {
            IntegrationResult result = integrator.integrate("x sin", "[0 ; 3.14159265]", 200);

            assertThat(result.riemannSum()).isCloseTo(2.0, within(0.01));
            assertThat(result.lowerDarbouxSum()).isLessThanOrEqualTo(result.riemannSum());
            assertThat(result.riemannSum()).isLessThanOrEqualTo(result.upperDarbouxSum());
        }

        @Test
        @DisplayName("Refinement of one uses a single subinterval")
        void testSingleSubinterval() {
            IntegrationResult result = integrator.integrate("3", "[1 ; 2]", 1);

            assertThat(result.subintervalWidth()).isEqualTo(1.0);
            assertThat(result.riemannSum()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("Domain errors flow into the sums")
        void testDomainErrors() {
            IntegrationResult result = integrator.integrate("x ln", "[-1 ; 1]", 10);

            assertThat(result.isFinite()).isFalse();
            assertThat(result.riemannSum()).isNaN();
        }

        @Test
        @DisplayName("Result is handed to the consumer")
        void testConsumer() {
            List<IntegrationResult> received = new ArrayList<>();

            IntegrationResult result = integrator.integrate(
                new IntegrationRequest("x", "[0 ; 1]", 10), received::add);

            assertThat(received).containsExactly(result);
        }
    }

    // ==================== Rejected Requests ====================

    @Nested
    @DisplayName("Rejected Request Tests")
    class RejectedRequestTests {

        @Test
        @DisplayName("Degenerate interval is rejected before parsing")
        void testDegenerateInterval() {
            assertThatThrownBy(() -> integrator.integrate("x", "[2 ; 2]", 10))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Integrating over a [c ; c] interval is defined to be equal to 0");
            assertThat(integrator.lastState()).isEqualTo(IntegrationState.FAILED);
        }

        @Test
        @DisplayName("Bounds too large for the step are rejected as invalid input")
        void testUnresolvableInterval() {
            ValidationException e = catchThrowableOfType(
                () -> integrator.integrate("x", "[1000000000000 ; 1000000000001]", 10),
                ValidationException.class);

            assertThat(e).isNotNull();
            assertThat(e.getPhase()).isEqualTo("interval validation");
            assertThat(e.getMessage()).contains("too far from 0");
            assertThat(integrator.lastState()).isEqualTo(IntegrationState.FAILED);
        }

        @Test
        @DisplayName("Subinterval width lost to rounding is rejected")
        void testUnresolvableWidth() {
            // 5e-11 is below half an ulp of 1e9
            assertThatThrownBy(() -> integrator.integrate("x", "[1000000000 ; 1000000000.001]", 20_000_000))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("too far from 0");
        }

        @Test
        @DisplayName("Undefined interval is rejected")
        void testUndefinedInterval() {
            assertThatThrownBy(() -> integrator.integrate("x", "[ ; ]", 10))
                .isInstanceOf(ValidationException.class)
                .hasMessage("The interval is not defined");
        }

        @Test
        @DisplayName("Refinement outside the range is rejected, not clamped")
        void testRefinementRange() {
            assertThatThrownBy(() -> integrator.integrate("x", "[0 ; 1]", 0))
                .isInstanceOf(ValidationException.class)
                .hasMessage("The scale of refinement must be between 1 and 20000000");
            assertThatThrownBy(() -> integrator.validateRefinement(20_000_001))
                .isInstanceOf(ValidationException.class);
            assertThat(integrator.validateRefinement(20_000_000)).isEqualTo(20_000_000);
        }

        @Test
        @DisplayName("Too long integrand is rejected")
        void testTooLong() {
            String integrand = "x" + " 1 +".repeat(25);

            assertThat(integrand).hasSizeGreaterThan(100);
            assertThatThrownBy(() -> integrator.integrate(integrand, "[0 ; 1]", 10))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("The integrand is too long");
        }

        @Test
        @DisplayName("Malformed integrand fails in the parsing stage")
        void testMalformedIntegrand() {
            assertThatThrownBy(() -> integrator.integrate("x x", "[0 ; 1]", 10))
                .isInstanceOf(PostfixParseException.class);
            assertThat(integrator.lastState()).isEqualTo(IntegrationState.FAILED);
            assertThat(IntegrationState.FAILED.isFailure()).isTrue();
        }
    }

    @Test
    @TestCategories.Tier2
    @DisplayName("Time limit cancels a long summation")
    void testTimeLimit() {
        DarbouxConfig config = DarbouxConfig.builder()
            .maxExecutionTimeMs(1)
            .parallelSummation(false)
            .build();

        try (Integrator limited = new Integrator(config)) {
            assertThatThrownBy(() -> limited.integrate("x sin x cos *", "[0 ; 1000]", 20_000_000))
                .isInstanceOf(IntegrationCancelledException.class)
                .hasMessage("time limit exceeded");
            assertThat(limited.lastState()).isEqualTo(IntegrationState.FAILED);
        }
    }
}
