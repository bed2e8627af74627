package com.darboux.integration;

import com.darboux.exception.DarbouxException;
import com.darboux.exception.ValidationException;
import com.darboux.expression.Expression;
import com.darboux.parser.PostfixParser;
import com.darboux.parser.PostfixTokenizer;
import com.darboux.runtime.DarbouxConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs one integration request from raw text to sign-corrected sums.
 *
 * <p>Stages (see {@link IntegrationState}):
 * <ol>
 *   <li>Validate the integrand length, the interval and the refinement</li>
 *   <li>Build the expression tree</li>
 *   <li>Swap descending bounds and remember to negate the result</li>
 *   <li>Run the Riemann and both Darboux passes over the partition</li>
 *   <li>Negate the sums if needed and hand the result to the consumer</li>
 * </ol>
 *
 * <p>Validation and grammar errors abort only the current request: a
 * {@link ValidationException} or
 * {@link com.darboux.parser.PostfixParseException} is thrown and nothing is
 * computed. Numeric-domain problems are not errors; NaN and infinite samples
 * flow into the sums.
 *
 * <p>Example usage:
 * <pre>
 *   try (Integrator integrator = new Integrator(DarbouxConfig.defaults())) {
 *       IntegrationResult result = integrator.integrate("x", "[0 ; 2]", 1000);
 *       System.out.println(result.riemannSum());
 *   }
 * </pre>
 */
public class Integrator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Integrator.class);

    private final DarbouxConfig config;
    private final PostfixParser parser;
    private final SummationEngine summationEngine;

    private volatile IntegrationState lastState;

    /**
     * Creates an integrator with settings read from system properties.
     */
    public Integrator() {
        this(DarbouxConfig.fromSystemProperties());
    }

    /**
     * Creates an integrator.
     *
     * @param config the settings
     */
    public Integrator(DarbouxConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.parser = new PostfixParser(config);
        this.summationEngine = new SummationEngine(
            new ExtremumFinder(config.extremumStep()), config.parallelSummation());
        logger.info("Integrator initialized: {}", config);
    }

    public DarbouxConfig config() {
        return config;
    }

    /**
     * Returns the last stage reached by the most recent request.
     *
     * @return the state, or null if no request has run yet
     */
    public IntegrationState lastState() {
        return lastState;
    }

    public IntegrationResult integrate(String integrand, String interval, int refinement) {
        return integrate(new IntegrationRequest(integrand, interval, refinement));
    }

    public IntegrationResult integrate(IntegrationRequest request) {
        return integrate(request, result -> { });
    }

    /**
     * Integrates and hands the result to a consumer.
     *
     * @param request the request
     * @param consumer receives the result when all sums are available
     * @return the result passed to the consumer
     * @throws ValidationException if an input is rejected
     * @throws com.darboux.parser.PostfixParseException if the integrand is not well-formed postfix
     * @throws com.darboux.exception.IntegrationCancelledException if the time limit is exceeded
     */
    public IntegrationResult integrate(IntegrationRequest request, ResultConsumer consumer) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(consumer, "consumer must not be null");

        try {
            transition(IntegrationState.VALIDATING);
            String integrand = PostfixTokenizer.normalize(request.integrand());
            PostfixTokenizer.requireWithinLength(integrand, config.maxIntegrandLength());
            Interval interval = IntervalParser.parse(request.interval());
            int refinement = validateRefinement(request.refinement());
            requireResolvable(interval, refinement);

            transition(IntegrationState.PARSING);
            Expression tree = parser.parse(integrand);

            transition(IntegrationState.PARTITIONING);
            Interval ascending = interval.normalized();
            double dx = (ascending.end() - ascending.start()) / refinement;
            logger.debug("Partitioning {} into {} subintervals of width {} (reversed={})",
                ascending, refinement, dx, interval.isReversed());

            transition(IntegrationState.SUMMING);
            CancellationToken token = CancellationToken.withTimeout(config.maxExecutionTimeMs());
            PartitionSums sums = summationEngine.sumAll(tree, ascending.start(), ascending.end(), dx, token);

            transition(IntegrationState.REPORTING);
            IntegrationResult result = IntegrationResult.of(tree, interval, refinement, sums);
            if (!result.isFinite()) {
                logger.debug("Integration of '{}' produced non-finite sums", integrand);
            }
            logger.info("Integrated '{}' over {} (n={}): riemann={}, lower={}, upper={} [{}]",
                integrand, interval, refinement, result.riemannSum(), result.lowerDarbouxSum(),
                result.upperDarbouxSum(), sums.timing().toLogString());
            consumer.accept(result);
            return result;
        } catch (DarbouxException e) {
            logger.warn("Integration request rejected in state {}: {}", lastState, e.getMessage());
            transition(IntegrationState.FAILED);
            throw e;
        } catch (RuntimeException e) {
            transition(IntegrationState.FAILED);
            throw e;
        }
    }

    /**
     * Checks a partition count against the configured range.
     *
     * @param refinement the requested number of subintervals
     * @return the same value
     * @throws ValidationException if out of range; values are never clamped
     */
    public int validateRefinement(int refinement) {
        if (refinement < config.minRefinement() || refinement > config.maxRefinement()) {
            throw new ValidationException(
                "The scale of refinement must be between " + config.minRefinement() +
                    " and " + config.maxRefinement(),
                "refinement validation",
                Integer.toString(refinement),
                "Enter a whole number in [" + config.minRefinement() + " ; " + config.maxRefinement() + "]");
        }
        return refinement;
    }

    /**
     * Checks that the subinterval width and the extremum step still move
     * {@code x} at both bounds. Bounds of a large magnitude absorb a small
     * increment, so the partition or the scan could not advance.
     *
     * @param interval the parsed interval
     * @param refinement the validated number of subintervals
     * @throws ValidationException if an increment is lost to rounding
     */
    private void requireResolvable(Interval interval, int refinement) {
        Interval ascending = interval.normalized();
        double dx = interval.subintervalWidth(refinement);
        double step = config.extremumStep();
        if (absorbs(ascending.start(), dx) || absorbs(ascending.end(), dx)
                || absorbs(ascending.start(), step) || absorbs(ascending.end(), step)) {
            throw new ValidationException(
                "The interval " + interval + " is too far from 0 for its width",
                "interval validation",
                interval.toString(),
                "Use bounds of a smaller magnitude, a wider interval or a smaller refinement");
        }
    }

    private static boolean absorbs(double bound, double increment) {
        return bound + increment == bound;
    }

    /**
     * Releases the summation workers.
     */
    @Override
    public void close() {
        summationEngine.close();
    }

    private void transition(IntegrationState next) {
        logger.debug("Integration state {} -> {}", lastState, next);
        lastState = next;
    }
}
