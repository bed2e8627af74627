package com.darboux.integration;

import com.darboux.evaluation.ExpressionEvaluator;
import com.darboux.evaluation.UnivariateFunction;
import com.darboux.exception.DarbouxException;
import com.darboux.exception.IntegrationCancelledException;
import com.darboux.expression.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadMXBean;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Computes the left-endpoint Riemann sum and the lower and upper Darboux sums
 * of an expression over a uniform partition.
 *
 * <p>All three passes walk the same half-open partition of {@code [start, end)}:
 * <pre>
 *   x = start
 *   while x &lt; end:
 *       sum += sample(x, x + dx) * dx
 *       x += dx
 * </pre>
 * where the sample is the value at {@code x} for the Riemann sum, and the
 * grid minimum or maximum over {@code [x, x + dx]} for the Darboux sums.
 * Because {@code x} is accumulated, rounding can add one extra subinterval at
 * the right boundary; the same happens in all three passes.
 *
 * <p>In parallel mode the passes run on a fixed pool of three daemon threads.
 * The tree is immutable and each pass writes only its own result, so no
 * locking is involved. Call {@link #close()} to release the pool.
 */
public class SummationEngine implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SummationEngine.class);

    private static final ThreadMXBean THREAD_BEAN = ManagementFactory.getThreadMXBean();

    private final ExtremumFinder extremumFinder;
    private final ExecutorService executor;

    /**
     * Creates an engine that runs the passes sequentially on the calling thread.
     *
     * @param extremumFinder the finder used by the Darboux sums
     */
    public SummationEngine(ExtremumFinder extremumFinder) {
        this(extremumFinder, false);
    }

    /**
     * Creates an engine.
     *
     * @param extremumFinder the finder used by the Darboux sums
     * @param parallel whether {@link #sumAll} runs the three passes concurrently
     */
    public SummationEngine(ExtremumFinder extremumFinder, boolean parallel) {
        this.extremumFinder = Objects.requireNonNull(extremumFinder, "extremumFinder must not be null");
        this.executor = parallel ? newSummationPool() : null;
        logger.debug("SummationEngine initialized: parallel={}, extremumStep={}",
            parallel, extremumFinder.defaultStep());
    }

    public boolean isParallel() {
        return executor != null;
    }

    public ExtremumFinder extremumFinder() {
        return extremumFinder;
    }

    public double riemannSum(Expression tree, double start, double end, double dx) {
        return riemannSum(tree, start, end, dx, CancellationToken.create());
    }

    /**
     * Accumulates {@code f(x) * dx} at the left endpoint of every subinterval.
     *
     * @param tree the integrand
     * @param start the lower bound, {@code start < end}
     * @param end the upper bound
     * @param dx the subinterval width
     * @param token checked once per subinterval
     * @return the Riemann sum
     */
    public double riemannSum(Expression tree, double start, double end, double dx,
                             CancellationToken token) {
        validatePartition(tree, start, end, dx);
        UnivariateFunction f = ExpressionEvaluator.asFunction(tree);
        double sum = 0.0;
        double x = start;

        while (x < end) {
            token.throwIfCancelled();
            sum += f.evaluate(x) * dx;
            x += dx;
        }

        return sum;
    }

    public double lowerDarbouxSum(Expression tree, double start, double end, double dx) {
        return lowerDarbouxSum(tree, start, end, dx, CancellationToken.create());
    }

    /**
     * Accumulates the grid minimum of every subinterval times its width.
     */
    public double lowerDarbouxSum(Expression tree, double start, double end, double dx,
                                  CancellationToken token) {
        return darbouxSum(tree, start, end, dx, Extremum.MIN, token);
    }

    public double upperDarbouxSum(Expression tree, double start, double end, double dx) {
        return upperDarbouxSum(tree, start, end, dx, CancellationToken.create());
    }

    /**
     * Accumulates the grid maximum of every subinterval times its width.
     */
    public double upperDarbouxSum(Expression tree, double start, double end, double dx,
                                  CancellationToken token) {
        return darbouxSum(tree, start, end, dx, Extremum.MAX, token);
    }

    /**
     * Runs all three passes over the same partition.
     *
     * @param tree the integrand
     * @param start the lower bound, {@code start < end}
     * @param end the upper bound
     * @param dx the subinterval width
     * @param token checked once per subinterval by every pass
     * @return the raw sums with their timings
     * @throws IntegrationCancelledException if the token is cancelled or the caller is interrupted
     */
    public PartitionSums sumAll(Expression tree, double start, double end, double dx,
                                CancellationToken token) {
        validatePartition(tree, start, end, dx);
        Objects.requireNonNull(token, "token must not be null");

        Map<SummationPass, Callable<TimedValue>> passes = new EnumMap<>(SummationPass.class);
        passes.put(SummationPass.RIEMANN, timed(() -> riemannSum(tree, start, end, dx, token)));
        passes.put(SummationPass.LOWER_DARBOUX, timed(() -> lowerDarbouxSum(tree, start, end, dx, token)));
        passes.put(SummationPass.UPPER_DARBOUX, timed(() -> upperDarbouxSum(tree, start, end, dx, token)));

        SummationTimingStats timing = new SummationTimingStats();
        timing.startTotal();
        Map<SummationPass, TimedValue> results = executor == null
            ? runSequentially(passes)
            : runInParallel(passes, token);
        timing.stopTotal();

        results.forEach((pass, value) -> timing.recordPass(pass, value.nanos()));
        logger.debug("Summation over [{} ; {}) with dx={} finished: {}", start, end, dx, timing.toLogString());

        return new PartitionSums(
            results.get(SummationPass.RIEMANN).value(),
            results.get(SummationPass.LOWER_DARBOUX).value(),
            results.get(SummationPass.UPPER_DARBOUX).value(),
            timing);
    }

    /**
     * Shuts down the worker pool, if any.
     */
    @Override
    public void close() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Summation workers did not terminate gracefully, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private double darbouxSum(Expression tree, double start, double end, double dx,
                              Extremum kind, CancellationToken token) {
        validatePartition(tree, start, end, dx);
        double sum = 0.0;
        double x = start;

        while (x < end) {
            token.throwIfCancelled();
            sum += extremumFinder.extremum(tree, x, x + dx, kind) * dx;
            x += dx;
        }

        return sum;
    }

    private Map<SummationPass, TimedValue> runSequentially(Map<SummationPass, Callable<TimedValue>> passes) {
        Map<SummationPass, TimedValue> results = new EnumMap<>(SummationPass.class);
        for (Map.Entry<SummationPass, Callable<TimedValue>> entry : passes.entrySet()) {
            try {
                results.put(entry.getKey(), entry.getValue().call());
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new DarbouxException(entry.getKey().label() + " failed", e);
            }
        }
        return results;
    }

    private Map<SummationPass, TimedValue> runInParallel(Map<SummationPass, Callable<TimedValue>> passes,
                                                         CancellationToken token) {
        Map<SummationPass, Future<TimedValue>> futures = new EnumMap<>(SummationPass.class);
        passes.forEach((pass, callable) -> futures.put(pass, executor.submit(callable)));

        Map<SummationPass, TimedValue> results = new EnumMap<>(SummationPass.class);
        try {
            for (Map.Entry<SummationPass, Future<TimedValue>> entry : futures.entrySet()) {
                results.put(entry.getKey(), entry.getValue().get());
            }
            return results;
        } catch (InterruptedException e) {
            token.cancel();
            futures.values().forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new IntegrationCancelledException("interrupted while waiting for summation", e);
        } catch (ExecutionException e) {
            token.cancel();
            futures.values().forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new DarbouxException("Summation failed", cause);
        }
    }

    private static Callable<TimedValue> timed(Callable<Double> pass) {
        return () -> {
            long cpuStart = threadTimeNanos();
            double value = pass.call();
            return new TimedValue(value, threadTimeNanos() - cpuStart);
        };
    }

    private static long threadTimeNanos() {
        if (THREAD_BEAN.isCurrentThreadCpuTimeSupported()) {
            long cpu = THREAD_BEAN.getCurrentThreadCpuTime();
            if (cpu >= 0) {
                return cpu;
            }
        }
        return System.nanoTime();
    }

    private static void validatePartition(Expression tree, double start, double end, double dx) {
        Objects.requireNonNull(tree, "Expression tree must not be null");
        if (!(start < end)) {
            throw new IllegalArgumentException("start must be below end, got [" + start + " ; " + end + "]");
        }
        if (!(dx > 0.0) || start + dx == start || end + dx == end) {
            throw new IllegalArgumentException("Subinterval width " + dx + " cannot advance from " + start);
        }
    }

    private static ExecutorService newSummationPool() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(SummationPass.values().length, r -> {
            Thread t = new Thread(r, "darboux-summation-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private record TimedValue(double value, long nanos) {}
}
