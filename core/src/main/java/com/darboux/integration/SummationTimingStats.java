package com.darboux.integration;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Timing statistics collector for the summation passes.
 *
 * <p>Tracks, per pass, the CPU time of the thread that ran it (wall-clock
 * time where the JVM does not support thread CPU time), plus the wall-clock
 * time of the whole summation.
 *
 * <p>Usage:
 * <pre>{@code
 * SummationTimingStats timing = new SummationTimingStats();
 * timing.startTotal();
 * // ... run the passes, calling timing.recordPass(pass, nanos) ...
 * timing.stopTotal();
 * logger.info("Summation timing: {}", timing.toLogString());
 * }</pre>
 */
public class SummationTimingStats {

    private final Map<SummationPass, Long> passNanos = new EnumMap<>(SummationPass.class);

    private long totalStartNanos;
    private long totalNanos;

    public void startTotal() {
        totalStartNanos = System.nanoTime();
    }

    public void stopTotal() {
        totalNanos = System.nanoTime() - totalStartNanos;
    }

    public void recordPass(SummationPass pass, long nanos) {
        passNanos.put(pass, nanos);
    }

    public long getPassNanos(SummationPass pass) {
        return passNanos.getOrDefault(pass, 0L);
    }

    public double getPassMillis(SummationPass pass) {
        return getPassNanos(pass) / 1_000_000.0;
    }

    public long getTotalNanos() {
        return totalNanos;
    }

    public double getTotalMillis() {
        return totalNanos / 1_000_000.0;
    }

    /**
     * Format timing for a single log line.
     *
     * @return e.g. {@code "riemann=1.2ms, lower=40.0ms, upper=41.3ms, total=42.0ms"}
     */
    public String toLogString() {
        return String.format(Locale.ROOT, "riemann=%.1fms, lower=%.1fms, upper=%.1fms, total=%.1fms",
            getPassMillis(SummationPass.RIEMANN),
            getPassMillis(SummationPass.LOWER_DARBOUX),
            getPassMillis(SummationPass.UPPER_DARBOUX),
            getTotalMillis());
    }

    @Override
    public String toString() {
        return toLogString();
    }
}
