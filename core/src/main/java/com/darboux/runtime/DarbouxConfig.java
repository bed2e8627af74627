package com.darboux.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Immutable settings shared by the parser, the summation engine and the
 * console front end.
 *
 * <p>Every setting can be overridden through a system property, read once
 * by {@link #fromSystemProperties()}:
 * <pre>
 *   -Ddarboux.maxIntegrandLength=100
 *   -Ddarboux.minRefinement=1
 *   -Ddarboux.maxRefinement=20000000
 *   -Ddarboux.extremumStep=1e-5
 *   -Ddarboux.maxStackDepth=50
 *   -Ddarboux.parallelSummation=true
 *   -Ddarboux.maxExecutionTimeMs=0
 *   -Ddarboux.historyFile=functions.txt
 * </pre>
 *
 * <p>A property that cannot be parsed, or that holds a value outside its valid
 * range, is ignored with a warning and the default is used instead.
 */
public final class DarbouxConfig {

    private static final Logger logger = LoggerFactory.getLogger(DarbouxConfig.class);

    /** Maximum integrand length in characters */
    public static final int DEFAULT_MAX_INTEGRAND_LENGTH = 100;

    /** Smallest accepted partition count */
    public static final int DEFAULT_MIN_REFINEMENT = 1;

    /** Largest accepted partition count */
    public static final int DEFAULT_MAX_REFINEMENT = 20_000_000;

    /** Sampling step of the extremum search */
    public static final double DEFAULT_EXTREMUM_STEP = 1e-5;

    /** Operand stack capacity of the tree builder */
    public static final int DEFAULT_MAX_STACK_DEPTH = 50;

    /** Zero means no deadline */
    public static final long DEFAULT_MAX_EXECUTION_TIME_MS = 0L;

    public static final String DEFAULT_HISTORY_FILE = "functions.txt";

    static final String PROP_MAX_INTEGRAND_LENGTH = "darboux.maxIntegrandLength";
    static final String PROP_MIN_REFINEMENT = "darboux.minRefinement";
    static final String PROP_MAX_REFINEMENT = "darboux.maxRefinement";
    static final String PROP_EXTREMUM_STEP = "darboux.extremumStep";
    static final String PROP_MAX_STACK_DEPTH = "darboux.maxStackDepth";
    static final String PROP_PARALLEL_SUMMATION = "darboux.parallelSummation";
    static final String PROP_MAX_EXECUTION_TIME_MS = "darboux.maxExecutionTimeMs";
    static final String PROP_HISTORY_FILE = "darboux.historyFile";

    private final int maxIntegrandLength;
    private final int minRefinement;
    private final int maxRefinement;
    private final double extremumStep;
    private final int maxStackDepth;
    private final boolean parallelSummation;
    private final long maxExecutionTimeMs;
    private final Path historyFile;

    private DarbouxConfig(Builder builder) {
        this.maxIntegrandLength = builder.maxIntegrandLength;
        this.minRefinement = builder.minRefinement;
        this.maxRefinement = builder.maxRefinement;
        this.extremumStep = builder.extremumStep;
        this.maxStackDepth = builder.maxStackDepth;
        this.parallelSummation = builder.parallelSummation;
        this.maxExecutionTimeMs = builder.maxExecutionTimeMs;
        this.historyFile = builder.historyFile;
    }

    /**
     * Returns the default configuration.
     *
     * @return a configuration with every setting at its default
     */
    public static DarbouxConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a configuration from the {@code darboux.*} system properties.
     *
     * @return the configuration
     */
    public static DarbouxConfig fromSystemProperties() {
        Builder builder = builder()
            .maxIntegrandLength(positiveInt(PROP_MAX_INTEGRAND_LENGTH, DEFAULT_MAX_INTEGRAND_LENGTH))
            .maxStackDepth(positiveInt(PROP_MAX_STACK_DEPTH, DEFAULT_MAX_STACK_DEPTH))
            .extremumStep(positiveDouble(PROP_EXTREMUM_STEP, DEFAULT_EXTREMUM_STEP))
            .parallelSummation(bool(PROP_PARALLEL_SUMMATION, true))
            .maxExecutionTimeMs(nonNegativeLong(PROP_MAX_EXECUTION_TIME_MS, DEFAULT_MAX_EXECUTION_TIME_MS))
            .historyFile(Paths.get(System.getProperty(PROP_HISTORY_FILE, DEFAULT_HISTORY_FILE)));

        int min = positiveInt(PROP_MIN_REFINEMENT, DEFAULT_MIN_REFINEMENT);
        int max = positiveInt(PROP_MAX_REFINEMENT, DEFAULT_MAX_REFINEMENT);
        if (min > max) {
            logger.warn("Ignoring refinement range [{} ; {}]: minimum exceeds maximum", min, max);
            min = DEFAULT_MIN_REFINEMENT;
            max = DEFAULT_MAX_REFINEMENT;
        }
        return builder.refinementRange(min, max).build();
    }

    public int maxIntegrandLength() {
        return maxIntegrandLength;
    }

    public int minRefinement() {
        return minRefinement;
    }

    public int maxRefinement() {
        return maxRefinement;
    }

    public double extremumStep() {
        return extremumStep;
    }

    public int maxStackDepth() {
        return maxStackDepth;
    }

    public boolean parallelSummation() {
        return parallelSummation;
    }

    public long maxExecutionTimeMs() {
        return maxExecutionTimeMs;
    }

    public Path historyFile() {
        return historyFile;
    }

    @Override
    public String toString() {
        return "DarbouxConfig{" +
               "maxIntegrandLength=" + maxIntegrandLength +
               ", refinement=[" + minRefinement + " ; " + maxRefinement + "]" +
               ", extremumStep=" + extremumStep +
               ", maxStackDepth=" + maxStackDepth +
               ", parallelSummation=" + parallelSummation +
               ", maxExecutionTimeMs=" + maxExecutionTimeMs +
               ", historyFile=" + historyFile +
               '}';
    }

    // ========== Configuration Helpers ==========

    private static int positiveInt(String property, int defaultValue) {
        String value = System.getProperty(property);
        if (value != null) {
            try {
                int parsed = Integer.parseInt(value.trim());
                if (parsed > 0) {
                    return parsed;
                }
            } catch (NumberFormatException e) {
                // fall through to the warning below
            }
            logger.warn("Invalid value '{}' for {}, using default {}", value, property, defaultValue);
        }
        return defaultValue;
    }

    private static long nonNegativeLong(String property, long defaultValue) {
        String value = System.getProperty(property);
        if (value != null) {
            try {
                long parsed = Long.parseLong(value.trim());
                if (parsed >= 0) {
                    return parsed;
                }
            } catch (NumberFormatException e) {
                // fall through to the warning below
            }
            logger.warn("Invalid value '{}' for {}, using default {}", value, property, defaultValue);
        }
        return defaultValue;
    }

    private static double positiveDouble(String property, double defaultValue) {
        String value = System.getProperty(property);
        if (value != null) {
            try {
                double parsed = Double.parseDouble(value.trim());
                if (parsed > 0.0 && Double.isFinite(parsed)) {
                    return parsed;
                }
            } catch (NumberFormatException e) {
                // fall through to the warning below
            }
            logger.warn("Invalid value '{}' for {}, using default {}", value, property, defaultValue);
        }
        return defaultValue;
    }

    private static boolean bool(String property, boolean defaultValue) {
        String value = System.getProperty(property);
        if (value == null) {
            return defaultValue;
        }
        return switch (value.trim().toLowerCase()) {
            case "true" -> true;
            case "false" -> false;
            default -> {
                logger.warn("Invalid value '{}' for {}, using default {}", value, property, defaultValue);
                yield defaultValue;
            }
        };
    }

    /**
     * Builder for {@link DarbouxConfig}. Setters validate eagerly.
     */
    public static final class Builder {
        private int maxIntegrandLength = DEFAULT_MAX_INTEGRAND_LENGTH;
        private int minRefinement = DEFAULT_MIN_REFINEMENT;
        private int maxRefinement = DEFAULT_MAX_REFINEMENT;
        private double extremumStep = DEFAULT_EXTREMUM_STEP;
        private int maxStackDepth = DEFAULT_MAX_STACK_DEPTH;
        private boolean parallelSummation = true;
        private long maxExecutionTimeMs = DEFAULT_MAX_EXECUTION_TIME_MS;
        private Path historyFile = Paths.get(DEFAULT_HISTORY_FILE);

        private Builder() {}

        public Builder maxIntegrandLength(int maxIntegrandLength) {
            if (maxIntegrandLength <= 0) {
                throw new IllegalArgumentException("maxIntegrandLength must be positive");
            }
            this.maxIntegrandLength = maxIntegrandLength;
            return this;
        }

        public Builder refinementRange(int min, int max) {
            if (min <= 0) {
                throw new IllegalArgumentException("minimum refinement must be positive");
            }
            if (max < min) {
                throw new IllegalArgumentException("maximum refinement must not be below the minimum");
            }
            this.minRefinement = min;
            this.maxRefinement = max;
            return this;
        }

        public Builder extremumStep(double extremumStep) {
            if (!(extremumStep > 0.0) || Double.isInfinite(extremumStep)) {
                throw new IllegalArgumentException("Step size must be positive");
            }
            this.extremumStep = extremumStep;
            return this;
        }

        public Builder maxStackDepth(int maxStackDepth) {
            if (maxStackDepth <= 0) {
                throw new IllegalArgumentException("maxStackDepth must be positive");
            }
            this.maxStackDepth = maxStackDepth;
            return this;
        }

        public Builder parallelSummation(boolean parallelSummation) {
            this.parallelSummation = parallelSummation;
            return this;
        }

        public Builder maxExecutionTimeMs(long maxExecutionTimeMs) {
            if (maxExecutionTimeMs < 0) {
                throw new IllegalArgumentException("maxExecutionTimeMs must not be negative");
            }
            this.maxExecutionTimeMs = maxExecutionTimeMs;
            return this;
        }

        public Builder historyFile(Path historyFile) {
            this.historyFile = Objects.requireNonNull(historyFile, "historyFile must not be null");
            return this;
        }

        public DarbouxConfig build() {
            return new DarbouxConfig(this);
        }
    }
}
