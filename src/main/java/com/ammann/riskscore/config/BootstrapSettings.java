/* (C)2026 */
package com.ammann.riskscore.config;

import com.ammann.riskscore.exception.ValidationException;

/**
 * Resampling parameters of one bootstrap validation.
 *
 * @param iterations      number of resamples B, at least 1
 * @param skipTolerance   skip rate the run must stay below, in {@code [0, 1)}
 * @param seed            seed of the resampling stream
 * @param confidenceLevel level of the percentile interval, in {@code (0, 1)}
 * @param parallelism     number of worker tasks, at least 1
 */
public record BootstrapSettings(int iterations, double skipTolerance, long seed, double confidenceLevel, int parallelism) {

    public static final int DEFAULT_ITERATIONS = 1000;
    public static final double DEFAULT_SKIP_TOLERANCE = 0.05;
    public static final long DEFAULT_SEED = 42L;
    public static final double DEFAULT_CONFIDENCE_LEVEL = 0.95;
    public static final int DEFAULT_PARALLELISM = 4;

    public BootstrapSettings {
        if (iterations < 1) {
            throw ValidationException.invalidParameter("validation.bootstrap.iterations", iterations, "a value >= 1");
        }
        if (!(skipTolerance >= 0.0 && skipTolerance < 1.0)) {
            throw ValidationException.invalidParameter("validation.bootstrap.skip-tolerance", skipTolerance, "a value in [0, 1)");
        }
        if (!(confidenceLevel > 0.0 && confidenceLevel < 1.0)) {
            throw ValidationException.invalidParameter("validation.bootstrap.confidence-level", confidenceLevel, "a value in (0, 1)");
        }
        if (parallelism < 1) {
            throw ValidationException.invalidParameter("validation.bootstrap.parallelism", parallelism, "a value >= 1");
        }
    }

    public static BootstrapSettings defaults() {
        return new BootstrapSettings(DEFAULT_ITERATIONS, DEFAULT_SKIP_TOLERANCE, DEFAULT_SEED,
                DEFAULT_CONFIDENCE_LEVEL, DEFAULT_PARALLELISM);
    }

    public BootstrapSettings withIterations(int newIterations) {
        return new BootstrapSettings(newIterations, skipTolerance, seed, confidenceLevel, parallelism);
    }

    public BootstrapSettings withSeed(long newSeed) {
        return new BootstrapSettings(iterations, skipTolerance, newSeed, confidenceLevel, parallelism);
    }

    /**
     * Largest number of skipped iterations that keeps the skip rate strictly below the
     * tolerance. A tolerance of 0 allows no skip at all.
     */
    public int maxSkips() {
        int skips = (int) Math.floor(skipTolerance * iterations);
        if ((double) skips / iterations >= skipTolerance) {
            skips--;
        }
        return Math.max(skips, 0);
    }
}
