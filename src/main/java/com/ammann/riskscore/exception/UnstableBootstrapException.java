/* (C)2026 */
package com.ammann.riskscore.exception;

import java.util.Map;

/**
 * Raised when the fraction of skipped bootstrap iterations exceeds the configured
 * tolerance, which means the cohort is too small or the outcome too rare for reliable
 * bootstrap inference. Fatal to the whole validation run.
 *
 * <p>Carries the diagnostic counts accumulated until the run was stopped.
 */
public class UnstableBootstrapException extends RiskScoreException
{
    private final String metric;
    private final int iterationsRequested;
    private final int iterationsAttempted;
    private final int iterationsSkipped;
    private final double tolerance;
    private final Map<String, Long> skipReasons;

    public UnstableBootstrapException(String metric,
                                      int iterationsRequested,
                                      int iterationsAttempted,
                                      int iterationsSkipped,
                                      double tolerance,
                                      Map<String, Long> skipReasons)
    {
        super(String.format(
                "Bootstrap validation of %s is unstable: %d of %d attempted iterations skipped "
                        + "(%d requested, tolerance %.1f%%), reasons %s",
                metric, iterationsSkipped, iterationsAttempted, iterationsRequested,
                tolerance * 100.0, skipReasons));
        this.metric = metric;
        this.iterationsRequested = iterationsRequested;
        this.iterationsAttempted = iterationsAttempted;
        this.iterationsSkipped = iterationsSkipped;
        this.tolerance = tolerance;
        this.skipReasons = Map.copyOf(skipReasons);
    }

    public String getMetric()
    {
        return metric;
    }

    public int getIterationsRequested()
    {
        return iterationsRequested;
    }

    public int getIterationsAttempted()
    {
        return iterationsAttempted;
    }

    public int getIterationsSkipped()
    {
        return iterationsSkipped;
    }

    public double getTolerance()
    {
        return tolerance;
    }

    public Map<String, Long> getSkipReasons()
    {
        return skipReasons;
    }
}
