/* (C)2026 */
package com.ammann.riskscore.model;

import java.util.Objects;

/**
 * Sub-cohort of subjects still at risk after a landmark day, with follow-up time measured
 * from the landmark and the event indicator restricted to the horizon under study.
 *
 * @param landmarkDay   landmark τ; every retained subject had original time {@code > τ}
 * @param horizon       prediction horizon relative to the landmark, or
 *                      {@link Double#POSITIVE_INFINITY} when the event indicator is not
 *                      restricted
 * @param cohort        the shifted subjects
 * @param excludedCount subjects of the source cohort dropped because their time was
 *                      {@code ≤ τ}
 */
public record LandmarkCohort(double landmarkDay, double horizon, Cohort cohort, int excludedCount)
{
    public LandmarkCohort
    {
        Objects.requireNonNull(cohort, "cohort");
    }

    public int size()
    {
        return cohort.size();
    }

    public boolean hasHorizon()
    {
        return !Double.isInfinite(horizon);
    }
}
