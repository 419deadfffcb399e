/* (C)2026 */
package com.ammann.riskscore.model;

import java.util.List;

/**
 * Result of loading tabular rows into a validated cohort.
 *
 * @param cohort     subjects that passed validation
 * @param exclusions rows rejected per subject, with reasons
 */
public record CohortLoadResult(Cohort cohort, List<SubjectExclusion> exclusions)
{
    public CohortLoadResult
    {
        exclusions = List.copyOf(exclusions);
    }
}
