/* (C)2026 */
package com.ammann.riskscore.dto;

import com.ammann.riskscore.enumeration.Direction;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Youden-optimal cut point for one continuous covariate.
 *
 * <p>The subject is classified positive when {@code value direction cutPoint} holds, e.g.
 * {@code MELD > 19}. The confidence interval is the 2.5th/97.5th percentile range of the cut
 * points re-derived on bootstrap resamples and is absent when no resample was evaluable.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ThresholdDTO(
        String variable,
        double cutPoint,
        Direction direction,
        double sensitivity,
        double specificity,
        double youdenIndex,
        int cases,
        int controls,
        ConfidenceIntervalDTO confidenceInterval,
        Integer resamplesUsed
) {
    /**
     * Returns a copy carrying the bootstrap confidence interval of the cut point.
     */
    public ThresholdDTO withConfidenceInterval(ConfidenceIntervalDTO interval, int resamples) {
        return new ThresholdDTO(variable, cutPoint, direction, sensitivity, specificity,
                youdenIndex, cases, controls, interval, resamples);
    }
}
