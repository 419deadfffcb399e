/* (C)2026 */
package com.ammann.riskscore.dto;

import com.ammann.riskscore.enumeration.PerformanceMetric;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/**
 * Optimism-corrected performance estimate of one metric.
 *
 * <p>{@code biasCorrectedPerformance == originalPerformance - optimism} holds exactly;
 * {@code optimism} is the mean of (apparent - test) over completed iterations and the
 * confidence interval is the percentile range of the per-iteration test performance.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BootstrapReportDTO(
        PerformanceMetric metric,
        int iterationsRequested,
        int iterationsCompleted,
        int iterationsSkipped,
        double skipRate,
        Map<String, Long> skipReasons,
        double originalPerformance,
        double meanApparentPerformance,
        double meanTestPerformance,
        double optimism,
        double biasCorrectedPerformance,
        ConfidenceIntervalDTO confidenceInterval,
        long seed
) {
    public BootstrapReportDTO {
        skipReasons = Map.copyOf(skipReasons);
    }
}
