/* (C)2026 */
package com.ammann.riskscore.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/**
 * Aggregate statistics over a batch of detailed score results. Score statistics cover
 * valid results only and are absent when there are none.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScoreBatchSummaryDTO(
        int totalSubjects,
        int validCalculations,
        int invalidCalculations,
        Double meanScore,
        Double medianScore,
        Integer minScore,
        Integer maxObservedScore,
        int maxScore,
        Map<String, Long> riskDistribution
) {
}
