/* (C)2026 */
package com.ammann.riskscore.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Log-rank comparison of two risk categories with the hazard ratio of the second
 * relative to the first. Statistics are absent when either group is empty.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LogRankResultDTO(
        String firstCategory,
        String secondCategory,
        Double chiSquare,
        Double pValue,
        Double hazardRatio,
        ConfidenceIntervalDTO hazardRatioInterval
) {
    @JsonIgnore
    public boolean isValid() {
        return pValue != null && !pValue.isNaN();
    }
}
