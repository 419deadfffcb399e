/* (C)2026 */
package com.ammann.riskscore.dto;

import java.util.List;

/**
 * Per-category outcome table of a scored cohort plus adjacent-category odds ratios.
 *
 * @param maxScore          maximum of the score definition the partition tiles
 * @param decisionThreshold lower bound of the highest category
 * @param excludedCensored  subjects censored before the horizon without an event
 */
public record RiskStratificationDTO(
        int maxScore,
        int decisionThreshold,
        List<RiskCategorySummaryDTO> categories,
        List<OddsRatioDTO> adjacentOddsRatios,
        int excludedCensored
) {
    public RiskStratificationDTO {
        categories = List.copyOf(categories);
        adjacentOddsRatios = List.copyOf(adjacentOddsRatios);
    }
}
