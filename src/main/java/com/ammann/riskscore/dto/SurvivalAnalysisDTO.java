/* (C)2026 */
package com.ammann.riskscore.dto;

import java.util.List;

/**
 * Survival curves per risk category and log-rank tests between adjacent categories.
 */
public record SurvivalAnalysisDTO(List<KaplanMeierCurveDTO> curves, List<LogRankResultDTO> adjacentComparisons) {

    public SurvivalAnalysisDTO {
        curves = List.copyOf(curves);
        adjacentComparisons = List.copyOf(adjacentComparisons);
    }
}
