/* (C)2026 */
package com.ammann.riskscore.dto;

/**
 * Subject count and outcome rate of one risk category.
 */
public record RiskCategorySummaryDTO(
        String category,
        int lowerBound,
        int upperBound,
        int subjects,
        int events,
        double outcomeRate
) {
}
