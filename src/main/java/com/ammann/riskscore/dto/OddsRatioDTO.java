/* (C)2026 */
package com.ammann.riskscore.dto;

/**
 * Odds ratio of the outcome in a higher risk category relative to the category directly
 * below it, with a Wald interval on the log-odds scale. When a cell of the 2x2 table was
 * empty, 0.5 was added to every cell and {@code continuityCorrected} is set.
 */
public record OddsRatioDTO(
        String lowerCategory,
        String higherCategory,
        double oddsRatio,
        ConfidenceIntervalDTO confidenceInterval,
        boolean continuityCorrected
) {
}
