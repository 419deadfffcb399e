/* (C)2026 */
package com.ammann.riskscore.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;

/**
 * Detailed score of one subject with the contribution of every component.
 *
 * <p>{@code maxScore} is taken from the score definition used for the calculation, so
 * "out of N" displays never carry their own literal.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScoreResultDTO(
        String subjectId,
        int totalScore,
        int maxScore,
        Map<String, Integer> componentPoints,
        List<String> details,
        List<String> missingComponents,
        List<String> warnings,
        boolean valid
) {
    public ScoreResultDTO {
        componentPoints = Map.copyOf(componentPoints);
        details = List.copyOf(details);
        missingComponents = List.copyOf(missingComponents);
        warnings = List.copyOf(warnings);
    }

    /**
     * One-line summary such as {@code Score: 5/8 (VALID)}.
     */
    public String summaryLine() {
        return String.format("Score: %d/%d (%s)", totalScore, maxScore, valid ? "VALID" : "INVALID");
    }
}
