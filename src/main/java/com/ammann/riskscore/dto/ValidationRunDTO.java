/* (C)2026 */
package com.ammann.riskscore.dto;

import com.ammann.riskscore.enumeration.EvaluationStatus;
import java.time.Instant;
import java.util.List;

/**
 * Complete output of one validation run over a cohort.
 *
 * @param scoreDefinition textual form of the configured point table
 * @param maxScore        maximum score of that table
 */
public record ValidationRunDTO(
        int cohortSize,
        String scoreDefinition,
        int maxScore,
        List<LandmarkValidationDTO> results,
        Instant startedAt,
        Instant completedAt,
        long durationMs
) {
    public ValidationRunDTO {
        results = List.copyOf(results);
    }

    public long evaluatedCount() {
        return results.stream()
                .filter(r -> r.status() == EvaluationStatus.EVALUATED)
                .count();
    }
}
