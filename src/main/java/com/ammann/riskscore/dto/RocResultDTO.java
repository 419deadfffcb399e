/* (C)2026 */
package com.ammann.riskscore.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Time-dependent ROC curve of the score for one (landmark, horizon) pair.
 *
 * <p>Points are ordered by descending threshold, i.e. by ascending false positive rate.
 * Cases had the event within the horizon, controls were still event-free after it, and
 * subjects censored earlier without an event are counted in {@code excludedCensored}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RocResultDTO(
        double landmarkDay,
        double horizon,
        int cases,
        int controls,
        int excludedCensored,
        List<RocPointDTO> points,
        double auc,
        Double optimalThreshold,
        Double optimalSensitivity,
        Double optimalSpecificity
) {
    public RocResultDTO {
        points = List.copyOf(points);
    }
}
