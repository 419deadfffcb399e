/* (C)2026 */
package com.ammann.riskscore.dto;

import java.util.List;

/**
 * Kaplan-Meier survival estimate of one risk category. The three lists are aligned: at
 * {@code times[i]} the estimated survival is {@code survival[i]} with {@code atRisk[i]}
 * subjects at risk. The first entry is time 0 with survival 1.
 */
public record KaplanMeierCurveDTO(
        String category,
        int subjects,
        int events,
        List<Double> times,
        List<Double> survival,
        List<Integer> atRisk
) {
    public KaplanMeierCurveDTO {
        times = List.copyOf(times);
        survival = List.copyOf(survival);
        atRisk = List.copyOf(atRisk);
    }
}
