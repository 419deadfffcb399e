/* (C)2026 */
package com.ammann.riskscore.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Calibration of category-based risk predictions at the horizon.
 *
 * <p>The Hosmer-Lemeshow p-value is absent when fewer than three non-empty groups were
 * formed (the chi-square reference needs at least one degree of freedom).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CalibrationDTO(
        int subjects,
        double brierScore,
        double hosmerLemeshowStatistic,
        Double hosmerLemeshowPValue,
        List<CalibrationBinDTO> groups
) {
    public CalibrationDTO {
        groups = List.copyOf(groups);
    }
}
