/* (C)2026 */
package com.ammann.riskscore.dto;

import java.util.List;

/**
 * Decision curve for the rule "intervene when score &gt;= decisionThreshold".
 */
public record DecisionCurveDTO(
        int decisionThreshold,
        int subjects,
        double prevalence,
        double sensitivity,
        double specificity,
        List<NetBenefitPointDTO> points
) {
    public DecisionCurveDTO {
        points = List.copyOf(points);
    }
}
