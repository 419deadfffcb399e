/* (C)2026 */
package com.ammann.riskscore.dto;

import com.ammann.riskscore.enumeration.EvaluationStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Validation results for one (landmark, horizon) cell. Performance fields are absent when
 * the cell is {@link EvaluationStatus#NON_EVALUABLE}; {@code reason} says why.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LandmarkValidationDTO(
        double landmarkDay,
        double horizon,
        EvaluationStatus status,
        String reason,
        int subjectsAtRisk,
        int excludedBeforeLandmark,
        int scoringExclusions,
        List<ThresholdDTO> thresholds,
        RocResultDTO roc,
        Double concordanceIndex,
        CalibrationDTO calibration,
        DecisionCurveDTO decisionCurve,
        List<BootstrapReportDTO> bootstrapReports,
        RiskStratificationDTO stratification,
        SurvivalAnalysisDTO survival
) {
    /**
     * Creates the result of a cell that could not be evaluated.
     */
    public static LandmarkValidationDTO nonEvaluable(double landmarkDay,
                                                     double horizon,
                                                     int subjectsAtRisk,
                                                     int excludedBeforeLandmark,
                                                     String reason) {
        return new LandmarkValidationDTO(landmarkDay, horizon, EvaluationStatus.NON_EVALUABLE, reason,
                subjectsAtRisk, excludedBeforeLandmark, 0, null, null, null, null, null, null, null, null);
    }
}
