/* (C)2026 */
package com.ammann.riskscore.service;

import com.ammann.riskscore.config.ValidationSettings;
import com.ammann.riskscore.dto.BootstrapReportDTO;
import com.ammann.riskscore.dto.CalibrationDTO;
import com.ammann.riskscore.dto.DecisionCurveDTO;
import com.ammann.riskscore.dto.LandmarkValidationDTO;
import com.ammann.riskscore.dto.RiskStratificationDTO;
import com.ammann.riskscore.dto.RocResultDTO;
import com.ammann.riskscore.dto.SurvivalAnalysisDTO;
import com.ammann.riskscore.dto.ThresholdDTO;
import com.ammann.riskscore.dto.ValidationRunDTO;
import com.ammann.riskscore.enumeration.EvaluationStatus;
import com.ammann.riskscore.enumeration.PerformanceMetric;
import com.ammann.riskscore.exception.InsufficientDataException;
import com.ammann.riskscore.exception.ValidationException;
import com.ammann.riskscore.model.Cohort;
import com.ammann.riskscore.model.LandmarkCohort;
import com.ammann.riskscore.model.RiskPartition;
import com.ammann.riskscore.model.ScoreComponent;
import com.ammann.riskscore.model.ScoreDefinition;
import com.ammann.riskscore.model.ScoredCohort;
import com.ammann.riskscore.model.SubjectExclusion;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import org.jboss.logging.Logger;

/**
 * Runs the complete validation of the configured score over every (landmark day, horizon)
 * cell.
 *
 * <p>Per cell: landmark cohort, re-derived cut points with bootstrap intervals, scores,
 * time-dependent ROC, C-index, calibration, decision curve, bootstrap optimism correction of
 * every configured metric, risk stratification and survival per category.
 *
 * <p>A cell without cases or controls is reported as {@link EvaluationStatus#NON_EVALUABLE}
 * and the run continues. An unstable bootstrap aborts the whole run.
 */
@ApplicationScoped
public class ValidationPipelineService
{

    private static final Logger LOG = Logger.getLogger(ValidationPipelineService.class);

    private final CohortStore cohortStore;
    private final LandmarkBuilder landmarkBuilder;
    private final ThresholdOptimizer thresholdOptimizer;
    private final ScoreCalculator scoreCalculator;
    private final TimeDependentRocService rocService;
    private final ConcordanceService concordanceService;
    private final CalibrationService calibrationService;
    private final DecisionCurveService decisionCurveService;
    private final RiskStratifier riskStratifier;
    private final SurvivalAnalysisService survivalAnalysisService;
    private final BootstrapValidator bootstrapValidator;
    private final ScoreDefinition scoreDefinition;
    private final RiskPartition riskPartition;
    private final ValidationSettings settings;

    @Inject
    public ValidationPipelineService(CohortStore cohortStore,
                                     LandmarkBuilder landmarkBuilder,
                                     ThresholdOptimizer thresholdOptimizer,
                                     ScoreCalculator scoreCalculator,
                                     TimeDependentRocService rocService,
                                     ConcordanceService concordanceService,
                                     CalibrationService calibrationService,
                                     DecisionCurveService decisionCurveService,
                                     RiskStratifier riskStratifier,
                                     SurvivalAnalysisService survivalAnalysisService,
                                     BootstrapValidator bootstrapValidator,
                                     ScoreDefinition scoreDefinition,
                                     RiskPartition riskPartition,
                                     ValidationSettings settings)
    {
        this.cohortStore = cohortStore;
        this.landmarkBuilder = landmarkBuilder;
        this.thresholdOptimizer = thresholdOptimizer;
        this.scoreCalculator = scoreCalculator;
        this.rocService = rocService;
        this.concordanceService = concordanceService;
        this.calibrationService = calibrationService;
        this.decisionCurveService = decisionCurveService;
        this.riskStratifier = riskStratifier;
        this.survivalAnalysisService = survivalAnalysisService;
        this.bootstrapValidator = bootstrapValidator;
        this.scoreDefinition = scoreDefinition;
        this.riskPartition = riskPartition;
        this.settings = settings;
    }

    /**
     * Validates the cohort most recently loaded into the {@link CohortStore}.
     *
     * @throws ValidationException if no cohort has been loaded
     */
    public ValidationRunDTO run()
    {
        Cohort cohort = cohortStore.current()
                .orElseThrow(() -> new ValidationException("No cohort loaded, call CohortStore.load first"));
        return run(cohort);
    }

    public ValidationRunDTO run(Cohort cohort)
    {
        Instant startedAt = Instant.now();
        LOG.infof("Validating %s (max %d) on %d subjects: landmarks %s, horizons %s",
                scoreDefinition, scoreDefinition.maxScore(), cohort.size(),
                settings.landmarkDays(), settings.horizons());

        List<LandmarkValidationDTO> results = new ArrayList<>();
        for (double landmarkDay : settings.landmarkDays()) {
            for (double horizon : settings.horizons()) {
                results.add(runCell(cohort, landmarkDay, horizon));
            }
        }

        Instant completedAt = Instant.now();
        ValidationRunDTO run = new ValidationRunDTO(cohort.size(), scoreDefinition.toString(),
                scoreDefinition.maxScore(), results, startedAt, completedAt,
                Duration.between(startedAt, completedAt).toMillis());

        LOG.infof("Validation finished: %d of %d cells evaluated in %d ms",
                run.evaluatedCount(), results.size(), run.durationMs());
        return run;
    }

    /**
     * Validates one (landmark day, horizon) cell.
     */
    public LandmarkValidationDTO runCell(Cohort cohort, double landmarkDay, double horizon)
    {
        LandmarkCohort landmark = landmarkBuilder.build(cohort, landmarkDay, horizon);
        if (landmark.cohort().isEmpty()) {
            return nonEvaluable(landmark, "No subject at risk at landmark day");
        }

        try {
            List<ThresholdDTO> thresholds = new ArrayList<>();
            ScoreDefinition definition = deriveDefinition(landmark.cohort(), horizon, thresholds);

            ScoredCohort scored = scoreCalculator.scoreCohort(definition, landmark.cohort());
            for (SubjectExclusion exclusion : scored.exclusions()) {
                LOG.warnf("Landmark %.1f horizon %.1f: subject %s excluded from scoring: %s",
                        landmarkDay, horizon, exclusion.subjectId(), exclusion.reason());
            }

            RocResultDTO roc = rocService.compute(scored, landmarkDay, horizon).orElse(null);
            if (roc == null) {
                return nonEvaluable(landmark, "No cases or no controls at horizon");
            }

            OptionalDouble concordance = concordanceService.concordanceIndex(scored);
            Map<String, Double> categoryRisks = calibrationService.categoryRisks(riskPartition, scored, horizon);
            CalibrationDTO calibration = calibrationService.assess(categoryRisks, riskPartition, scored, horizon,
                    settings.calibrationBins());
            DecisionCurveDTO decisionCurve = decisionCurveService.analyze(riskPartition, scored, horizon);

            List<BootstrapReportDTO> reports = new ArrayList<>();
            for (PerformanceMetric metric : settings.metrics()) {
                bootstrap(metric, cohort, landmarkDay, horizon).ifPresent(reports::add);
            }

            RiskStratificationDTO stratification = riskStratifier.stratify(riskPartition, scored, horizon);
            SurvivalAnalysisDTO survival = survivalAnalysisService.analyze(riskPartition, scored);

            LOG.infof("Landmark %.1f horizon %.1f: AUC %.3f, %d cases, %d controls",
                    landmarkDay, horizon, roc.auc(), roc.cases(), roc.controls());

            return new LandmarkValidationDTO(landmarkDay, horizon, EvaluationStatus.EVALUATED, null,
                    landmark.size(), landmark.excludedCount(), scored.exclusions().size(), thresholds, roc,
                    concordance.isPresent() ? concordance.getAsDouble() : null,
                    calibration, decisionCurve, reports, stratification, survival);
        } catch (InsufficientDataException e) {
            return nonEvaluable(landmark, e.getMessage());
        }
    }

    private Optional<BootstrapReportDTO> bootstrap(PerformanceMetric metric,
                                                   Cohort cohort,
                                                   double landmarkDay,
                                                   double horizon)
    {
        try {
            return Optional.of(bootstrapValidator.validate(metric, cohort,
                    sample -> develop(sample, landmarkDay, horizon),
                    (model, target) -> evaluate(metric, model, target, landmarkDay, horizon),
                    settings.bootstrap()));
        } catch (InsufficientDataException e) {
            LOG.warnf("Bootstrap of %s at landmark %.1f horizon %.1f not evaluable: %s",
                    metric, landmarkDay, horizon, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Full model development on one cohort: landmark, cut points, scores and category risks.
     */
    private DevelopedModel develop(Cohort cohort, double landmarkDay, double horizon)
    {
        LandmarkCohort landmark = landmarkBuilder.build(cohort, landmarkDay, horizon);
        ScoreDefinition definition = deriveDefinition(landmark.cohort(), horizon, null);
        ScoredCohort scored = scoreCalculator.scoreCohort(definition, landmark.cohort());
        return new DevelopedModel(definition, calibrationService.categoryRisks(riskPartition, scored, horizon));
    }

    private OptionalDouble evaluate(PerformanceMetric metric,
                                    DevelopedModel model,
                                    Cohort cohort,
                                    double landmarkDay,
                                    double horizon)
    {
        LandmarkCohort landmark = landmarkBuilder.build(cohort, landmarkDay, horizon);
        ScoredCohort scored = scoreCalculator.scoreCohort(model.definition(), landmark.cohort());
        return switch (metric) {
            case AUC -> rocService.auc(scored, horizon);
            case C_INDEX -> concordanceService.concordanceIndex(scored);
            case BRIER -> calibrationService.brierScore(model.categoryRisks(), riskPartition, scored, horizon);
        };
    }

    /**
     * Re-derives the cut point of every threshold component on the cohort. With
     * {@code thresholds} given, bootstrap intervals are computed and the thresholds collected.
     */
    private ScoreDefinition deriveDefinition(Cohort cohort, double horizon, List<ThresholdDTO> thresholds)
    {
        if (!settings.deriveCutPoints()) {
            return scoreDefinition;
        }
        Map<String, Double> cutPoints = new LinkedHashMap<>();
        for (ScoreComponent component : scoreDefinition.thresholdComponents()) {
            ThresholdDTO threshold;
            if (thresholds == null) {
                threshold = thresholdOptimizer.findOptimalThreshold(cohort, component.variable(), horizon,
                        component.direction());
            } else {
                threshold = thresholdOptimizer.findOptimalThresholdWithConfidence(cohort, component.variable(),
                        horizon, component.direction(), settings.thresholdIterations(),
                        settings.bootstrap().seed(), settings.bootstrap().confidenceLevel());
                thresholds.add(threshold);
            }
            cutPoints.put(component.variable(), threshold.cutPoint());
        }
        return scoreDefinition.withCutPoints(cutPoints);
    }

    private static LandmarkValidationDTO nonEvaluable(LandmarkCohort landmark, String reason)
    {
        LOG.warnf("Landmark %.1f horizon %.1f not evaluable: %s", landmark.landmarkDay(), landmark.horizon(), reason);
        return LandmarkValidationDTO.nonEvaluable(landmark.landmarkDay(), landmark.horizon(), landmark.size(),
                landmark.excludedCount(), reason);
    }

    private record DevelopedModel(ScoreDefinition definition, Map<String, Double> categoryRisks)
    {
    }
}
