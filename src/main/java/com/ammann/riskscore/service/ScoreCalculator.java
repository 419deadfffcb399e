/* (C)2026 */
package com.ammann.riskscore.service;

import com.ammann.riskscore.dto.ScoreBatchSummaryDTO;
import com.ammann.riskscore.dto.ScoreResultDTO;
import com.ammann.riskscore.enumeration.MissingCovariatePolicy;
import com.ammann.riskscore.exception.MissingCovariateException;
import com.ammann.riskscore.model.Cohort;
import com.ammann.riskscore.model.RiskCategory;
import com.ammann.riskscore.model.RiskPartition;
import com.ammann.riskscore.model.ScoreComponent;
import com.ammann.riskscore.model.ScoreDefinition;
import com.ammann.riskscore.model.ScoredCohort;
import com.ammann.riskscore.model.Subject;
import com.ammann.riskscore.model.SubjectExclusion;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Deterministic point-sum transform from covariates to an integer score.
 *
 * <p>Every component is evaluated against the subject's covariate and its points are added
 * when the predicate holds, so the result is always within {@code [0, maxScore]}. The
 * calculator keeps no state between calls.
 *
 * <p>Missing covariates are handled according to {@code risk-score.missing-policy}:
 * {@link MissingCovariatePolicy#FAIL} rejects the subject, {@link MissingCovariatePolicy#SCORE_ZERO}
 * scores the component as 0 while at most {@code risk-score.cohort.max-missing-covariates}
 * components are missing.
 */
@ApplicationScoped
public class ScoreCalculator {

    private static final Logger LOG = Logger.getLogger(ScoreCalculator.class);

    @ConfigProperty(name = "risk-score.missing-policy", defaultValue = "FAIL")
    MissingCovariatePolicy missingPolicy = MissingCovariatePolicy.FAIL;

    @ConfigProperty(name = "risk-score.cohort.max-missing-covariates", defaultValue = "2")
    int maxMissingComponents = CohortStore.DEFAULT_MAX_MISSING_COVARIATES;

    /**
     * Computes the integer score of one subject.
     *
     * @throws MissingCovariateException if a required covariate is absent and the policy
     *                                   does not allow scoring it
     */
    public int calculate(ScoreDefinition definition, Subject subject) {
        int total = 0;
        List<String> missing = null;

        for (ScoreComponent component : definition.components()) {
            OptionalDouble value = subject.value(component.variable());
            if (value.isEmpty()) {
                if (missing == null) missing = new ArrayList<>();
                missing.add(component.variable());
                continue;
            }
            if (component.isSatisfiedBy(value.getAsDouble())) {
                total += component.points();
            }
        }

        if (missing != null && !isScorable(missing.size())) {
            throw new MissingCovariateException(subject.id(), missing);
        }
        return total;
    }

    /**
     * Computes the score with a per-component breakdown. Never throws for missing covariates;
     * the result is flagged invalid instead.
     */
    public ScoreResultDTO calculateDetailed(ScoreDefinition definition, Subject subject) {
        Map<String, Integer> componentPoints = new LinkedHashMap<>();
        List<String> details = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        int total = 0;

        for (ScoreComponent component : definition.components()) {
            OptionalDouble value = subject.value(component.variable());
            if (value.isEmpty()) {
                missing.add(component.variable());
                warnings.add(component.variable() + " missing");
                continue;
            }

            double v = value.getAsDouble();
            boolean satisfied = component.isSatisfiedBy(v);
            int points = satisfied ? component.points() : 0;
            componentPoints.put(component.variable(), points);
            total += points;
            details.add(describe(component, v, satisfied, points));
        }

        boolean valid = missing.isEmpty() || isScorable(missing.size());
        if (!valid) {
            warnings.add(String.format("Too many missing components (%d). Result is not valid under policy %s",
                    missing.size(), missingPolicy));
        }

        LOG.debugf("Score for subject %s: %d/%d (%s)",
                subject.id(), total, definition.maxScore(), valid ? "valid" : "invalid");

        return new ScoreResultDTO(subject.id(), total, definition.maxScore(), componentPoints,
                details, missing, warnings, valid);
    }

    /**
     * Scores every subject of the cohort. Subjects that cannot be scored are excluded and
     * reported in {@link ScoredCohort#exclusions()}; they never abort the cohort.
     */
    public ScoredCohort scoreCohort(ScoreDefinition definition, Cohort cohort) {
        List<Subject> subjects = cohort.subjects();
        List<Subject> scored = new ArrayList<>(subjects.size());
        int[] scores = new int[subjects.size()];
        List<SubjectExclusion> exclusions = new ArrayList<>();

        for (Subject subject : subjects) {
            try {
                scores[scored.size()] = calculate(definition, subject);
                scored.add(subject);
            } catch (MissingCovariateException e) {
                LOG.debugf("Subject %s not scored: %s", subject.id(), e.getMessage());
                exclusions.add(new SubjectExclusion(subject.id(), "missing covariates " + e.getMissingCovariates()));
            }
        }

        if (!exclusions.isEmpty()) {
            LOG.debugf("%d of %d subjects could not be scored because of missing covariates",
                    exclusions.size(), subjects.size());
        }

        int[] trimmed = new int[scored.size()];
        System.arraycopy(scores, 0, trimmed, 0, scored.size());
        return new ScoredCohort(scored, trimmed, definition.maxScore(), exclusions);
    }

    /**
     * Summarizes a batch of detailed results. Score statistics use valid results only.
     */
    public ScoreBatchSummaryDTO summarize(List<ScoreResultDTO> results, RiskPartition partition) {
        List<ScoreResultDTO> valid = results.stream().filter(ScoreResultDTO::valid).toList();

        Map<String, Long> distribution = new LinkedHashMap<>();
        for (RiskCategory category : partition.categories()) {
            distribution.put(category.name(), 0L);
        }
        for (ScoreResultDTO result : valid) {
            distribution.merge(partition.categoryOf(result.totalScore()).name(), 1L, Long::sum);
        }

        if (valid.isEmpty()) {
            return new ScoreBatchSummaryDTO(results.size(), 0, results.size(),
                    null, null, null, null, partition.maxScore(), distribution);
        }

        double[] totals = valid.stream().mapToDouble(ScoreResultDTO::totalScore).toArray();
        var stats = valid.stream().mapToInt(ScoreResultDTO::totalScore).summaryStatistics();

        return new ScoreBatchSummaryDTO(
                results.size(),
                valid.size(),
                results.size() - valid.size(),
                stats.getAverage(),
                Percentiles.median(totals),
                stats.getMin(),
                stats.getMax(),
                partition.maxScore(),
                distribution);
    }

    private boolean isScorable(int missingCount) {
        return missingPolicy == MissingCovariatePolicy.SCORE_ZERO && missingCount <= maxMissingComponents;
    }

    private static String describe(ScoreComponent component, double value, boolean satisfied, int points) {
        if (!component.isThreshold()) {
            return String.format(Locale.ROOT, "%s %s: +%d points", component.variable(), satisfied ? "present" : "absent", points);
        }
        String symbol = satisfied ? component.direction().getSymbol() : component.direction().getComplementSymbol();
        return String.format(Locale.ROOT, "%s %s %s (%.1f): +%d points",
                component.variable(), symbol, component.cutPoint(), value, points);
    }
}
