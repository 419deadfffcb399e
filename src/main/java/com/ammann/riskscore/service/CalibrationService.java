/* (C)2026 */
package com.ammann.riskscore.service;

import com.ammann.riskscore.dto.CalibrationBinDTO;
import com.ammann.riskscore.dto.CalibrationDTO;
import com.ammann.riskscore.enumeration.OutcomeClass;
import com.ammann.riskscore.exception.InsufficientDataException;
import com.ammann.riskscore.model.RiskCategory;
import com.ammann.riskscore.model.RiskPartition;
import com.ammann.riskscore.model.ScoredCohort;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.jboss.logging.Logger;

/**
 * Calibration of category-level risk estimates.
 *
 * <p>The predicted probability of a subject is the observed outcome rate of its risk category
 * in the development cohort. Agreement with observed outcomes is summarized by the Brier
 * score and the Hosmer-Lemeshow goodness-of-fit test.
 */
@ApplicationScoped
public class CalibrationService
{

    private static final Logger LOG = Logger.getLogger(CalibrationService.class);

    static final int DEFAULT_GROUPS = 10;

    /**
     * Observed outcome rate per category among subjects evaluable at the horizon. Categories
     * without evaluable subjects fall back to the overall rate.
     *
     * @throws InsufficientDataException if no subject is evaluable at the horizon
     */
    public Map<String, Double> categoryRisks(RiskPartition partition, ScoredCohort scored, double horizon)
    {
        int categories = partition.categories().size();
        int[] subjects = new int[categories];
        int[] cases = new int[categories];
        int totalSubjects = 0;
        int totalCases = 0;

        for (int i = 0; i < scored.size(); i++) {
            OutcomeClass outcome = OutcomeClass.at(scored.subjects().get(i), horizon);
            if (!outcome.isEvaluable()) continue;
            int index = partition.indexOf(scored.score(i));
            subjects[index]++;
            totalSubjects++;
            if (outcome == OutcomeClass.CASE) {
                cases[index]++;
                totalCases++;
            }
        }

        if (totalSubjects == 0) {
            throw new InsufficientDataException(
                    "No subject is evaluable at horizon " + horizon + " for category risk estimation", 0, 0);
        }

        double overall = (double) totalCases / totalSubjects;
        Map<String, Double> risks = new LinkedHashMap<>();
        for (int c = 0; c < categories; c++) {
            double risk = subjects[c] == 0 ? overall : (double) cases[c] / subjects[c];
            risks.put(partition.categories().get(c).name(), risk);
        }
        return risks;
    }

    /**
     * Mean squared difference between predicted category risk and observed outcome.
     *
     * @return the Brier score, or empty when no subject is evaluable
     */
    public OptionalDouble brierScore(Map<String, Double> categoryRisks,
                                     RiskPartition partition,
                                     ScoredCohort scored,
                                     double horizon)
    {
        Labelled labelled = label(categoryRisks, partition, scored, horizon);
        if (labelled.size() == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(brier(labelled));
    }

    /**
     * Full calibration assessment with Hosmer-Lemeshow grouping by predicted risk.
     *
     * @param groups requested number of groups; reduced to the number of subjects if larger
     * @throws InsufficientDataException if no subject is evaluable
     */
    public CalibrationDTO assess(Map<String, Double> categoryRisks,
                                 RiskPartition partition,
                                 ScoredCohort scored,
                                 double horizon,
                                 int groups)
    {
        if (groups < 1) {
            throw new IllegalArgumentException("Number of calibration groups must be positive, got " + groups);
        }
        Labelled labelled = label(categoryRisks, partition, scored, horizon);
        int n = labelled.size();
        if (n == 0) {
            throw new InsufficientDataException("No subject is evaluable at horizon " + horizon + " for calibration", 0, 0);
        }

        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) order[i] = i;
        Arrays.sort(order, (a, b) -> Double.compare(labelled.predicted()[a], labelled.predicted()[b]));

        int groupCount = Math.min(groups, n);
        List<CalibrationBinDTO> bins = new ArrayList<>(groupCount);
        double statistic = 0.0;

        for (int g = 0; g < groupCount; g++) {
            int from = (int) ((long) g * n / groupCount);
            int to = (int) ((long) (g + 1) * n / groupCount);
            int size = to - from;
            double expected = 0.0;
            int observed = 0;
            for (int k = from; k < to; k++) {
                expected += labelled.predicted()[order[k]];
                if (labelled.observed()[order[k]]) observed++;
            }

            double denominator = expected * (1.0 - expected / size);
            if (denominator > 0.0) {
                statistic += (observed - expected) * (observed - expected) / denominator;
            }
            bins.add(new CalibrationBinDTO(g + 1, size, expected / size, (double) observed / size));
        }

        int degreesOfFreedom = groupCount - 2;
        Double pValue = null;
        if (degreesOfFreedom >= 1) {
            pValue = 1.0 - new ChiSquaredDistribution(degreesOfFreedom).cumulativeProbability(statistic);
        } else {
            LOG.debugf("Hosmer-Lemeshow p-value undefined with %d groups", groupCount);
        }

        double brier = brier(labelled);
        LOG.debugf("Calibration at horizon %.1f: Brier=%.4f, HL=%.3f (p=%s) over %d subjects",
                horizon, brier, statistic, pValue, n);

        return new CalibrationDTO(n, brier, statistic, pValue, bins);
    }

    private static double brier(Labelled labelled)
    {
        double sum = 0.0;
        for (int i = 0; i < labelled.size(); i++) {
            double y = labelled.observed()[i] ? 1.0 : 0.0;
            double diff = labelled.predicted()[i] - y;
            sum += diff * diff;
        }
        return sum / labelled.size();
    }

    private static Labelled label(Map<String, Double> categoryRisks,
                                  RiskPartition partition,
                                  ScoredCohort scored,
                                  double horizon)
    {
        double[] predicted = new double[scored.size()];
        boolean[] observed = new boolean[scored.size()];
        int n = 0;
        for (int i = 0; i < scored.size(); i++) {
            OutcomeClass outcome = OutcomeClass.at(scored.subjects().get(i), horizon);
            if (!outcome.isEvaluable()) continue;
            RiskCategory category = partition.categoryOf(scored.score(i));
            Double risk = categoryRisks.get(category.name());
            if (risk == null) {
                throw new IllegalArgumentException("No risk estimate for category " + category.name());
            }
            predicted[n] = risk;
            observed[n] = outcome == OutcomeClass.CASE;
            n++;
        }
        return new Labelled(Arrays.copyOf(predicted, n), Arrays.copyOf(observed, n));
    }

    private record Labelled(double[] predicted, boolean[] observed)
    {
        int size()
        {
            return predicted.length;
        }
    }
}
