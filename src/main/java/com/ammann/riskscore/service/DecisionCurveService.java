/* (C)2026 */
package com.ammann.riskscore.service;

import com.ammann.riskscore.dto.DecisionCurveDTO;
import com.ammann.riskscore.dto.NetBenefitPointDTO;
import com.ammann.riskscore.enumeration.OutcomeClass;
import com.ammann.riskscore.exception.InsufficientDataException;
import com.ammann.riskscore.model.RiskPartition;
import com.ammann.riskscore.model.ScoredCohort;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Decision curve analysis of the high-risk classification.
 *
 * <p>Subjects scoring at least the partition's decision threshold are classified as high
 * risk. Net benefit at threshold probability {@code pt} is
 * {@code TP/n - FP/n * pt / (1 - pt)}, compared against treating everybody and nobody.
 */
@ApplicationScoped
public class DecisionCurveService {

    private static final Logger LOG = Logger.getLogger(DecisionCurveService.class);

    static final double MIN_THRESHOLD_PROBABILITY = 0.01;
    static final double MAX_THRESHOLD_PROBABILITY = 0.99;
    static final double STEP = 0.01;

    /**
     * @throws InsufficientDataException if no subject is evaluable at the horizon
     */
    public DecisionCurveDTO analyze(RiskPartition partition, ScoredCohort scored, double horizon) {
        int threshold = partition.decisionThreshold();
        int n = 0;
        int cases = 0;
        int truePositives = 0;
        int falsePositives = 0;

        for (int i = 0; i < scored.size(); i++) {
            OutcomeClass outcome = OutcomeClass.at(scored.subjects().get(i), horizon);
            if (!outcome.isEvaluable()) continue;
            n++;
            boolean positive = scored.score(i) >= threshold;
            if (outcome == OutcomeClass.CASE) {
                cases++;
                if (positive) truePositives++;
            } else if (positive) {
                falsePositives++;
            }
        }

        if (n == 0) {
            throw new InsufficientDataException("No subject is evaluable at horizon " + horizon + " for decision curve", 0, 0);
        }

        int controls = n - cases;
        double prevalence = (double) cases / n;
        double sensitivity = cases == 0 ? Double.NaN : (double) truePositives / cases;
        double specificity = controls == 0 ? Double.NaN : 1.0 - (double) falsePositives / controls;

        List<NetBenefitPointDTO> points = new ArrayList<>();
        int steps = (int) Math.round((MAX_THRESHOLD_PROBABILITY - MIN_THRESHOLD_PROBABILITY) / STEP);
        for (int k = 0; k <= steps; k++) {
            double pt = Math.round((MIN_THRESHOLD_PROBABILITY + k * STEP) * 100.0) / 100.0;
            double odds = pt / (1.0 - pt);
            double model = (double) truePositives / n - (double) falsePositives / n * odds;
            double treatAll = prevalence - (1.0 - prevalence) * odds;
            points.add(new NetBenefitPointDTO(pt, model, treatAll, 0.0));
        }

        LOG.debugf("Decision curve at horizon %.1f, threshold %d: prevalence %.3f, TP=%d, FP=%d, n=%d",
                horizon, threshold, prevalence, truePositives, falsePositives, n);

        return new DecisionCurveDTO(threshold, n, prevalence, sensitivity, specificity, points);
    }
}
