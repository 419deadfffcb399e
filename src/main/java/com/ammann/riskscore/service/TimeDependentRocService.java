/* (C)2026 */
package com.ammann.riskscore.service;

import com.ammann.riskscore.dto.RocPointDTO;
import com.ammann.riskscore.dto.RocResultDTO;
import com.ammann.riskscore.enumeration.OutcomeClass;
import com.ammann.riskscore.model.ScoredCohort;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;
import org.jboss.logging.Logger;

/**
 * Cumulative/dynamic time-dependent ROC analysis of an integer score.
 *
 * <p>At horizon {@code h} a case is a subject with an event at {@code t <= h}, a control a
 * subject still under observation at {@code t > h}. Subjects censored without an event at
 * {@code t <= h} are left out. A subject scoring at least {@code c} is called positive.
 *
 * <p>The curve is anchored at {@code (0, 0)} by a threshold one above the highest observed
 * score and always ends at {@code (1, 1)}; the AUC is the trapezoidal area under it.
 */
@ApplicationScoped
public class TimeDependentRocService {

    private static final Logger LOG = Logger.getLogger(TimeDependentRocService.class);

    /**
     * Computes the ROC curve of the cohort's scores at the given horizon.
     *
     * @return the curve, or empty when there are no cases or no controls at the horizon
     */
    public Optional<RocResultDTO> compute(ScoredCohort scored, double landmarkDay, double horizon) {
        // score -> {cases, controls} with that score
        TreeMap<Integer, int[]> counts = new TreeMap<>();
        int cases = 0;
        int controls = 0;
        int censored = 0;

        for (int i = 0; i < scored.size(); i++) {
            OutcomeClass outcome = OutcomeClass.at(scored.subjects().get(i), horizon);
            if (outcome == OutcomeClass.CENSORED) {
                censored++;
                continue;
            }
            int[] cell = counts.computeIfAbsent(scored.score(i), s -> new int[2]);
            if (outcome == OutcomeClass.CASE) {
                cell[0]++;
                cases++;
            } else {
                cell[1]++;
                controls++;
            }
        }

        if (cases == 0 || controls == 0) {
            LOG.debugf("ROC at landmark %.1f horizon %.1f not evaluable: %d cases, %d controls, %d censored",
                    landmarkDay, horizon, cases, controls, censored);
            return Optional.empty();
        }

        List<RocPointDTO> points = new ArrayList<>(counts.size() + 1);
        points.add(new RocPointDTO(counts.lastKey() + 1, 0.0, 1.0));

        int truePositives = 0;
        int falsePositives = 0;
        double auc = 0.0;
        double previousTpr = 0.0;
        double previousFpr = 0.0;

        RocPointDTO optimal = null;

        for (var entry : counts.descendingMap().entrySet()) {
            truePositives += entry.getValue()[0];
            falsePositives += entry.getValue()[1];

            double sensitivity = (double) truePositives / cases;
            double specificity = 1.0 - (double) falsePositives / controls;
            RocPointDTO point = new RocPointDTO(entry.getKey(), sensitivity, specificity);
            points.add(point);

            double fpr = point.falsePositiveRate();
            auc += (fpr - previousFpr) * (sensitivity + previousTpr) / 2.0;
            previousFpr = fpr;
            previousTpr = sensitivity;

            // strictly greater keeps the higher threshold on ties
            if (optimal == null || point.youdenIndex() > optimal.youdenIndex()) {
                optimal = point;
            }
        }

        LOG.debugf("ROC at landmark %.1f horizon %.1f: AUC=%.3f (%d cases, %d controls, %d censored)",
                landmarkDay, horizon, auc, cases, controls, censored);

        return Optional.of(new RocResultDTO(landmarkDay, horizon, cases, controls, censored, points, auc,
                optimal.threshold(), optimal.sensitivity(), optimal.specificity()));
    }

    /**
     * AUC only, used as the bootstrap performance measure.
     */
    public OptionalDouble auc(ScoredCohort scored, double horizon) {
        return compute(scored, 0.0, horizon)
                .map(roc -> OptionalDouble.of(roc.auc()))
                .orElseGet(OptionalDouble::empty);
    }
}
