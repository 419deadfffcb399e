/* (C)2026 */
package com.ammann.riskscore.service;

import com.ammann.riskscore.dto.ConfidenceIntervalDTO;
import com.ammann.riskscore.dto.OddsRatioDTO;
import com.ammann.riskscore.dto.RiskCategorySummaryDTO;
import com.ammann.riskscore.dto.RiskStratificationDTO;
import com.ammann.riskscore.enumeration.OutcomeClass;
import com.ammann.riskscore.exception.InvalidPartitionException;
import com.ammann.riskscore.model.RiskCategory;
import com.ammann.riskscore.model.RiskPartition;
import com.ammann.riskscore.model.ScoredCohort;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.jboss.logging.Logger;

/**
 * Buckets scores into ordinal risk categories and compares adjacent categories.
 *
 * <p>Outcome rates use subjects evaluable at the horizon. Odds ratios compare each category
 * with the one below it; a 0.5 continuity correction is added to every cell when any cell of
 * the 2x2 table is empty. Confidence intervals use the Wald interval on the log odds ratio.
 */
@ApplicationScoped
public class RiskStratifier
{

    private static final Logger LOG = Logger.getLogger(RiskStratifier.class);

    static final double DEFAULT_CONFIDENCE_LEVEL = 0.95;

    private static final double CONTINUITY_CORRECTION = 0.5;

    public RiskStratificationDTO stratify(RiskPartition partition, ScoredCohort scored, double horizon)
    {
        return stratify(partition, scored, horizon, DEFAULT_CONFIDENCE_LEVEL);
    }

    /**
     * @throws InvalidPartitionException if the partition was built for a different maximum score
     */
    public RiskStratificationDTO stratify(RiskPartition partition,
                                          ScoredCohort scored,
                                          double horizon,
                                          double confidenceLevel)
    {
        if (partition.maxScore() != scored.maxScore()) {
            throw new InvalidPartitionException(String.format(
                    "Risk partition tiles [0, %d] but the score range is [0, %d]",
                    partition.maxScore(), scored.maxScore()));
        }
        if (!(confidenceLevel > 0.0 && confidenceLevel < 1.0)) {
            throw new IllegalArgumentException("Confidence level must be in (0, 1), got " + confidenceLevel);
        }

        int size = partition.categories().size();
        int[] subjects = new int[size];
        int[] events = new int[size];
        int censored = 0;

        for (int i = 0; i < scored.size(); i++) {
            OutcomeClass outcome = OutcomeClass.at(scored.subjects().get(i), horizon);
            if (!outcome.isEvaluable()) {
                censored++;
                continue;
            }
            int index = partition.indexOf(scored.score(i));
            subjects[index]++;
            if (outcome == OutcomeClass.CASE) events[index]++;
        }

        List<RiskCategorySummaryDTO> summaries = new ArrayList<>(size);
        for (int c = 0; c < size; c++) {
            RiskCategory category = partition.categories().get(c);
            double rate = subjects[c] == 0 ? 0.0 : (double) events[c] / subjects[c];
            summaries.add(new RiskCategorySummaryDTO(category.name(), category.lowerBound(), category.upperBound(),
                    subjects[c], events[c], rate));
            LOG.debugf("Category %s (%s): %d subjects, %d events, rate %.3f",
                    category.name(), category.rangeLabel(), subjects[c], events[c], rate);
        }

        double z = new NormalDistribution().inverseCumulativeProbability(1.0 - (1.0 - confidenceLevel) / 2.0);
        List<OddsRatioDTO> oddsRatios = new ArrayList<>(Math.max(0, size - 1));
        for (int c = 1; c < size; c++) {
            oddsRatios.add(oddsRatio(partition.categories().get(c - 1).name(), subjects[c - 1], events[c - 1],
                    partition.categories().get(c).name(), subjects[c], events[c], z, confidenceLevel));
        }

        return new RiskStratificationDTO(partition.maxScore(), partition.decisionThreshold(),
                summaries, oddsRatios, censored);
    }

    static OddsRatioDTO oddsRatio(String lowerName, int lowerSubjects, int lowerEvents,
                                  String higherName, int higherSubjects, int higherEvents,
                                  double z, double confidenceLevel)
    {
        double a = higherEvents;
        double b = higherSubjects - higherEvents;
        double c = lowerEvents;
        double d = lowerSubjects - lowerEvents;

        boolean corrected = a == 0 || b == 0 || c == 0 || d == 0;
        if (corrected) {
            a += CONTINUITY_CORRECTION;
            b += CONTINUITY_CORRECTION;
            c += CONTINUITY_CORRECTION;
            d += CONTINUITY_CORRECTION;
        }

        double logOr = Math.log((a * d) / (b * c));
        double se = Math.sqrt(1.0 / a + 1.0 / b + 1.0 / c + 1.0 / d);
        ConfidenceIntervalDTO interval = new ConfidenceIntervalDTO(
                Math.exp(logOr - z * se), Math.exp(logOr + z * se), confidenceLevel);

        return new OddsRatioDTO(lowerName, higherName, Math.exp(logOr), interval, corrected);
    }
}
