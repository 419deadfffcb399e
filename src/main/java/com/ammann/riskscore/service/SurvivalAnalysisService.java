/* (C)2026 */
package com.ammann.riskscore.service;

import com.ammann.riskscore.dto.ConfidenceIntervalDTO;
import com.ammann.riskscore.dto.KaplanMeierCurveDTO;
import com.ammann.riskscore.dto.LogRankResultDTO;
import com.ammann.riskscore.dto.SurvivalAnalysisDTO;
import com.ammann.riskscore.model.RiskPartition;
import com.ammann.riskscore.model.ScoredCohort;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.IntStream;
import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.jboss.logging.Logger;

/**
 * Kaplan-Meier survival per risk category and log-rank comparison of adjacent categories.
 */
@ApplicationScoped
public class SurvivalAnalysisService {

    private static final Logger LOG = Logger.getLogger(SurvivalAnalysisService.class);

    private static final ChiSquaredDistribution CHI_SQUARED_1 = new ChiSquaredDistribution(1);
    private static final double Z_95 = 1.959963984540054;

    public SurvivalAnalysisDTO analyze(RiskPartition partition, ScoredCohort scored) {
        int size = partition.categories().size();
        List<List<Integer>> members = new ArrayList<>(size);
        for (int c = 0; c < size; c++) members.add(new ArrayList<>());
        for (int i = 0; i < scored.size(); i++) {
            members.get(partition.indexOf(scored.score(i))).add(i);
        }

        double[] times = scored.times();
        boolean[] events = scored.events();
        List<Group> groups = new ArrayList<>(size);
        List<KaplanMeierCurveDTO> curves = new ArrayList<>(size);
        for (int c = 0; c < size; c++) {
            Group group = Group.of(members.get(c), times, events);
            groups.add(group);
            curves.add(kaplanMeier(partition.categories().get(c).name(), group));
        }

        List<LogRankResultDTO> comparisons = new ArrayList<>(Math.max(0, size - 1));
        for (int c = 1; c < size; c++) {
            comparisons.add(logRank(partition.categories().get(c - 1).name(), groups.get(c - 1),
                    partition.categories().get(c).name(), groups.get(c)));
        }
        return new SurvivalAnalysisDTO(curves, comparisons);
    }

    /**
     * Product-limit estimate starting at {@code (0, 1)} with one step per distinct event time.
     */
    static KaplanMeierCurveDTO kaplanMeier(String category, Group group) {
        List<Double> stepTimes = new ArrayList<>();
        List<Double> survival = new ArrayList<>();
        List<Integer> atRisk = new ArrayList<>();
        stepTimes.add(0.0);
        survival.add(1.0);
        atRisk.add(group.size());

        double s = 1.0;
        for (double t : group.eventTimes()) {
            int n = group.atRisk(t);
            int d = group.eventsAt(t);
            s *= 1.0 - (double) d / n;
            stepTimes.add(t);
            survival.add(s);
            atRisk.add(n);
        }
        return new KaplanMeierCurveDTO(category, group.size(), group.eventCount(), stepTimes, survival, atRisk);
    }

    /**
     * Log-rank test of two groups. The hazard ratio is that of the second group relative to the
     * first. Fields are absent when a group is empty or has no expected events.
     */
    static LogRankResultDTO logRank(String firstName, Group first, String secondName, Group second) {
        if (first.size() == 0 || second.size() == 0) {
            return new LogRankResultDTO(firstName, secondName, null, null, null, null);
        }

        TreeSet<Double> allTimes = new TreeSet<>();
        for (double t : first.eventTimes()) allTimes.add(t);
        for (double t : second.eventTimes()) allTimes.add(t);

        double d1 = 0, d2 = 0, e1 = 0, e2 = 0;
        for (double t : allTimes) {
            double n1 = first.atRisk(t);
            double n2 = second.atRisk(t);
            double d1t = first.eventsAt(t);
            double d2t = second.eventsAt(t);
            d1 += d1t;
            d2 += d2t;
            double pooled = (d1t + d2t) / (n1 + n2);
            e1 += pooled * n1;
            e2 += pooled * n2;
        }

        if (e1 <= 0.0 || e2 <= 0.0) {
            LOG.debugf("Log-rank %s vs %s undefined: expected events %.2f / %.2f", firstName, secondName, e1, e2);
            return new LogRankResultDTO(firstName, secondName, null, null, null, null);
        }

        double statistic = (d1 - e1) * (d1 - e1) / e1 + (d2 - e2) * (d2 - e2) / e2;
        double pValue = 1.0 - CHI_SQUARED_1.cumulativeProbability(statistic);

        double hazardRatio = (d2 / e2) / (d1 / e1);
        ConfidenceIntervalDTO interval = null;
        if (hazardRatio > 0.0 && Double.isFinite(hazardRatio)) {
            double se = Math.sqrt(1.0 / e1 + 1.0 / e2);
            double log = Math.log(hazardRatio);
            interval = new ConfidenceIntervalDTO(Math.exp(log - Z_95 * se), Math.exp(log + Z_95 * se), 0.95);
        }

        LOG.debugf("Log-rank %s vs %s: chi2=%.3f, p=%.4f, HR=%.3f", firstName, secondName, statistic, pValue, hazardRatio);
        return new LogRankResultDTO(firstName, secondName, statistic, pValue, hazardRatio, interval);
    }

    /**
     * Survival data of one category, sorted by time.
     */
    static final class Group {

        private final double[] times;
        private final boolean[] events;

        private Group(double[] times, boolean[] events) {
            this.times = times;
            this.events = events;
        }

        static Group of(List<Integer> indices, double[] times, boolean[] events) {
            Integer[] order = indices.toArray(new Integer[0]);
            Arrays.sort(order, (a, b) -> Double.compare(times[a], times[b]));
            double[] t = new double[order.length];
            boolean[] e = new boolean[order.length];
            for (int k = 0; k < order.length; k++) {
                t[k] = times[order[k]];
                e[k] = events[order[k]];
            }
            return new Group(t, e);
        }

        int size() {
            return times.length;
        }

        int eventCount() {
            int count = 0;
            for (boolean event : events) if (event) count++;
            return count;
        }

        /** Distinct times with at least one event, ascending. */
        double[] eventTimes() {
            return IntStream.range(0, times.length)
                    .filter(i -> events[i])
                    .mapToDouble(i -> times[i])
                    .distinct()
                    .toArray();
        }

        int atRisk(double time) {
            int first = 0;
            while (first < times.length && times[first] < time) first++;
            return times.length - first;
        }

        int eventsAt(double time) {
            int count = 0;
            for (int i = 0; i < times.length; i++) {
                if (events[i] && times[i] == time) count++;
            }
            return count;
        }
    }
}
