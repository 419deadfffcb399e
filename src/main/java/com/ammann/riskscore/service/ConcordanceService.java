/* (C)2026 */
package com.ammann.riskscore.service;

import com.ammann.riskscore.model.ScoredCohort;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Arrays;
import java.util.OptionalDouble;
import org.jboss.logging.Logger;

/**
 * Harrell's concordance index for right-censored data.
 *
 * <p>A pair is comparable when the subject with the shorter follow-up had the event. It is
 * concordant when that subject also has the higher score; equal scores count one half.
 * Pairs are counted with a Fenwick tree over rank-compressed scores in O(n log n).
 */
@ApplicationScoped
public class ConcordanceService {

    private static final Logger LOG = Logger.getLogger(ConcordanceService.class);

    /**
     * @return the C-index, or empty when the cohort has no comparable pair
     */
    public OptionalDouble concordanceIndex(ScoredCohort scored) {
        return concordanceIndex(scored.scores(), scored.times(), scored.events());
    }

    public OptionalDouble concordanceIndex(int[] scores, double[] times, boolean[] events) {
        int n = scores.length;
        if (times.length != n || events.length != n) {
            throw new IllegalArgumentException("scores, times and events must have the same length");
        }

        int[] distinct = Arrays.stream(scores).distinct().sorted().toArray();
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) order[i] = i;
        Arrays.sort(order, (a, b) -> Double.compare(times[b], times[a]));

        FenwickTree tree = new FenwickTree(distinct.length);
        long comparable = 0;
        double concordant = 0.0;
        int added = 0;

        int start = 0;
        while (start < n) {
            int end = start;
            while (end < n && times[order[end]] == times[order[start]]) end++;

            // subjects already in the tree have a strictly longer follow-up
            for (int k = start; k < end; k++) {
                int idx = order[k];
                if (!events[idx]) continue;
                int rank = Arrays.binarySearch(distinct, scores[idx]) + 1;
                long lower = tree.prefixSum(rank - 1);
                long equal = tree.prefixSum(rank) - lower;
                comparable += added;
                concordant += lower + 0.5 * equal;
            }
            for (int k = start; k < end; k++) {
                tree.add(Arrays.binarySearch(distinct, scores[order[k]]) + 1);
                added++;
            }
            start = end;
        }

        if (comparable == 0) {
            LOG.debug("No comparable pairs, C-index undefined");
            return OptionalDouble.empty();
        }

        double index = concordant / comparable;
        LOG.debugf("C-index %.4f over %d comparable pairs", index, comparable);
        return OptionalDouble.of(index);
    }

    private static final class FenwickTree {

        private final long[] tree;

        FenwickTree(int size) {
            this.tree = new long[size + 1];
        }

        void add(int position) {
            for (int i = position; i < tree.length; i += i & -i) {
                tree[i]++;
            }
        }

        long prefixSum(int position) {
            long sum = 0;
            for (int i = position; i > 0; i -= i & -i) {
                sum += tree[i];
            }
            return sum;
        }
    }
}
