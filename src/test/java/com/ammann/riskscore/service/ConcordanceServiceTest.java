/* (C)2026 */
package com.ammann.riskscore.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.SplittableRandom;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

class ConcordanceServiceTest
{

    private final ConcordanceService service = new ConcordanceService();

    @Test
    void perfectRankingGivesOne()
    {
        int[] scores = {8, 5, 3, 1};
        double[] times = {2, 5, 9, 20};
        boolean[] events = {true, true, true, false};

        assertThat(service.concordanceIndex(scores, times, events)).hasValue(1.0);
    }

    @Test
    void tiedScoresCountHalf()
    {
        int[] scores = {2, 2};
        double[] times = {1, 5};
        boolean[] events = {true, false};

        assertThat(service.concordanceIndex(scores, times, events)).hasValue(0.5);
    }

    @Test
    void pairsWithEqualTimesAreNotComparable()
    {
        int[] scores = {1, 5, 3};
        double[] times = {4, 4, 10};
        boolean[] events = {true, true, false};

        // only (0,2) and (1,2) are comparable; (1,2) is concordant, (0,2) discordant
        assertThat(service.concordanceIndex(scores, times, events)).hasValue(0.5);
    }

    @Test
    void noEventsMeansNoComparablePairs()
    {
        int[] scores = {1, 2, 3};
        double[] times = {4, 5, 6};
        boolean[] events = {false, false, false};

        assertThat(service.concordanceIndex(scores, times, events)).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 2L, 3L, 42L, 1234L})
    void matchesPairwiseCountingOnTiedRandomData(long seed)
    {
        SplittableRandom random = new SplittableRandom(seed);
        int n = 150;
        int[] scores = new int[n];
        double[] times = new double[n];
        boolean[] events = new boolean[n];
        for (int i = 0; i < n; i++) {
            scores[i] = random.nextInt(9);
            times[i] = 1 + random.nextInt(40);
            events[i] = random.nextDouble() < 0.4;
        }

        assertThat(service.concordanceIndex(scores, times, events).getAsDouble())
                .isCloseTo(bruteForce(scores, times, events), within(1e-12));
    }

    private static double bruteForce(int[] scores, double[] times, boolean[] events)
    {
        long comparable = 0;
        double concordant = 0;
        for (int i = 0; i < scores.length; i++) {
            for (int j = 0; j < scores.length; j++) {
                if (events[i] && times[i] < times[j]) {
                    comparable++;
                    if (scores[i] > scores[j]) concordant += 1.0;
                    else if (scores[i] == scores[j]) concordant += 0.5;
                }
            }
        }
        return concordant / comparable;
    }
}
