/* (C)2026 */
package com.ammann.riskscore.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import com.ammann.riskscore.dto.ThresholdDTO;
import com.ammann.riskscore.enumeration.Direction;
import com.ammann.riskscore.exception.InsufficientDataException;
import com.ammann.riskscore.exception.ValidationException;
import com.ammann.riskscore.model.Cohort;
import com.ammann.riskscore.model.Subject;
import com.ammann.riskscore.support.TestDataFactory;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ThresholdOptimizerTest
{

    private static final double[] MELD = {10, 15, 18, 22, 25, 30, 12, 28, 19, 35};

    private final ThresholdOptimizer optimizer = new ThresholdOptimizer();

    @Test
    void separableMeldCohortSplitsBetween19And20()
    {
        ThresholdDTO threshold = optimizer.findOptimalThreshold("MELD", MELD, deathIfMeldAtLeast20(), Direction.GREATER);

        assertThat(threshold.cutPoint()).isEqualTo(19.0);
        assertThat(threshold.direction()).isEqualTo(Direction.GREATER);
        assertThat(threshold.sensitivity()).isEqualTo(1.0);
        assertThat(threshold.specificity()).isEqualTo(1.0);
        assertThat(threshold.youdenIndex()).isEqualTo(1.0);
        assertThat(threshold.cases()).isEqualTo(5);
        assertThat(threshold.controls()).isEqualTo(5);
        assertThat(threshold.confidenceInterval()).isNull();

        assertThat(Direction.GREATER.isPositive(20, threshold.cutPoint())).isTrue();
        assertThat(Direction.GREATER.isPositive(19, threshold.cutPoint())).isFalse();
    }

    @Test
    void lessDirectionFindsUpperBoundOfLowValues()
    {
        double[] platelets = {50, 60, 70, 100, 150, 200};
        boolean[] bleeding = {true, true, true, false, false, false};

        ThresholdDTO threshold = optimizer.findOptimalThreshold("PLATELETS", platelets, bleeding, Direction.LESS);

        assertThat(threshold.cutPoint()).isEqualTo(100.0);
        assertThat(threshold.youdenIndex()).isEqualTo(1.0);
        assertThat(Direction.LESS.isPositive(70, threshold.cutPoint())).isTrue();
        assertThat(Direction.LESS.isPositive(100, threshold.cutPoint())).isFalse();
    }

    @Test
    void tiesResolveToCandidateClosestToMedian()
    {
        // cuts 1 and 3 both reach J = 0.5, the median is 2.5
        double[] values = {1, 2, 3, 4};
        boolean[] outcomes = {false, true, false, true};

        ThresholdDTO threshold = optimizer.findOptimalThreshold("X", values, outcomes, Direction.GREATER);

        assertThat(threshold.youdenIndex()).isCloseTo(0.5, within(1e-12));
        assertThat(threshold.cutPoint()).isEqualTo(3.0);
    }

    @Test
    void emptyOutcomeClassIsInsufficientData()
    {
        boolean[] noCases = new boolean[MELD.length];

        assertThatThrownBy(() -> optimizer.findOptimalThreshold("MELD", MELD, noCases, Direction.GREATER))
                .isInstanceOf(InsufficientDataException.class)
                .satisfies(e -> {
                    InsufficientDataException ex = (InsufficientDataException) e;
                    assertThat(ex.getCases()).isZero();
                    assertThat(ex.getControls()).isEqualTo(10);
                });
    }

    @Test
    void mismatchedLengthsAreRejected()
    {
        assertThatThrownBy(() -> optimizer.findOptimalThreshold("MELD", MELD, new boolean[3], Direction.GREATER))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @ValueSource(doubles = {Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY})
    void nonFiniteValueIsRejected(double bad)
    {
        double[] values = {10, 15, bad, 25};
        boolean[] outcomes = {false, false, true, true};

        assertTimeoutPreemptively(Duration.ofSeconds(5), () ->
                assertThatThrownBy(() -> optimizer.findOptimalThreshold("MELD", values, outcomes, Direction.GREATER))
                        .isInstanceOf(ValidationException.class)
                        .hasMessageContaining("MELD")
                        .hasMessageContaining("finite"));
    }

    @Test
    void bootstrapIntervalCoversPointEstimateAndIsReproducible()
    {
        ThresholdDTO first = optimizer.findOptimalThresholdWithConfidence(
                "MELD", MELD, deathIfMeldAtLeast20(), Direction.GREATER, 200, 7L, 0.95);
        ThresholdDTO second = optimizer.findOptimalThresholdWithConfidence(
                "MELD", MELD, deathIfMeldAtLeast20(), Direction.GREATER, 200, 7L, 0.95);

        assertThat(first.cutPoint()).isEqualTo(19.0);
        assertThat(first.confidenceInterval()).isNotNull();
        assertThat(first.confidenceInterval().lower()).isLessThanOrEqualTo(first.confidenceInterval().upper());
        assertThat(first.confidenceInterval().level()).isEqualTo(0.95);
        assertThat(first.resamplesUsed()).isPositive().isLessThanOrEqualTo(200);
        assertThat(second).isEqualTo(first);
    }

    @Test
    void cohortVariantLabelsByHorizonAndDropsCensored()
    {
        List<Subject> subjects = List.of(
                TestDataFactory.subject("case", 10, true, Map.of("MELD", 30.0)),
                TestDataFactory.subject("survivor", 50, false, Map.of("MELD", 10.0)),
                TestDataFactory.subject("late-death", 40, true, Map.of("MELD", 12.0)),
                TestDataFactory.subject("censored", 5, false, Map.of("MELD", 25.0)),
                TestDataFactory.subject("no-meld", 60, false, Map.of()));
        Cohort cohort = new Cohort(TestDataFactory.schema(), subjects);

        ThresholdDTO threshold = optimizer.findOptimalThreshold(cohort, "MELD", 30, Direction.GREATER);

        assertThat(threshold.cases()).isEqualTo(1);
        assertThat(threshold.controls()).isEqualTo(2);
        assertThat(threshold.cutPoint()).isEqualTo(12.0);
        assertThat(threshold.youdenIndex()).isEqualTo(1.0);
    }

    @Test
    void detectDirectionFollowsCaseMean()
    {
        assertThat(optimizer.detectDirection(MELD, deathIfMeldAtLeast20())).isEqualTo(Direction.GREATER);

        boolean[] inverted = deathIfMeldAtLeast20();
        for (int i = 0; i < inverted.length; i++) inverted[i] = !inverted[i];
        assertThat(optimizer.detectDirection(MELD, inverted)).isEqualTo(Direction.LESS);
    }

    private static boolean[] deathIfMeldAtLeast20()
    {
        boolean[] outcomes = new boolean[MELD.length];
        for (int i = 0; i < MELD.length; i++) {
            outcomes[i] = MELD[i] >= 20;
        }
        return outcomes;
    }
}
