/* (C)2026 */
package com.ammann.riskscore.service;

import static com.ammann.riskscore.support.TestDataFactory.outcome;
import static com.ammann.riskscore.support.TestDataFactory.partition;
import static com.ammann.riskscore.support.TestDataFactory.scored;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.riskscore.dto.OddsRatioDTO;
import com.ammann.riskscore.dto.RiskCategorySummaryDTO;
import com.ammann.riskscore.dto.RiskStratificationDTO;
import com.ammann.riskscore.exception.InvalidPartitionException;
import com.ammann.riskscore.model.ScoredCohort;
import java.util.List;
import org.junit.jupiter.api.Test;

class RiskStratifierTest
{

    private static final double Z_95 = 1.959963984540054;

    private final RiskStratifier stratifier = new RiskStratifier();

    @Test
    void oddsRatioWithoutEmptyCells()
    {
        OddsRatioDTO result = RiskStratifier.oddsRatio("LOW", 4, 1, "MEDIUM", 4, 2, Z_95, 0.95);

        assertThat(result.oddsRatio()).isCloseTo(3.0, within(1e-12));
        assertThat(result.continuityCorrected()).isFalse();
        assertThat(result.confidenceInterval().lower()).isLessThan(3.0);
        assertThat(result.confidenceInterval().upper()).isGreaterThan(3.0);
        // Wald interval is symmetric on the log scale
        assertThat(Math.log(result.confidenceInterval().lower()) + Math.log(result.confidenceInterval().upper()))
                .isCloseTo(2 * Math.log(3.0), within(1e-9));
    }

    @Test
    void emptyCellTriggersContinuityCorrection()
    {
        OddsRatioDTO result = RiskStratifier.oddsRatio("LOW", 4, 0, "MEDIUM", 4, 2, Z_95, 0.95);

        // (2.5 * 4.5) / (2.5 * 0.5)
        assertThat(result.oddsRatio()).isCloseTo(9.0, within(1e-12));
        assertThat(result.continuityCorrected()).isTrue();
        assertThat(result.confidenceInterval().lower()).isPositive();
        assertThat(result.confidenceInterval().upper()).isFinite();
    }

    @Test
    void stratifiesEvaluableSubjects()
    {
        ScoredCohort scored = scored(List.of(
                        outcome("L1", 10, true),
                        outcome("L2", 40, false),
                        outcome("L3", 60, false),
                        outcome("L4", 90, false),
                        outcome("M1", 5, true),
                        outcome("M2", 12, true),
                        outcome("M3", 50, false),
                        outcome("M4", 80, false),
                        outcome("H1", 2, true),
                        outcome("H2", 6, true),
                        outcome("H3", 14, false)),
                0, 1, 1, 0, 2, 2, 2, 2, 3, 8, 5);

        RiskStratificationDTO result = stratifier.stratify(partition(), scored, 30.0);

        assertThat(result.maxScore()).isEqualTo(8);
        assertThat(result.decisionThreshold()).isEqualTo(3);
        assertThat(result.excludedCensored()).isEqualTo(1);
        assertThat(result.categories()).extracting(RiskCategorySummaryDTO::category)
                .containsExactly("LOW", "MEDIUM", "HIGH");
        assertThat(result.categories()).extracting(RiskCategorySummaryDTO::subjects).containsExactly(4, 4, 2);
        assertThat(result.categories()).extracting(RiskCategorySummaryDTO::events).containsExactly(1, 2, 2);
        assertThat(result.categories()).extracting(RiskCategorySummaryDTO::outcomeRate)
                .containsExactly(0.25, 0.5, 1.0);

        assertThat(result.adjacentOddsRatios()).hasSize(2);
        OddsRatioDTO lowMedium = result.adjacentOddsRatios().get(0);
        assertThat(lowMedium.lowerCategory()).isEqualTo("LOW");
        assertThat(lowMedium.higherCategory()).isEqualTo("MEDIUM");
        assertThat(lowMedium.oddsRatio()).isCloseTo(3.0, within(1e-12));
        assertThat(result.adjacentOddsRatios().get(1).continuityCorrected()).isTrue();
    }

    @Test
    void emptyCategoryHasZeroRate()
    {
        ScoredCohort scored = scored(List.of(outcome("L1", 10, true), outcome("L2", 40, false)), 0, 1);

        RiskStratificationDTO result = stratifier.stratify(partition(), scored, 30.0);

        assertThat(result.categories().get(2).subjects()).isZero();
        assertThat(result.categories().get(2).outcomeRate()).isZero();
    }

    @Test
    void partitionForDifferentMaximumIsRejected()
    {
        ScoredCohort scored = new ScoredCohort(List.of(outcome("A", 10, true)), new int[] {1}, 7, List.of());

        assertThatThrownBy(() -> stratifier.stratify(partition(), scored, 30.0))
                .isInstanceOf(InvalidPartitionException.class)
                .hasMessageContaining("[0, 8]")
                .hasMessageContaining("[0, 7]");
    }

    @Test
    void confidenceLevelMustBeAProbability()
    {
        ScoredCohort scored = scored(List.of(outcome("A", 10, true)), 1);

        assertThatThrownBy(() -> stratifier.stratify(partition(), scored, 30.0, 1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
