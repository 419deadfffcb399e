/* (C)2026 */
package com.ammann.riskscore.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.riskscore.exception.InvalidPartitionException;
import com.ammann.riskscore.support.TestDataFactory;
import java.util.List;
import org.junit.jupiter.api.Test;

class RiskPartitionTest {

    @Test
    void everyScoreFallsInExactlyOneCategory() {
        RiskPartition partition = TestDataFactory.partition();

        for (int score = 0; score <= 8; score++) {
            int s = score;
            assertThat(partition.categories().stream().filter(c -> c.contains(s)).count()).isEqualTo(1);
        }
        assertThat(partition.categoryOf(0).name()).isEqualTo("LOW");
        assertThat(partition.categoryOf(2).name()).isEqualTo("MEDIUM");
        assertThat(partition.categoryOf(8).name()).isEqualTo("HIGH");
        assertThat(partition.indexOf(5)).isEqualTo(2);
    }

    @Test
    void decisionThresholdIsLowerBoundOfHighestCategory() {
        assertThat(TestDataFactory.partition().decisionThreshold()).isEqualTo(3);
    }

    @Test
    void gapIsRejected() {
        assertThatThrownBy(() -> RiskPartition.of(List.of(
                new RiskCategory("LOW", 0, 1),
                new RiskCategory("HIGH", 3, 8)), 8))
                .isInstanceOf(InvalidPartitionException.class)
                .hasMessageContaining("gap");
    }

    @Test
    void overlapIsRejected() {
        assertThatThrownBy(() -> RiskPartition.of(List.of(
                new RiskCategory("LOW", 0, 2),
                new RiskCategory("HIGH", 2, 8)), 8))
                .isInstanceOf(InvalidPartitionException.class)
                .hasMessageContaining("overlap");
    }

    @Test
    void partitionMustEndAtMaximumScore() {
        assertThatThrownBy(() -> RiskPartition.of(List.of(
                new RiskCategory("LOW", 0, 1),
                new RiskCategory("MEDIUM", 2, 2),
                new RiskCategory("HIGH", 3, 7)), 8))
                .isInstanceOf(InvalidPartitionException.class)
                .hasMessageContaining("maximum 8");
    }

    @Test
    void partitionMustStartAtZero() {
        assertThatThrownBy(() -> RiskPartition.of(List.of(new RiskCategory("ALL", 1, 8)), 8))
                .isInstanceOf(InvalidPartitionException.class);
    }

    @Test
    void duplicateNamesAreRejected() {
        assertThatThrownBy(() -> RiskPartition.of(List.of(
                new RiskCategory("LOW", 0, 3),
                new RiskCategory("LOW", 4, 8)), 8))
                .isInstanceOf(InvalidPartitionException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void emptyPartitionIsRejected() {
        assertThatThrownBy(() -> RiskPartition.of(List.of(), 8))
                .isInstanceOf(InvalidPartitionException.class);
    }

    @Test
    void scoreOutsideScaleIsRejected() {
        assertThatThrownBy(() -> TestDataFactory.partition().categoryOf(9))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void alternativeHighRiskBoundaryMovesDecisionThreshold() {
        RiskPartition partition = RiskPartition.of(List.of(
                new RiskCategory("LOW", 0, 1),
                new RiskCategory("MEDIUM", 2, 3),
                new RiskCategory("HIGH", 4, 8)), 8);

        assertThat(partition.decisionThreshold()).isEqualTo(4);
        assertThat(partition.categoryOf(3).rangeLabel()).isEqualTo("2-3");
    }
}
