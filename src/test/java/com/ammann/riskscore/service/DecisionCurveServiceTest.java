/* (C)2026 */
package com.ammann.riskscore.service;

import static com.ammann.riskscore.support.TestDataFactory.outcome;
import static com.ammann.riskscore.support.TestDataFactory.partition;
import static com.ammann.riskscore.support.TestDataFactory.scored;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.riskscore.dto.DecisionCurveDTO;
import com.ammann.riskscore.dto.NetBenefitPointDTO;
import com.ammann.riskscore.exception.InsufficientDataException;
import com.ammann.riskscore.model.ScoredCohort;
import java.util.List;
import org.junit.jupiter.api.Test;

class DecisionCurveServiceTest {

    private final DecisionCurveService service = new DecisionCurveService();

    // three cases (two high risk), four controls (one high risk), one censored
    private static ScoredCohort cohort() {
        return scored(List.of(
                        outcome("C1", 4, true),
                        outcome("C2", 9, true),
                        outcome("C3", 20, true),
                        outcome("K1", 60, false),
                        outcome("K2", 75, true),
                        outcome("K3", 90, false),
                        outcome("K4", 120, false),
                        outcome("X1", 10, false)),
                5, 3, 1, 4, 0, 2, 1, 8);
    }

    @Test
    void usesPartitionDecisionThreshold() {
        DecisionCurveDTO curve = service.analyze(partition(), cohort(), 30.0);

        assertThat(curve.decisionThreshold()).isEqualTo(3);
        assertThat(curve.subjects()).isEqualTo(7);
        assertThat(curve.prevalence()).isCloseTo(3.0 / 7.0, within(1e-12));
        assertThat(curve.sensitivity()).isCloseTo(2.0 / 3.0, within(1e-12));
        assertThat(curve.specificity()).isCloseTo(0.75, within(1e-12));
    }

    @Test
    void gridCoversOnePercentToNinetyNinePercent() {
        List<NetBenefitPointDTO> points = service.analyze(partition(), cohort(), 30.0).points();

        assertThat(points).hasSize(99);
        assertThat(points.get(0).thresholdProbability()).isEqualTo(0.01);
        assertThat(points.get(98).thresholdProbability()).isEqualTo(0.99);
        assertThat(points).allSatisfy(p -> assertThat(p.treatNoneNetBenefit()).isZero());
    }

    @Test
    void netBenefitAtEvenOdds() {
        NetBenefitPointDTO half = service.analyze(partition(), cohort(), 30.0).points().stream()
                .filter(p -> p.thresholdProbability() == 0.5)
                .findFirst()
                .orElseThrow();

        assertThat(half.modelNetBenefit()).isCloseTo(1.0 / 7.0, within(1e-12));
        assertThat(half.treatAllNetBenefit()).isCloseTo(-1.0 / 7.0, within(1e-12));
    }

    @Test
    void treatAllEqualsPrevalenceAtLowestThreshold() {
        DecisionCurveDTO curve = service.analyze(partition(), cohort(), 30.0);
        double prevalence = 3.0 / 7.0;

        assertThat(curve.points().get(0).treatAllNetBenefit())
                .isCloseTo(prevalence - (1 - prevalence) * (0.01 / 0.99), within(1e-12));
    }

    @Test
    void sensitivityUndefinedWithoutCases() {
        ScoredCohort controlsOnly = scored(List.of(outcome("K1", 60, false), outcome("K2", 80, false)), 1, 4);

        DecisionCurveDTO curve = service.analyze(partition(), controlsOnly, 30.0);

        assertThat(curve.sensitivity()).isNaN();
        assertThat(curve.specificity()).isEqualTo(0.5);
    }

    @Test
    void noEvaluableSubjectIsInsufficientData() {
        ScoredCohort censored = scored(List.of(outcome("X", 5, false)), 2);

        assertThatThrownBy(() -> service.analyze(partition(), censored, 30.0))
                .isInstanceOf(InsufficientDataException.class);
    }
}
