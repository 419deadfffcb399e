/* (C)2026 */
package com.ammann.riskscore.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ammann.riskscore.config.BootstrapSettings;
import com.ammann.riskscore.config.ValidationSettings;
import com.ammann.riskscore.dto.LandmarkValidationDTO;
import com.ammann.riskscore.enumeration.EvaluationStatus;
import com.ammann.riskscore.enumeration.PerformanceMetric;
import com.ammann.riskscore.exception.InsufficientDataException;
import com.ammann.riskscore.exception.UnstableBootstrapException;
import com.ammann.riskscore.exception.ValidationException;
import com.ammann.riskscore.model.Cohort;
import com.ammann.riskscore.model.Subject;
import com.ammann.riskscore.support.TestDataFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.jupiter.api.Test;

class ValidationPipelineServiceUnitTest {

    private static ValidationSettings settings(boolean deriveCutPoints) {
        return new ValidationSettings(List.of(3.0), List.of(30.0), List.of(PerformanceMetric.AUC, PerformanceMetric.BRIER),
                20, deriveCutPoints, 10, new BootstrapSettings(20, 0.05, 42L, 0.95, 1));
    }

    private static ValidationPipelineService pipeline(CohortStore store, BootstrapValidator validator,
                                                      ValidationSettings settings) {
        return new ValidationPipelineService(store, new LandmarkBuilder(), new ThresholdOptimizer(),
                new ScoreCalculator(), new TimeDependentRocService(), new ConcordanceService(),
                new CalibrationService(), new DecisionCurveService(), new RiskStratifier(),
                new SurvivalAnalysisService(), validator, TestDataFactory.definition(),
                TestDataFactory.partition(), settings);
    }

    @Test
    void runWithoutLoadedCohortFails() {
        CohortStore store = mock(CohortStore.class);
        when(store.current()).thenReturn(Optional.empty());
        BootstrapValidator validator = mock(BootstrapValidator.class);

        assertThatThrownBy(() -> pipeline(store, validator, settings(true)).run())
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("No cohort loaded");
        verify(validator, never()).validate(any(), any(), any(), any(), any());
    }

    @Test
    void unstableBootstrapAbortsTheRun() {
        BootstrapValidator validator = mock(BootstrapValidator.class);
        when(validator.validate(any(), any(), any(), any(), any())).thenThrow(
                new UnstableBootstrapException("AUC", 20, 5, 5, 0.05, Map.of("NON_EVALUABLE", 5L)));
        Cohort cohort = TestDataFactory.syntheticCohort(200, 21L);

        assertThatThrownBy(() -> pipeline(new CohortStore(), validator, settings(false)).run(cohort))
                .isInstanceOf(UnstableBootstrapException.class)
                .hasMessageContaining("AUC");
    }

    @Test
    void metricNotEvaluableOnOriginalCohortIsOmitted() {
        BootstrapValidator validator = mock(BootstrapValidator.class);
        when(validator.validate(any(), any(), any(), any(), any()))
                .thenThrow(new InsufficientDataException("not evaluable", 0, 0));
        Cohort cohort = TestDataFactory.syntheticCohort(200, 21L);

        LandmarkValidationDTO cell = pipeline(new CohortStore(), validator, settings(false))
                .runCell(cohort, 3.0, 30.0);

        assertThat(cell.status()).isEqualTo(EvaluationStatus.EVALUATED);
        assertThat(cell.bootstrapReports()).isEmpty();
    }

    @Test
    void configuredCutPointsAreKeptWhenDerivationIsDisabled() {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            BootstrapValidator validator = new BootstrapValidator(executor, null);
            Cohort cohort = TestDataFactory.syntheticCohort(250, 8L);

            LandmarkValidationDTO cell = pipeline(new CohortStore(), validator, settings(false))
                    .runCell(cohort, 3.0, 30.0);

            assertThat(cell.thresholds()).isEmpty();
            assertThat(cell.bootstrapReports()).hasSize(2);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void scoringExclusionIsLoggedPerSubjectAtWarn() {
        BootstrapValidator validator = mock(BootstrapValidator.class);
        when(validator.validate(any(), any(), any(), any(), any()))
                .thenThrow(new InsufficientDataException("not evaluable", 0, 0));
        Cohort synthetic = TestDataFactory.syntheticCohort(200, 21L);
        List<Subject> subjects = new ArrayList<>(synthetic.subjects());
        Map<String, Double> noMeld = TestDataFactory.covariates(25, 50, 60, 100, false, false, false);
        noMeld.remove("MELD");
        subjects.add(TestDataFactory.subject("NO-MELD", 40.0, false, noMeld));
        Cohort cohort = new Cohort(TestDataFactory.schema(), subjects);

        List<LogRecord> records = new ArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        Logger logger = Logger.getLogger(ValidationPipelineService.class.getName());
        logger.addHandler(handler);
        try {
            LandmarkValidationDTO cell = pipeline(new CohortStore(), validator, settings(false))
                    .runCell(cohort, 3.0, 30.0);

            assertThat(cell.scoringExclusions()).isEqualTo(1);
        } finally {
            logger.removeHandler(handler);
        }

        assertThat(records)
                .filteredOn(r -> r.getLevel().intValue() >= Level.WARNING.intValue())
                .anySatisfy(r -> assertThat(formatted(r)).contains("NO-MELD").contains("MELD"));
    }

    private static String formatted(LogRecord record) {
        Object[] parameters = record.getParameters();
        if (parameters == null || parameters.length == 0) {
            return record.getMessage();
        }
        return String.format(record.getMessage(), parameters);
    }
}
