/* (C)2026 */
package com.ammann.riskscore.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.riskscore.enumeration.ComponentType;
import com.ammann.riskscore.enumeration.CovariateType;
import com.ammann.riskscore.enumeration.Direction;
import com.ammann.riskscore.enumeration.PerformanceMetric;
import com.ammann.riskscore.exception.ValidationException;
import com.ammann.riskscore.model.CovariateDefinition;
import com.ammann.riskscore.model.CovariateSchema;
import com.ammann.riskscore.model.RiskCategory;
import com.ammann.riskscore.model.ScoreComponent;
import com.ammann.riskscore.model.ScoreDefinition;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ScoreConfigurationParserTest {

    @Test
    void parsesNumericCovariateWithRange() {
        CovariateDefinition meld = ScoreConfigurationParser.parseCovariate("MELD:NUMERIC:6:40");

        assertThat(meld.name()).isEqualTo("MELD");
        assertThat(meld.type()).isEqualTo(CovariateType.NUMERIC);
        assertThat(meld.min()).isEqualTo(6.0);
        assertThat(meld.max()).isEqualTo(40.0);
    }

    @Test
    void parsesUnboundedAndBooleanCovariates() {
        CovariateDefinition lactate = ScoreConfigurationParser.parseCovariate(" LACTATE : numeric ");
        CovariateDefinition hcc = ScoreConfigurationParser.parseCovariate("HCC:BOOLEAN");

        assertThat(lactate.min()).isNull();
        assertThat(lactate.max()).isNull();
        assertThat(lactate.isInRange(1e6)).isTrue();
        assertThat(hcc.type()).isEqualTo(CovariateType.BOOLEAN);
    }

    @Test
    void schemaKeepsDeclarationOrder() {
        CovariateSchema schema = ScoreConfigurationParser.parseSchema(
                List.of("MELD:NUMERIC:6:40", "HCC:BOOLEAN", "AGE:NUMERIC:18:80"));

        assertThat(schema.names()).containsExactly("MELD", "HCC", "AGE");
    }

    @Test
    void duplicateCovariateIsAValidationError() {
        assertThatThrownBy(() -> ScoreConfigurationParser.parseSchema(List.of("HCC:BOOLEAN", "HCC:BOOLEAN")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Duplicate");
    }

    @ParameterizedTest
    @ValueSource(strings = {"MELD", "MELD:TEXT", "MELD:NUMERIC:6", "MELD:NUMERIC:a:40", "MELD:NUMERIC:40:6",
            "HCC:BOOLEAN:1", ":BOOLEAN", " "})
    void rejectsMalformedCovariates(String entry) {
        assertThatThrownBy(() -> ScoreConfigurationParser.parseCovariate(entry))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void parsesThresholdAndFlagComponents() {
        ScoreComponent meld = ScoreConfigurationParser.parseComponent("MELD:>:20:2");
        ScoreComponent platelets = ScoreConfigurationParser.parseComponent("PLATELETS:<:78:1");
        ScoreComponent hcc = ScoreConfigurationParser.parseComponent("HCC:flag:1");

        assertThat(meld.direction()).isEqualTo(Direction.GREATER);
        assertThat(meld.cutPoint()).isEqualTo(20.0);
        assertThat(meld.points()).isEqualTo(2);
        assertThat(platelets.direction()).isEqualTo(Direction.LESS);
        assertThat(hcc.type()).isEqualTo(ComponentType.FLAG);
        assertThat(hcc.points()).isEqualTo(1);
    }

    @Test
    void definitionCarriesMaximumScore() {
        ScoreDefinition definition = ScoreConfigurationParser.parseDefinition(List.of(
                "MELD:>:20:2", "SAPS_II:>:42:1", "AGE:>:52:1", "PLATELETS:<:78:1",
                "HCC:FLAG:1", "CVVHD:FLAG:1", "VHF:FLAG:1"));

        assertThat(definition.maxScore()).isEqualTo(8);
    }

    @ParameterizedTest
    @ValueSource(strings = {"MELD:>=:20:2", "MELD:>:20", "MELD:>:20:0", "MELD:>:x:2", "HCC:FLAG:-1", "HCC:FLAG:one"})
    void rejectsMalformedComponents(String entry) {
        assertThatThrownBy(() -> ScoreConfigurationParser.parseComponent(entry))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void parsesCategories() {
        List<RiskCategory> categories = ScoreConfigurationParser.parseCategories(
                List.of("LOW:0-1", "MEDIUM:2-2", "HIGH:3-8"));

        assertThat(categories).containsExactly(
                new RiskCategory("LOW", 0, 1),
                new RiskCategory("MEDIUM", 2, 2),
                new RiskCategory("HIGH", 3, 8));
    }

    @ParameterizedTest
    @ValueSource(strings = {"LOW", "LOW:0", "LOW:0-1-2", "LOW:a-1"})
    void rejectsMalformedCategories(String entry) {
        assertThatThrownBy(() -> ScoreConfigurationParser.parseCategories(List.of(entry)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void parsesMetricsIgnoringCaseAndDuplicates() {
        assertThat(ScoreConfigurationParser.parseMetrics(List.of("auc", "C_INDEX", "AUC", "brier")))
                .containsExactly(PerformanceMetric.AUC, PerformanceMetric.C_INDEX, PerformanceMetric.BRIER);
    }

    @Test
    void unknownMetricIsRejected() {
        assertThatThrownBy(() -> ScoreConfigurationParser.parseMetrics(List.of("NRI")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("validation.bootstrap.metrics");
    }
}
