/* (C)2026 */
package com.ammann.riskscore.config;

import com.ammann.riskscore.model.CovariateSchema;
import com.ammann.riskscore.model.RiskPartition;
import com.ammann.riskscore.model.ScoreDefinition;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * CDI producer turning the {@code risk-score.*} and {@code validation.*} configuration into
 * immutable beans.
 *
 * <p>The score definition is the single source of the maximum score: the risk partition is
 * validated against it here, so a partition that does not tile {@code [0, max]} fails at
 * startup instead of surfacing in a report.
 */
@ApplicationScoped
public class ValidationConfigProducer {

    private static final Logger LOG = Logger.getLogger(ValidationConfigProducer.class);

    @ConfigProperty(name = "risk-score.covariates")
    List<String> covariates;

    @ConfigProperty(name = "risk-score.components")
    List<String> components;

    @ConfigProperty(name = "risk-score.risk-categories")
    List<String> riskCategories;

    @ConfigProperty(name = "validation.landmark-days", defaultValue = "3,5,7")
    List<Double> landmarkDays;

    @ConfigProperty(name = "validation.horizons", defaultValue = "30,60,90")
    List<Double> horizons;

    @ConfigProperty(name = "validation.bootstrap.metrics", defaultValue = "AUC,C_INDEX,BRIER")
    List<String> metrics;

    @ConfigProperty(name = "validation.bootstrap.iterations", defaultValue = "1000")
    int iterations;

    @ConfigProperty(name = "validation.bootstrap.skip-tolerance", defaultValue = "0.05")
    double skipTolerance;

    @ConfigProperty(name = "validation.bootstrap.seed", defaultValue = "42")
    long seed;

    @ConfigProperty(name = "validation.bootstrap.confidence-level", defaultValue = "0.95")
    double confidenceLevel;

    @ConfigProperty(name = "validation.bootstrap.parallelism", defaultValue = "4")
    int parallelism;

    @ConfigProperty(name = "validation.threshold.bootstrap-iterations", defaultValue = "1000")
    int thresholdIterations;

    @ConfigProperty(name = "validation.derive-cut-points", defaultValue = "true")
    boolean deriveCutPoints;

    @ConfigProperty(name = "validation.calibration.bins", defaultValue = "10")
    int calibrationBins;

    @Produces
    @Singleton
    public CovariateSchema covariateSchema() {
        CovariateSchema schema = ScoreConfigurationParser.parseSchema(covariates);
        LOG.debugf("Covariate schema: %s", schema);
        return schema;
    }

    @Produces
    @Singleton
    public ScoreDefinition scoreDefinition() {
        ScoreDefinition definition = ScoreConfigurationParser.parseDefinition(components);
        LOG.debugf("Score definition: %s (max %d)", definition, definition.maxScore());
        return definition;
    }

    @Produces
    @Singleton
    public RiskPartition riskPartition(ScoreDefinition definition) {
        return RiskPartition.of(ScoreConfigurationParser.parseCategories(riskCategories), definition.maxScore());
    }

    @Produces
    @Singleton
    public ValidationSettings validationSettings() {
        BootstrapSettings bootstrap = new BootstrapSettings(iterations, skipTolerance, seed, confidenceLevel, parallelism);
        return new ValidationSettings(landmarkDays, horizons, ScoreConfigurationParser.parseMetrics(metrics),
                thresholdIterations, deriveCutPoints, calibrationBins, bootstrap);
    }
}
