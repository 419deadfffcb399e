/* (C)2026 */
package com.ammann.riskscore.startup;

import com.ammann.riskscore.config.ValidationSettings;
import com.ammann.riskscore.model.CovariateSchema;
import com.ammann.riskscore.model.RiskCategory;
import com.ammann.riskscore.model.RiskPartition;
import com.ammann.riskscore.model.ScoreDefinition;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Validates the scoring configuration on application startup.
 * <p>
 * The score definition must reference exactly the covariates of the schema with matching
 * types, and the risk partition must tile {@code [0, max]} of that definition. Any defect
 * aborts startup; nothing is corrected silently.
 */
@ApplicationScoped
public class ScoringConfigurationCheck {

    private static final Logger LOG = Logger.getLogger(ScoringConfigurationCheck.class);

    @Inject CovariateSchema schema;

    @Inject ScoreDefinition definition;

    @Inject RiskPartition partition;

    @Inject ValidationSettings settings;

    void onStart(@Observes StartupEvent event) {
        verify();
    }

    /**
     * @throws com.ammann.riskscore.exception.ValidationException       if definition and schema disagree
     * @throws com.ammann.riskscore.exception.InvalidPartitionException if the partition does not tile the score range
     */
    void verify() {
        LOG.info("Scoring configuration check: validating score definition and risk partition...");

        definition.validateAgainst(schema);
        // the partition bean is built against the definition; re-check in case it was replaced
        RiskPartition.of(partition.categories(), definition.maxScore());

        StringBuilder categories = new StringBuilder();
        for (RiskCategory category : partition.categories()) {
            if (categories.length() > 0) categories.append(", ");
            categories.append(category.name()).append(' ').append(category.rangeLabel());
        }

        LOG.infof("Scoring configuration check: %s, max score %d, categories [%s], high risk from %d",
                definition, definition.maxScore(), categories, partition.decisionThreshold());
        LOG.infof("Validation grid: landmarks %s x horizons %s, %d bootstrap iterations (seed %d)",
                settings.landmarkDays(), settings.horizons(), settings.bootstrap().iterations(),
                settings.bootstrap().seed());
    }
}
