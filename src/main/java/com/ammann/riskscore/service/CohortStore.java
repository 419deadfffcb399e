/* (C)2026 */
package com.ammann.riskscore.service;

import com.ammann.riskscore.enumeration.CovariateType;
import com.ammann.riskscore.exception.ValidationException;
import com.ammann.riskscore.model.Cohort;
import com.ammann.riskscore.model.CohortLoadResult;
import com.ammann.riskscore.model.CovariateDefinition;
import com.ammann.riskscore.model.CovariateSchema;
import com.ammann.riskscore.model.Subject;
import com.ammann.riskscore.model.SubjectExclusion;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Converts free-form tabular rows into a validated, immutable {@link Cohort} and keeps the
 * most recently loaded cohort.
 *
 * <p>Structural defects of the input (unknown column names, duplicate subject ids) are
 * fatal because they indicate a schema mismatch such as a renamed or misspelled covariate.
 * Defects of a single row (invalid time, implausible value, too many missing covariates)
 * exclude that subject with a logged reason.
 */
@ApplicationScoped
public class CohortStore {

    private static final Logger LOG = Logger.getLogger(CohortStore.class);

    public static final String ID_COLUMN = "id";
    public static final String TIME_COLUMN = "time_to_event";
    public static final String EVENT_COLUMN = "event";

    static final int DEFAULT_MAX_MISSING_COVARIATES = 2;

    private static final Set<String> RESERVED_COLUMNS = Set.of(ID_COLUMN, TIME_COLUMN, EVENT_COLUMN);

    /**
     * Maximum number of schema covariates a subject may lack before it is excluded.
     */
    @ConfigProperty(name = "risk-score.cohort.max-missing-covariates", defaultValue = "2")
    int maxMissingCovariates = DEFAULT_MAX_MISSING_COVARIATES;

    private final AtomicReference<Cohort> current = new AtomicReference<>();

    /**
     * Validates the rows against the schema and replaces the stored cohort.
     *
     * @param schema covariate schema every row must follow
     * @param rows   one map per subject with {@value #ID_COLUMN}, {@value #TIME_COLUMN},
     *               {@value #EVENT_COLUMN} and covariate columns
     * @return loaded cohort and per-subject exclusions
     * @throws ValidationException on unknown columns or duplicate subject ids
     */
    public CohortLoadResult load(CovariateSchema schema, List<Map<String, Object>> rows) {
        if (rows == null) {
            throw ValidationException.invalidParameter("rows", null, "non-null row list");
        }

        List<Subject> subjects = new ArrayList<>(rows.size());
        List<SubjectExclusion> exclusions = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = rows.get(i);
            Object rawId = row.get(ID_COLUMN);
            String id = rawId == null ? null : rawId.toString().trim();
            String label = (id == null || id.isEmpty()) ? "row-" + (i + 1) : id;

            for (String column : row.keySet()) {
                if (!RESERVED_COLUMNS.contains(column) && !schema.contains(column)) {
                    throw ValidationException.unknownColumn(column, label);
                }
            }

            if (id == null || id.isEmpty()) {
                exclude(exclusions, label, "missing subject id");
                continue;
            }
            if (!seenIds.add(id)) {
                throw new ValidationException("Duplicate subject id: " + id);
            }

            Optional<String> problem = parseSubject(schema, id, row, subjects);
            problem.ifPresent(reason -> exclude(exclusions, id, reason));
        }

        Cohort cohort = new Cohort(schema, subjects);
        current.set(cohort);

        if (exclusions.isEmpty()) {
            LOG.infof("Loaded cohort: %d subjects, %d events", cohort.size(), cohort.eventCount());
        } else {
            LOG.warnf("Loaded cohort: %d subjects, %d events, %d rows excluded",
                    cohort.size(), cohort.eventCount(), exclusions.size());
        }

        return new CohortLoadResult(cohort, exclusions);
    }

    /**
     * Returns the most recently loaded cohort, if any.
     */
    public Optional<Cohort> current() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Parses one row and appends the subject on success.
     *
     * @return the exclusion reason, or empty if the subject was accepted
     */
    private Optional<String> parseSubject(CovariateSchema schema,
                                          String id,
                                          Map<String, Object> row,
                                          List<Subject> subjects) {
        Double time = parseNumber(row.get(TIME_COLUMN));
        if (time == null || !Double.isFinite(time) || time <= 0.0) {
            return Optional.of(String.format("invalid %s '%s' (must be > 0)", TIME_COLUMN, row.get(TIME_COLUMN)));
        }

        Boolean event = parseFlag(row.get(EVENT_COLUMN));
        if (event == null) {
            return Optional.of(String.format("invalid %s '%s'", EVENT_COLUMN, row.get(EVENT_COLUMN)));
        }

        Map<String, Double> covariates = new HashMap<>();
        List<String> missing = new ArrayList<>();

        for (CovariateDefinition definition : schema.definitions()) {
            Object raw = row.get(definition.name());
            if (raw == null || (raw instanceof String s && s.isBlank())) {
                missing.add(definition.name());
                continue;
            }

            Double value = definition.type() == CovariateType.BOOLEAN ? flagValue(raw) : parseNumber(raw);
            if (value == null) {
                return Optional.of(String.format("%s value '%s' is not a valid %s",
                        definition.name(), raw, definition.type().name().toLowerCase(Locale.ROOT)));
            }
            if (!definition.isInRange(value)) {
                return Optional.of(String.format("%s value %s outside plausible range [%s, %s]",
                        definition.name(), value, definition.min(), definition.max()));
            }
            covariates.put(definition.name(), value);
        }

        if (missing.size() > maxMissingCovariates) {
            return Optional.of(String.format("%d covariates missing %s (maximum %d)",
                    missing.size(), missing, maxMissingCovariates));
        }
        if (!missing.isEmpty()) {
            LOG.debugf("Subject %s accepted with missing covariates %s", id, missing);
        }

        subjects.add(new Subject(id, covariates, time, event));
        return Optional.empty();
    }

    private void exclude(List<SubjectExclusion> exclusions, String subjectId, String reason) {
        LOG.warnf("Excluding subject %s: %s", subjectId, reason);
        exclusions.add(new SubjectExclusion(subjectId, reason));
    }

    private static Double flagValue(Object raw) {
        Boolean flag = parseFlag(raw);
        return flag == null ? null : (flag ? 1.0 : 0.0);
    }

    /** Accepts Boolean, numeric 0/1, and true/false/yes/no/1/0 strings. */
    static Boolean parseFlag(Object raw) {
        if (raw instanceof Boolean b) {
            return b;
        }
        if (raw instanceof Number n) {
            double v = n.doubleValue();
            if (v == 1.0) return Boolean.TRUE;
            if (v == 0.0) return Boolean.FALSE;
            return null;
        }
        if (raw instanceof String s) {
            switch (s.trim().toLowerCase(Locale.ROOT)) {
                case "true", "yes", "y", "1":
                    return Boolean.TRUE;
                case "false", "no", "n", "0":
                    return Boolean.FALSE;
                default:
                    return null;
            }
        }
        return null;
    }

    static Double parseNumber(Object raw) {
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        if (raw instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                LOG.debugf("Unparsable numeric value '%s'", s);
                return null;
            }
        }
        return null;
    }
}
