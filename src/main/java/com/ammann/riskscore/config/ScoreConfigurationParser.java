/* (C)2026 */
package com.ammann.riskscore.config;

import com.ammann.riskscore.enumeration.CovariateType;
import com.ammann.riskscore.enumeration.Direction;
import com.ammann.riskscore.enumeration.PerformanceMetric;
import com.ammann.riskscore.exception.ValidationException;
import com.ammann.riskscore.model.CovariateDefinition;
import com.ammann.riskscore.model.CovariateSchema;
import com.ammann.riskscore.model.RiskCategory;
import com.ammann.riskscore.model.ScoreComponent;
import com.ammann.riskscore.model.ScoreDefinition;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses the compact notation used for score configuration entries.
 *
 * <ul>
 *   <li>covariate: {@code MELD:NUMERIC:6:40} or {@code HCC:BOOLEAN}</li>
 *   <li>threshold component: {@code MELD:>:20:2} (variable, direction, cut point, points)</li>
 *   <li>flag component: {@code HCC:FLAG:1}</li>
 *   <li>risk category: {@code LOW:0-1}</li>
 * </ul>
 */
public final class ScoreConfigurationParser {

    private ScoreConfigurationParser() {
    }

    public static CovariateSchema parseSchema(List<String> entries) {
        List<CovariateDefinition> definitions = new ArrayList<>(entries.size());
        for (String entry : entries) {
            definitions.add(parseCovariate(entry));
        }
        try {
            return new CovariateSchema(definitions);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid covariate schema: " + e.getMessage(), e);
        }
    }

    public static CovariateDefinition parseCovariate(String entry) {
        String[] parts = split(entry, "risk-score.covariates");
        CovariateType type = parseEnum(CovariateType.class, parts.length > 1 ? parts[1] : null,
                "risk-score.covariates", entry);

        if (type == CovariateType.BOOLEAN) {
            if (parts.length != 2) {
                throw ValidationException.invalidParameter("risk-score.covariates", entry, "NAME:BOOLEAN");
            }
            return CovariateDefinition.flag(parts[0]);
        }
        if (parts.length == 2) {
            return new CovariateDefinition(parts[0], CovariateType.NUMERIC, null, null);
        }
        if (parts.length != 4) {
            throw ValidationException.invalidParameter("risk-score.covariates", entry, "NAME:NUMERIC:MIN:MAX");
        }
        try {
            return CovariateDefinition.numeric(parts[0],
                    parseDouble(parts[2], "risk-score.covariates", entry),
                    parseDouble(parts[3], "risk-score.covariates", entry));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid covariate " + entry + ": " + e.getMessage(), e);
        }
    }

    public static ScoreDefinition parseDefinition(List<String> entries) {
        List<ScoreComponent> components = new ArrayList<>(entries.size());
        for (String entry : entries) {
            components.add(parseComponent(entry));
        }
        try {
            return new ScoreDefinition(components);
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new ValidationException("Invalid score definition: " + e.getMessage(), e);
        }
    }

    public static ScoreComponent parseComponent(String entry) {
        String[] parts = split(entry, "risk-score.components");
        try {
            if (parts.length == 3 && "FLAG".equalsIgnoreCase(parts[1])) {
                return ScoreComponent.flag(parts[0], parseInt(parts[2], "risk-score.components", entry));
            }
            if (parts.length == 4) {
                return ScoreComponent.threshold(parts[0],
                        Direction.fromSymbol(parts[1]),
                        parseDouble(parts[2], "risk-score.components", entry),
                        parseInt(parts[3], "risk-score.components", entry));
            }
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid score component " + entry + ": " + e.getMessage(), e);
        }
        throw ValidationException.invalidParameter("risk-score.components", entry,
                "VARIABLE:>|<:CUT:POINTS or VARIABLE:FLAG:POINTS");
    }

    public static List<RiskCategory> parseCategories(List<String> entries) {
        List<RiskCategory> categories = new ArrayList<>(entries.size());
        for (String entry : entries) {
            String[] parts = split(entry, "risk-score.risk-categories");
            String[] bounds = parts.length == 2 ? parts[1].split("-", -1) : new String[0];
            if (bounds.length != 2) {
                throw ValidationException.invalidParameter("risk-score.risk-categories", entry, "NAME:LOWER-UPPER");
            }
            try {
                categories.add(new RiskCategory(parts[0],
                        parseInt(bounds[0], "risk-score.risk-categories", entry),
                        parseInt(bounds[1], "risk-score.risk-categories", entry)));
            } catch (IllegalArgumentException e) {
                throw new ValidationException("Invalid risk category " + entry + ": " + e.getMessage(), e);
            }
        }
        return categories;
    }

    public static List<PerformanceMetric> parseMetrics(List<String> entries) {
        List<PerformanceMetric> metrics = new ArrayList<>(entries.size());
        for (String entry : entries) {
            PerformanceMetric metric = parseEnum(PerformanceMetric.class, entry, "validation.bootstrap.metrics", entry);
            if (!metrics.contains(metric)) {
                metrics.add(metric);
            }
        }
        return metrics;
    }

    private static String[] split(String entry, String key) {
        if (entry == null || entry.isBlank()) {
            throw ValidationException.invalidParameter(key, entry, "a non-empty entry");
        }
        String[] parts = entry.trim().split(":", -1);
        for (int i = 0; i < parts.length; i++) {
            parts[i] = parts[i].trim();
        }
        if (parts[0].isEmpty()) {
            throw ValidationException.invalidParameter(key, entry, "a name before the first ':'");
        }
        return parts;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String text, String key, String entry) {
        if (text == null) {
            throw ValidationException.invalidParameter(key, entry, "one of " + List.of(type.getEnumConstants()));
        }
        try {
            return Enum.valueOf(type, text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidParameter(key, entry, "one of " + List.of(type.getEnumConstants()));
        }
    }

    private static double parseDouble(String text, String key, String entry) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new ValidationException(String.format("Invalid number '%s' in %s entry '%s'", text, key, entry), e);
        }
    }

    private static int parseInt(String text, String key, String entry) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(String.format("Invalid integer '%s' in %s entry '%s'", text, key, entry), e);
        }
    }
}
