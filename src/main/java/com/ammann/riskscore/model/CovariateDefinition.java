/* (C)2026 */
package com.ammann.riskscore.model;

import com.ammann.riskscore.enumeration.CovariateType;
import java.util.Objects;

/**
 * Declares one covariate column of the cohort schema together with its plausible value
 * range. Range bounds are inclusive and only apply to numeric covariates; a {@code null}
 * bound is unbounded.
 */
public record CovariateDefinition(String name, CovariateType type, Double min, Double max)
{
    public CovariateDefinition
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException(
                    String.format("Covariate %s has min %.3f above max %.3f", name, min, max));
        }
    }

    public static CovariateDefinition numeric(String name, double min, double max)
    {
        return new CovariateDefinition(name, CovariateType.NUMERIC, min, max);
    }

    public static CovariateDefinition flag(String name)
    {
        return new CovariateDefinition(name, CovariateType.BOOLEAN, null, null);
    }

    /**
     * Returns {@code true} if the value is finite and within the declared bounds.
     */
    public boolean isInRange(double value)
    {
        if (!Double.isFinite(value)) {
            return false;
        }
        if (type == CovariateType.BOOLEAN) {
            return value == 0.0 || value == 1.0;
        }
        return (min == null || value >= min) && (max == null || value <= max);
    }
}
