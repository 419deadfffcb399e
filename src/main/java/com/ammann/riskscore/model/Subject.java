/* (C)2026 */
package com.ammann.riskscore.model;

import com.ammann.riskscore.exception.ValidationException;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * One cohort member: identifier, covariate values keyed by schema name, follow-up time and
 * event indicator. Boolean covariates are stored as 1.0 / 0.0; a missing covariate is
 * simply absent from the map.
 *
 * <p>Instances are immutable. Time-shifted copies for landmark cohorts are created with
 * {@link #shiftedBy(double, boolean)}.
 */
public final class Subject
{
    private final String id;
    private final Map<String, Double> covariates;
    private final double timeToEvent;
    private final boolean event;

    public Subject(String id, Map<String, Double> covariates, double timeToEvent, boolean event)
    {
        this.id = Objects.requireNonNull(id, "id");
        if (!(timeToEvent > 0.0) || Double.isInfinite(timeToEvent)) {
            throw ValidationException.invalidParameter("time_to_event", timeToEvent,
                    "a finite value > 0 for subject " + id);
        }
        covariates.forEach((name, value) -> {
            if (value == null || !Double.isFinite(value)) {
                throw ValidationException.invalidParameter(name, value, "a finite value for subject " + id);
            }
        });
        this.covariates = Map.copyOf(covariates);
        this.timeToEvent = timeToEvent;
        this.event = event;
    }

    public String id()
    {
        return id;
    }

    public double timeToEvent()
    {
        return timeToEvent;
    }

    public boolean event()
    {
        return event;
    }

    public Map<String, Double> covariates()
    {
        return covariates;
    }

    public boolean has(String covariate)
    {
        return covariates.containsKey(covariate);
    }

    public OptionalDouble value(String covariate)
    {
        Double value = covariates.get(covariate);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /**
     * Counts schema covariates this subject has no value for.
     */
    public int missingCount(CovariateSchema schema)
    {
        int missing = 0;
        for (String name : schema.names()) {
            if (!covariates.containsKey(name)) {
                missing++;
            }
        }
        return missing;
    }

    /**
     * Returns a copy whose time origin is moved forward by {@code offset} with the given
     * event indicator. The caller guarantees {@code timeToEvent > offset}.
     */
    public Subject shiftedBy(double offset, boolean shiftedEvent)
    {
        return new Subject(id, covariates, timeToEvent - offset, shiftedEvent);
    }

    @Override
    public String toString()
    {
        return String.format("Subject[%s, t=%.2f, event=%b, covariates=%s]",
                id, timeToEvent, event, covariates);
    }
}
