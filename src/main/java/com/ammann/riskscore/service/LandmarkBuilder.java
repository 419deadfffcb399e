/* (C)2026 */
package com.ammann.riskscore.service;

import com.ammann.riskscore.exception.ValidationException;
import com.ammann.riskscore.model.Cohort;
import com.ammann.riskscore.model.LandmarkCohort;
import com.ammann.riskscore.model.Subject;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Builds landmark cohorts to remove immortal-time bias.
 *
 * <p>Only subjects whose follow-up extends strictly beyond the landmark day are kept, so a
 * subject who died before the landmark can never appear as a survivor with a favorable
 * score. Follow-up time is re-expressed from the landmark and, when a horizon is given,
 * the event indicator only counts events up to the horizon.
 *
 * <p>Each call returns a fresh, independently owned cohort.
 */
@ApplicationScoped
public class LandmarkBuilder
{

    private static final Logger LOG = Logger.getLogger(LandmarkBuilder.class);

    /**
     * Builds the landmark cohort without restricting the event indicator to a horizon.
     */
    public LandmarkCohort build(Cohort cohort, double landmarkDay)
    {
        return build(cohort, landmarkDay, Double.POSITIVE_INFINITY);
    }

    /**
     * Builds the landmark cohort for one landmark day and prediction horizon.
     *
     * @param cohort      source cohort; left untouched
     * @param landmarkDay landmark τ, {@code >= 0}
     * @param horizon     horizon relative to the landmark, {@code > 0}; infinite for none
     * @return subjects with original time {@code > τ}, shifted by {@code -τ}, event set only
     *         when the original event happened within {@code (τ, τ + horizon]}
     */
    public LandmarkCohort build(Cohort cohort, double landmarkDay, double horizon)
    {
        if (Double.isNaN(landmarkDay) || Double.isInfinite(landmarkDay) || landmarkDay < 0.0) {
            throw ValidationException.invalidParameter("landmarkDay", landmarkDay, "a finite value >= 0");
        }
        if (Double.isNaN(horizon) || horizon <= 0.0) {
            throw ValidationException.invalidParameter("horizon", horizon, "a value > 0");
        }

        List<Subject> retained = new ArrayList<>(cohort.size());
        int excluded = 0;

        for (Subject subject : cohort.subjects()) {
            if (subject.timeToEvent() <= landmarkDay) {
                excluded++;
                continue;
            }
            double shiftedTime = subject.timeToEvent() - landmarkDay;
            boolean shiftedEvent = subject.event() && shiftedTime <= horizon;
            retained.add(subject.shiftedBy(landmarkDay, shiftedEvent));
        }

        LandmarkCohort landmark = new LandmarkCohort(
                landmarkDay, horizon, new Cohort(cohort.schema(), retained), excluded);

        LOG.debugf("Landmark day %.1f (horizon %.1f): %d at risk, %d excluded, %d events",
                landmarkDay, horizon, landmark.size(), excluded, landmark.cohort().eventCount());

        return landmark;
    }

    /**
     * Builds one independent landmark cohort per landmark day, in iteration order.
     */
    public Map<Double, LandmarkCohort> buildAll(Cohort cohort, Collection<Double> landmarkDays, double horizon)
    {
        Map<Double, LandmarkCohort> result = new LinkedHashMap<>();
        for (Double day : landmarkDays) {
            result.put(day, build(cohort, day, horizon));
        }
        return result;
    }
}
