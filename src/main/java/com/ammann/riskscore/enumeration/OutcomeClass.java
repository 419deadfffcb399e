/* (C)2026 */
package com.ammann.riskscore.enumeration;

import com.ammann.riskscore.model.Subject;

/**
 * Status of a subject at a prediction horizon.
 *
 * <p>A case had the event within the horizon, a control was still under follow-up after
 * it. A subject censored before the horizon without an event is neither. With an infinite
 * horizon every subject is a case or a control according to its event indicator.
 */
public enum OutcomeClass
{
    CASE,
    CONTROL,
    CENSORED;

    public static OutcomeClass at(Subject subject, double horizon)
    {
        if (Double.isInfinite(horizon)) {
            return subject.event() ? CASE : CONTROL;
        }
        if (subject.event() && subject.timeToEvent() <= horizon) {
            return CASE;
        }
        if (subject.timeToEvent() > horizon) {
            return CONTROL;
        }
        return CENSORED;
    }

    public boolean isEvaluable()
    {
        return this != CENSORED;
    }
}
