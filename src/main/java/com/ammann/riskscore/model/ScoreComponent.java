/* (C)2026 */
package com.ammann.riskscore.model;

import com.ammann.riskscore.enumeration.ComponentType;
import com.ammann.riskscore.enumeration.Direction;
import java.util.Objects;

/**
 * One line of a point-based score: a predicate over a single covariate and the points it
 * contributes when satisfied.
 *
 * @param variable  covariate name as declared in the schema
 * @param type      threshold predicate or boolean flag
 * @param direction comparison direction; {@code null} for flags
 * @param cutPoint  cut point of a threshold component; {@code null} for flags
 * @param points    points awarded when the predicate holds, strictly positive
 */
public record ScoreComponent(String variable, ComponentType type, Direction direction, Double cutPoint, int points)
{
    public ScoreComponent
    {
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(type, "type");
        if (points <= 0) {
            throw new IllegalArgumentException(
                    String.format("Component %s must award positive points, got %d", variable, points));
        }
        if (type == ComponentType.THRESHOLD) {
            if (direction == null || cutPoint == null || !Double.isFinite(cutPoint)) {
                throw new IllegalArgumentException(
                        "Threshold component " + variable + " needs a direction and a finite cut point");
            }
        } else {
            direction = null;
            cutPoint = null;
        }
    }

    public static ScoreComponent threshold(String variable, Direction direction, double cutPoint, int points)
    {
        return new ScoreComponent(variable, ComponentType.THRESHOLD, direction, cutPoint, points);
    }

    public static ScoreComponent flag(String variable, int points)
    {
        return new ScoreComponent(variable, ComponentType.FLAG, null, null, points);
    }

    public boolean isThreshold()
    {
        return type == ComponentType.THRESHOLD;
    }

    /**
     * Evaluates the predicate. Flags are satisfied by any non-zero value.
     */
    public boolean isSatisfiedBy(double value)
    {
        if (type == ComponentType.FLAG) {
            return value != 0.0;
        }
        return direction.isPositive(value, cutPoint);
    }

    public ScoreComponent withCutPoint(double newCutPoint)
    {
        if (type != ComponentType.THRESHOLD) {
            throw new IllegalStateException("Flag component " + variable + " has no cut point");
        }
        return new ScoreComponent(variable, type, direction, newCutPoint, points);
    }

    /**
     * Human readable predicate, for example {@code MELD > 20.0}.
     */
    public String describe()
    {
        return type == ComponentType.FLAG
                ? variable
                : String.format("%s %s %s", variable, direction.getSymbol(), cutPoint);
    }
}
