/* (C)2026 */
package com.ammann.riskscore.model;

import java.util.Objects;

/**
 * Named, inclusive integer sub-range of the score scale.
 */
public record RiskCategory(String name, int lowerBound, int upperBound)
{
    public RiskCategory
    {
        Objects.requireNonNull(name, "name");
    }

    public boolean contains(int score)
    {
        return score >= lowerBound && score <= upperBound;
    }

    public String rangeLabel()
    {
        return lowerBound == upperBound ? Integer.toString(lowerBound) : lowerBound + "-" + upperBound;
    }
}
