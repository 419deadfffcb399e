/* (C)2026 */
package com.ammann.riskscore.model;

import com.ammann.riskscore.enumeration.ComponentType;
import com.ammann.riskscore.enumeration.CovariateType;
import com.ammann.riskscore.exception.ValidationException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered point table of a risk score.
 *
 * <p>The maximum achievable score is derived exactly once, in the constructor, from the
 * same components that are used to compute points. Every consumer that needs "out of N"
 * reads {@link #maxScore()} from the definition it scored with; there is no separate
 * literal. Re-deriving cut points keeps the weights, so the maximum is preserved.
 */
public final class ScoreDefinition
{
    private final List<ScoreComponent> components;
    private final int maxScore;

    public ScoreDefinition(List<ScoreComponent> components)
    {
        if (components == null || components.isEmpty()) {
            throw new IllegalArgumentException("Score definition needs at least one component");
        }
        Set<String> seen = new HashSet<>();
        int sum = 0;
        for (ScoreComponent component : components) {
            if (!seen.add(component.variable())) {
                throw new IllegalArgumentException("Duplicate score component: " + component.variable());
            }
            sum = Math.addExact(sum, component.points());
        }
        this.components = List.copyOf(components);
        this.maxScore = sum;
    }

    public List<ScoreComponent> components()
    {
        return components;
    }

    public int maxScore()
    {
        return maxScore;
    }

    public List<ScoreComponent> thresholdComponents()
    {
        return components.stream().filter(ScoreComponent::isThreshold).toList();
    }

    public Set<String> requiredCovariates()
    {
        Set<String> names = new LinkedHashSet<>();
        components.forEach(c -> names.add(c.variable()));
        return names;
    }

    /**
     * Returns a definition with the same weights and the given cut points replacing those of
     * matching threshold components. Components without an entry keep their cut point.
     */
    public ScoreDefinition withCutPoints(Map<String, Double> cutPoints)
    {
        List<ScoreComponent> updated = new ArrayList<>(components.size());
        for (ScoreComponent component : components) {
            Double cut = cutPoints.get(component.variable());
            updated.add(component.isThreshold() && cut != null ? component.withCutPoint(cut) : component);
        }
        return new ScoreDefinition(updated);
    }

    /**
     * Checks that the schema names exactly the covariates this definition references, with
     * matching types (numeric for thresholds, boolean for flags).
     *
     * @throws ValidationException on any mismatch
     */
    public void validateAgainst(CovariateSchema schema)
    {
        Set<String> required = requiredCovariates();
        if (!required.equals(schema.names())) {
            Set<String> unused = new LinkedHashSet<>(schema.names());
            unused.removeAll(required);
            Set<String> undeclared = new LinkedHashSet<>(required);
            undeclared.removeAll(schema.names());
            throw new ValidationException(String.format(
                    "Schema does not match score definition: undeclared covariates %s, unreferenced covariates %s",
                    undeclared, unused));
        }
        for (ScoreComponent component : components) {
            CovariateType type = schema.get(component.variable()).orElseThrow().type();
            CovariateType expected = component.type() == ComponentType.THRESHOLD
                    ? CovariateType.NUMERIC
                    : CovariateType.BOOLEAN;
            if (type != expected) {
                throw new ValidationException(String.format(
                        "Component %s of type %s requires a %s covariate, schema declares %s",
                        component.variable(), component.type(), expected, type));
            }
        }
    }

    @Override
    public String toString()
    {
        return "ScoreDefinition" + components.stream().map(c -> c.describe() + ":" + c.points()).toList()
                + " max=" + maxScore;
    }
}
