/* (C)2026 */
package com.ammann.riskscore.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, immutable set of covariate definitions shared by every subject of a cohort.
 * Rows are validated against the schema once at load time, so downstream code can rely
 * on covariate names being exactly the declared ones.
 */
public final class CovariateSchema
{
    private final Map<String, CovariateDefinition> definitions;

    public CovariateSchema(Collection<CovariateDefinition> definitions)
    {
        Map<String, CovariateDefinition> byName = new LinkedHashMap<>();
        for (CovariateDefinition definition : definitions) {
            if (byName.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalArgumentException("Duplicate covariate in schema: " + definition.name());
            }
        }
        if (byName.isEmpty()) {
            throw new IllegalArgumentException("Covariate schema must declare at least one covariate");
        }
        this.definitions = Collections.unmodifiableMap(byName);
    }

    public static CovariateSchema of(CovariateDefinition... definitions)
    {
        return new CovariateSchema(List.of(definitions));
    }

    public boolean contains(String name)
    {
        return definitions.containsKey(name);
    }

    public Optional<CovariateDefinition> get(String name)
    {
        return Optional.ofNullable(definitions.get(name));
    }

    public Set<String> names()
    {
        return definitions.keySet();
    }

    public Collection<CovariateDefinition> definitions()
    {
        return definitions.values();
    }

    public int size()
    {
        return definitions.size();
    }

    @Override
    public String toString()
    {
        return "CovariateSchema" + definitions.keySet();
    }
}
