/* (C)2026 */
package com.ammann.riskscore.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Ordered, immutable collection of subjects sharing one covariate schema.
 *
 * <p>Bootstrap resamples are new cohorts drawn with replacement; they may contain the same
 * subject more than once and never modify the cohort they were drawn from.
 */
public final class Cohort
{
    private final CovariateSchema schema;
    private final List<Subject> subjects;

    public Cohort(CovariateSchema schema, List<Subject> subjects)
    {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.subjects = List.copyOf(subjects);
    }

    public CovariateSchema schema()
    {
        return schema;
    }

    public List<Subject> subjects()
    {
        return subjects;
    }

    public Subject get(int index)
    {
        return subjects.get(index);
    }

    public int size()
    {
        return subjects.size();
    }

    public boolean isEmpty()
    {
        return subjects.isEmpty();
    }

    public long eventCount()
    {
        return subjects.stream().filter(Subject::event).count();
    }

    /**
     * Draws a bootstrap sample of the same size with replacement.
     *
     * @param random iteration-local generator; not shared between threads
     */
    public Cohort resample(SplittableRandom random)
    {
        int n = subjects.size();
        List<Subject> sample = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            sample.add(subjects.get(random.nextInt(n)));
        }
        return new Cohort(schema, sample);
    }

    @Override
    public String toString()
    {
        return String.format("Cohort[%d subjects, %d events, schema=%s]",
                subjects.size(), eventCount(), schema.names());
    }
}
