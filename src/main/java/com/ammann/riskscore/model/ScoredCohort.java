/* (C)2026 */
package com.ammann.riskscore.model;

import java.util.Arrays;
import java.util.List;

/**
 * Subjects of a cohort paired with their integer scores under one score definition.
 * Subjects that could not be scored are listed in {@link #exclusions()} and are not part
 * of {@link #subjects()}.
 */
public final class ScoredCohort
{
    private final List<Subject> subjects;
    private final int[] scores;
    private final int maxScore;
    private final List<SubjectExclusion> exclusions;

    public ScoredCohort(List<Subject> subjects, int[] scores, int maxScore, List<SubjectExclusion> exclusions)
    {
        if (subjects.size() != scores.length) {
            throw new IllegalArgumentException(String.format(
                    "Got %d subjects but %d scores", subjects.size(), scores.length));
        }
        this.subjects = List.copyOf(subjects);
        this.scores = scores.clone();
        this.maxScore = maxScore;
        this.exclusions = List.copyOf(exclusions);
    }

    public List<Subject> subjects()
    {
        return subjects;
    }

    public int size()
    {
        return subjects.size();
    }

    public int score(int index)
    {
        return scores[index];
    }

    public int[] scores()
    {
        return scores.clone();
    }

    public int maxScore()
    {
        return maxScore;
    }

    public List<SubjectExclusion> exclusions()
    {
        return exclusions;
    }

    public double[] times()
    {
        return subjects.stream().mapToDouble(Subject::timeToEvent).toArray();
    }

    public boolean[] events()
    {
        boolean[] events = new boolean[subjects.size()];
        for (int i = 0; i < events.length; i++) {
            events[i] = subjects.get(i).event();
        }
        return events;
    }

    @Override
    public String toString()
    {
        return String.format("ScoredCohort[%d scored, %d excluded, max=%d, scores=%s]",
                subjects.size(), exclusions.size(), maxScore, Arrays.toString(scores));
    }
}
