/* (C)2026 */
package com.ammann.riskscore.model;

import com.ammann.riskscore.exception.InvalidPartitionException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered partition of {@code [0, maxScore]} into named risk categories.
 *
 * <p>Construction fails unless the categories tile the scale exactly: ascending, no gaps,
 * no overlaps, first category starting at 0 and last ending at {@code maxScore}. The
 * lower bound of the highest category is the decision threshold used by every report
 * that mentions a "high-risk" cut.
 */
public final class RiskPartition
{
    private final List<RiskCategory> categories;
    private final int maxScore;

    private RiskPartition(List<RiskCategory> categories, int maxScore)
    {
        this.categories = List.copyOf(categories);
        this.maxScore = maxScore;
    }

    /**
     * Validates and creates a partition.
     *
     * @param categories categories in ascending score order
     * @param maxScore   maximum score of the definition the partition belongs to
     * @throws InvalidPartitionException if the categories do not tile {@code [0, maxScore]}
     */
    public static RiskPartition of(List<RiskCategory> categories, int maxScore)
    {
        if (categories == null || categories.isEmpty()) {
            throw new InvalidPartitionException("Risk partition must contain at least one category");
        }
        Set<String> names = new HashSet<>();
        int expectedLower = 0;
        for (RiskCategory category : categories) {
            if (!names.add(category.name())) {
                throw new InvalidPartitionException("Duplicate risk category name: " + category.name());
            }
            if (category.lowerBound() > category.upperBound()) {
                throw new InvalidPartitionException(String.format(
                        "Risk category %s has lower bound %d above upper bound %d",
                        category.name(), category.lowerBound(), category.upperBound()));
            }
            if (category.lowerBound() != expectedLower) {
                String problem = category.lowerBound() > expectedLower ? "gap" : "overlap";
                throw new InvalidPartitionException(String.format(
                        "Risk partition has a %s before category %s: expected lower bound %d, got %d",
                        problem, category.name(), expectedLower, category.lowerBound()));
            }
            expectedLower = category.upperBound() + 1;
        }
        int lastUpper = expectedLower - 1;
        if (lastUpper != maxScore) {
            throw new InvalidPartitionException(String.format(
                    "Risk partition ends at %d but the score definition has maximum %d",
                    lastUpper, maxScore));
        }
        return new RiskPartition(categories, maxScore);
    }

    public List<RiskCategory> categories()
    {
        return categories;
    }

    public int maxScore()
    {
        return maxScore;
    }

    /**
     * Returns the unique category containing the score.
     *
     * @throws IllegalArgumentException if the score lies outside {@code [0, maxScore]}
     */
    public RiskCategory categoryOf(int score)
    {
        for (RiskCategory category : categories) {
            if (category.contains(score)) {
                return category;
            }
        }
        throw new IllegalArgumentException(
                String.format("Score %d outside [0, %d]", score, maxScore));
    }

    public int indexOf(int score)
    {
        return categories.indexOf(categoryOf(score));
    }

    /**
     * Lower bound of the highest category: subjects scoring at least this value are
     * reported as high risk.
     */
    public int decisionThreshold()
    {
        return categories.get(categories.size() - 1).lowerBound();
    }

    @Override
    public String toString()
    {
        return "RiskPartition" + categories.stream().map(c -> c.name() + ":" + c.rangeLabel()).toList();
    }
}
