/* (C)2026 */
package com.ammann.riskscore.enumeration;

/**
 * Performance measures that can be bootstrap-validated for a (landmark, horizon) cell.
 */
public enum PerformanceMetric
{
    /** Time-dependent area under the ROC curve at the prediction horizon. */
    AUC(true),
    /** Harrell's concordance index over the landmark cohort. */
    C_INDEX(true),
    /** Brier score of category-based risk predictions at the horizon. */
    BRIER(false);

    private final boolean higherIsBetter;

    PerformanceMetric(boolean higherIsBetter) {
        this.higherIsBetter = higherIsBetter;
    }

    public boolean isHigherBetter() { return higherIsBetter; }
}
