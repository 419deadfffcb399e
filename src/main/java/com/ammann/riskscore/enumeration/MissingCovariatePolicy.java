/* (C)2026 */
package com.ammann.riskscore.enumeration;

/**
 * Policy applied when a subject lacks a covariate referenced by the score definition.
 */
public enum MissingCovariatePolicy
{
    /** Scoring the subject fails with a MissingCovariateException. */
    FAIL,
    /**
     * The missing component contributes zero points and a warning is recorded, as long as
     * the number of missing components stays within the configured maximum.
     */
    SCORE_ZERO
}
