/* (C)2026 */
package com.ammann.riskscore.enumeration;

/**
 * Reason a bootstrap iteration was excluded from aggregation.
 */
public enum SkipReason
{
    /** Model derivation on the resample failed because an outcome class was empty. */
    INSUFFICIENT_DATA,
    /** The derived model could not be evaluated on the resample or the original cohort. */
    NON_EVALUABLE,
    /** A subject required for derivation lacked a covariate. */
    MISSING_COVARIATE
}
