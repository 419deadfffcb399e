/* (C)2026 */
package com.ammann.riskscore.enumeration;

/**
 * Value type of a covariate column in the cohort schema.
 */
public enum CovariateType
{
    /** Continuous or integer measurement (lab value, physiology score, age). */
    NUMERIC,
    /** Presence/absence indicator, stored internally as 1.0 / 0.0. */
    BOOLEAN
}
