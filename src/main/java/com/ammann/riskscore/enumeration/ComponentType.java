/* (C)2026 */
package com.ammann.riskscore.enumeration;

/**
 * Kind of predicate a score component evaluates.
 */
public enum ComponentType
{
    /** Continuous covariate compared against a (derived or configured) cut point. */
    THRESHOLD,
    /** Boolean covariate; points are awarded when the flag is present. */
    FLAG
}
