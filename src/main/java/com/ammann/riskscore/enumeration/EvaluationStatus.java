/* (C)2026 */
package com.ammann.riskscore.enumeration;

/**
 * Outcome of evaluating one (landmark, horizon) cell.
 */
public enum EvaluationStatus
{
    EVALUATED,
    /** Too few cases or controls; no performance figures are reported. */
    NON_EVALUABLE
}
