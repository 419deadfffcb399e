/* (C)2026 */
package com.ammann.riskscore.exception;

/**
 * Raised when a calculation needs both outcome classes (or a minimum number of
 * comparable observations) and the input does not provide them.
 *
 * <p>Fatal to the sub-calculation only. Callers report the result as non-evaluable
 * instead of substituting a default value.
 */
public class InsufficientDataException extends RiskScoreException
{
    private final int cases;
    private final int controls;

    public InsufficientDataException(String message, int cases, int controls)
    {
        super(message);
        this.cases = cases;
        this.controls = controls;
    }

    /**
     * Creates the exception for an empty outcome class.
     */
    public static InsufficientDataException emptyOutcomeClass(String calculation, int cases, int controls)
    {
        return new InsufficientDataException(
                String.format("%s requires both outcome classes: got %d cases and %d controls",
                        calculation, cases, controls),
                cases, controls);
    }

    public int getCases()
    {
        return cases;
    }

    public int getControls()
    {
        return controls;
    }
}
