/* (C)2026 */
package com.ammann.riskscore.exception;

/**
 * Configuration defect: the risk category partition does not tile
 * {@code [0, maxScore]} exactly. Never corrected silently.
 */
public class InvalidPartitionException extends RiskScoreException
{
    public InvalidPartitionException(String message)
    {
        super(message);
    }
}
