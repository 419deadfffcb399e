/* (C)2026 */
package com.ammann.riskscore.exception;

/**
 * Base unchecked exception for all errors raised by the risk score validation engine.
 *
 * <p>Subclasses represent the error categories of the engine: insufficient outcome data,
 * missing covariates, unstable bootstrap runs, invalid risk partitions and malformed
 * input or configuration.
 */
public class RiskScoreException extends RuntimeException
{
    public RiskScoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public RiskScoreException(String message) {
        super(message);
    }
}
