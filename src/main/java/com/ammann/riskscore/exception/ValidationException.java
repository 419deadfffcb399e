/* (C)2026 */
package com.ammann.riskscore.exception;

/**
 * Exception indicating that cohort input or a configuration value does not meet the
 * constraints required by the engine (unknown columns, duplicate subject ids,
 * unparsable configuration entries).
 *
 * <p>Provides factory methods for common validation failure patterns.
 */
public class ValidationException extends RiskScoreException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for an unknown column in a cohort row.
     */
    public static ValidationException unknownColumn(String column, Object subjectId) {
        return new ValidationException(
                String.format("Unknown column '%s' in row for subject '%s'", column, subjectId));
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }
}
