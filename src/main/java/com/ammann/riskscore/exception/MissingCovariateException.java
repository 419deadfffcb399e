/* (C)2026 */
package com.ammann.riskscore.exception;

import java.util.List;

/**
 * Raised when a subject lacks a covariate required by the score definition and the
 * configured missing-value policy does not allow scoring it anyway.
 *
 * <p>Fatal for the affected subject only; cohort level callers exclude the subject and
 * log the reason.
 */
public class MissingCovariateException extends RiskScoreException
{
    private final String subjectId;
    private final List<String> missingCovariates;

    public MissingCovariateException(String subjectId, List<String> missingCovariates)
    {
        super(String.format("Subject '%s' is missing required covariates %s",
                subjectId, missingCovariates));
        this.subjectId = subjectId;
        this.missingCovariates = List.copyOf(missingCovariates);
    }

    public String getSubjectId()
    {
        return subjectId;
    }

    public List<String> getMissingCovariates()
    {
        return missingCovariates;
    }
}
