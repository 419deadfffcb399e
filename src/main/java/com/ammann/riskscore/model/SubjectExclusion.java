/* (C)2026 */
package com.ammann.riskscore.model;

/**
 * A subject left out of a cohort or a scored cohort, with the reason it was dropped.
 */
public record SubjectExclusion(String subjectId, String reason)
{
}
