/* (C)2026 */
package com.ammann.riskscore.dto;

/**
 * Net benefit of the score rule and the reference strategies at one threshold probability.
 */
public record NetBenefitPointDTO(
        double thresholdProbability,
        double modelNetBenefit,
        double treatAllNetBenefit,
        double treatNoneNetBenefit
) {
}
