/* (C)2026 */
package com.ammann.riskscore.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One operating point of a ROC curve: classify positive when {@code score >= threshold}.
 */
public record RocPointDTO(double threshold, double sensitivity, double specificity) {

    @JsonIgnore
    public double falsePositiveRate() {
        return 1.0 - specificity;
    }

    @JsonIgnore
    public double youdenIndex() {
        return sensitivity + specificity - 1.0;
    }
}
